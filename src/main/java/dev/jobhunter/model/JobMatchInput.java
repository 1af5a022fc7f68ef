package dev.jobhunter.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields of a job match as submitted by a worker (everything except the generated id and timestamp).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobMatchInput {

    @JsonProperty("session_id")
    @JsonAlias({"analysis_id", "sessionId"})
    private String sessionId;

    private String url;
    private String title;
    private String company;
    private String location;

    @JsonProperty("match_score")
    @JsonAlias("matchScore")
    private Double matchScore;

    private String summary;

    @JsonProperty("raw_excerpt")
    @JsonAlias("rawExcerpt")
    private String rawExcerpt;
}
