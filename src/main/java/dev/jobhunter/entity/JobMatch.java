package dev.jobhunter.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A scored job listing accepted into the store.
 * Records are never updated in place; corrections are new records.
 */
@Getter
@ToString
@Entity
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Table(name = "job_matches", indexes = {
        @Index(name = "idx_created_at", columnList = "createdAt"),
        @Index(name = "idx_session_id", columnList = "sessionId")
})
public class JobMatch {

    @Id
    @Column(nullable = false, updatable = false, length = 36)
    private String id;

    @JsonProperty("session_id")
    @Column(updatable = false, length = 36)
    private String sessionId;

    @Column(nullable = false, updatable = false, length = 2048)
    private String url;

    @Column(updatable = false, length = 500)
    private String title;

    @Column(updatable = false, length = 500)
    private String company;

    @Column(updatable = false, length = 500)
    private String location;

    @JsonProperty("match_score")
    @Column(nullable = false, updatable = false)
    private double matchScore;

    @Column(nullable = false, updatable = false, length = 4000)
    private String summary;

    @JsonProperty("raw_excerpt")
    @Column(updatable = false, length = 4000)
    private String rawExcerpt;

    @JsonProperty("created_at")
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
