package dev.jobhunter.service;

import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.model.JobMatchInput;
import dev.jobhunter.repository.JobMatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Durable store of accepted job matches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchStoreService {

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private final JobMatchRepository jobMatchRepository;
    private final Clock clock;

    /**
     * Validate and persist a new match. The id and creation timestamp are generated here.
     *
     * @param input The submitted match fields
     * @return The persisted match
     * @throws AnalysisException ValidationFailed for bad input, PersistFailed on storage errors
     */
    public JobMatch insert(JobMatchInput input) {
        validate(input);

        JobMatch match = JobMatch.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(blankToNull(input.getSessionId()))
                .url(input.getUrl().trim())
                .title(blankToNull(input.getTitle()))
                .company(blankToNull(input.getCompany()))
                .location(blankToNull(input.getLocation()))
                .matchScore(input.getMatchScore())
                .summary(input.getSummary() != null ? input.getSummary() : "")
                .rawExcerpt(blankToNull(input.getRawExcerpt()))
                .createdAt(clock.instant())
                .build();

        try {
            JobMatch saved = jobMatchRepository.save(match);
            log.info("Saved job match {} for {} (score: {})", saved.getId(), saved.getUrl(), saved.getMatchScore());
            return saved;
        } catch (DataAccessException e) {
            log.error("Failed to persist job match for {}: {}", match.getUrl(), e.getMessage(), e);
            throw new AnalysisException(ErrorKind.PERSIST_FAILED, "Could not persist job match: " + e.getMessage(), e);
        }
    }

    /**
     * List the most recent matches, newest first.
     *
     * @param limit Maximum number of matches, must be positive
     */
    public List<JobMatch> listRecent(int limit) {
        if (limit <= 0) {
            throw AnalysisException.validation("limit must be a positive integer, got " + limit);
        }
        try {
            return jobMatchRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new AnalysisException(ErrorKind.PERSIST_FAILED, "Could not list job matches: " + e.getMessage(), e);
        }
    }

    /**
     * Delete every stored match.
     *
     * @return Number of matches removed
     */
    public int clear() {
        try {
            int removed = jobMatchRepository.deleteAllMatches();
            log.info("Cleared {} job matches", removed);
            return removed;
        } catch (DataAccessException e) {
            throw new AnalysisException(ErrorKind.PERSIST_FAILED, "Could not clear job matches: " + e.getMessage(), e);
        }
    }

    public long count() {
        return jobMatchRepository.count();
    }

    private void validate(JobMatchInput input) {
        if (input == null) {
            throw AnalysisException.validation("job match payload is required");
        }
        if (input.getUrl() == null || input.getUrl().isBlank()) {
            throw AnalysisException.validation("url is required");
        }
        Double score = input.getMatchScore();
        if (score == null || score.isNaN() || score < MIN_SCORE || score > MAX_SCORE) {
            throw AnalysisException.validation("match_score must lie in [0, 100], got " + score);
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
