package dev.jobhunter.settings;

import dev.jobhunter.error.AnalysisException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates and normalizes preferences on their way to the {@link PreferenceSource}.
 * Reads always go to the source, so every call sees the latest saved snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreferenceService {

    private final PreferenceSource preferenceSource;

    public Preferences current() {
        return preferenceSource.load();
    }

    /**
     * Validate, normalize and persist preferences.
     *
     * @return The normalized preferences as stored
     * @throws AnalysisException ValidationFailed when an invariant is violated
     */
    public Preferences update(Preferences preferences) {
        Preferences normalized = normalize(preferences);
        Preferences saved = preferenceSource.save(normalized);
        log.info("Preferences updated: {} titles, {} locations, {} keywords, remote only: {}",
                saved.preferredTitles().size(), saved.locations().size(), saved.keywords().size(),
                saved.remoteOnly());
        return saved;
    }

    /**
     * Trim every entry, drop blanks and duplicates, and check the salary range.
     */
    public Preferences normalize(Preferences preferences) {
        if (preferences == null) {
            throw AnalysisException.validation("settings payload is required");
        }
        Long min = preferences.salaryMin();
        Long max = preferences.salaryMax();
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw AnalysisException.validation("salary bounds must not be negative");
        }
        if (min != null && max != null && min > max) {
            throw AnalysisException.validation(
                    String.format("salaryMin (%d) must not exceed salaryMax (%d)", min, max));
        }

        return new Preferences(
                distinct(preferences.preferredTitles(), false),
                distinct(preferences.locations(), false),
                distinct(preferences.keywords(), false),
                preferences.remoteOnly(),
                min,
                max,
                distinct(preferences.companyBlacklist(), true));
    }

    private static List<String> distinct(List<String> values, boolean ignoreCase) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String value : values) {
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String key = ignoreCase ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
            if (seen.add(key)) {
                result.add(trimmed);
            }
        }
        return List.copyOf(result);
    }
}
