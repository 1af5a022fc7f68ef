package dev.jobhunter.worker;

import dev.jobhunter.settings.Preferences;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores an extracted listing against the user's preferences.
 */
@Slf4j
public class ListingScorer {

    static final double NO_KEYWORDS_BASE = 50.0;
    static final double TITLE_BONUS = 10.0;
    static final double LOCATION_BONUS = 6.0;
    static final double REMOTE_BONUS = 8.0;
    static final double BLACKLIST_PENALTY = -15.0;

    /**
     * Result of scoring a listing.
     *
     * @param score     final score in [0, 100]
     * @param summary   one-line human readable summary
     * @param breakdown contribution of each rule that fired
     */
    public record ScoringResult(double score, String summary, Map<String, Double> breakdown) {
    }

    public ScoringResult score(ExtractedListing listing, Preferences preferences) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        String text = listing.text() != null ? listing.text().toLowerCase(Locale.ROOT) : "";

        // 1. Keyword coverage
        List<String> keywords = preferences.keywords();
        double base;
        if (keywords.isEmpty()) {
            base = NO_KEYWORDS_BASE;
        } else {
            long hits = keywords.stream()
                    .filter(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)))
                    .count();
            base = (double) hits / keywords.size() * 100.0;
        }
        breakdown.put("keywords", base);
        double total = base;

        // 2. Preferred title
        if (containsAny(listing.title(), preferences.preferredTitles())) {
            breakdown.put("title", TITLE_BONUS);
            total += TITLE_BONUS;
        }

        // 3. Preferred location
        if (containsAny(listing.location(), preferences.locations())) {
            breakdown.put("location", LOCATION_BONUS);
            total += LOCATION_BONUS;
        }

        // 4. Remote
        if (preferences.remoteOnly() && text.contains("remote")) {
            breakdown.put("remote", REMOTE_BONUS);
            total += REMOTE_BONUS;
        }

        // 5. Blacklisted company
        if (preferences.isBlacklisted(listing.company())) {
            breakdown.put("company_blacklist", BLACKLIST_PENALTY);
            total += BLACKLIST_PENALTY;
        }

        double score = Math.max(0.0, Math.min(100.0, total));
        String summary = String.format(Locale.ROOT,
                "Matched %.0f%% of keywords. Remote preference: %s. Title signal: %s.",
                score,
                preferences.remoteOnly() ? "on" : "off",
                listing.title() != null ? listing.title() : "unknown");

        log.debug("Listing '{}' scored {} ({})", listing.title(), score, breakdown);
        return new ScoringResult(score, summary, breakdown);
    }

    private static boolean containsAny(String value, List<String> candidates) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .anyMatch(candidate -> !candidate.isEmpty() && lower.contains(candidate.toLowerCase(Locale.ROOT)));
    }
}
