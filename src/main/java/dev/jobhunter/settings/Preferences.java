package dev.jobhunter.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Locale;

/**
 * Immutable snapshot of the user's job search preferences.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Preferences(
        List<String> preferredTitles,
        List<String> locations,
        List<String> keywords,
        boolean remoteOnly,
        Long salaryMin,
        Long salaryMax,
        List<String> companyBlacklist) {

    public Preferences {
        preferredTitles = copyOf(preferredTitles);
        locations = copyOf(locations);
        keywords = copyOf(keywords);
        companyBlacklist = copyOf(companyBlacklist);
    }

    /**
     * Preferences used until the user saves their own.
     */
    public static Preferences defaults() {
        return new Preferences(
                List.of("Software Engineer", "Full Stack Engineer", "Frontend Engineer", "Backend Engineer"),
                List.of("Remote", "United States"),
                List.of("TypeScript", "React", "Node.js", "Rust", "Tauri", "Next.js"),
                true,
                120_000L,
                200_000L,
                List.of());
    }

    public boolean isBlacklisted(String company) {
        if (company == null || company.isBlank()) {
            return false;
        }
        String lower = company.toLowerCase(Locale.ROOT);
        return companyBlacklist.stream()
                .anyMatch(name -> !name.isEmpty() && lower.contains(name.toLowerCase(Locale.ROOT)));
    }

    private static List<String> copyOf(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null).toList();
    }
}
