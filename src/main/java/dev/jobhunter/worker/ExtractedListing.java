package dev.jobhunter.worker;

/**
 * Listing fields recovered from a fetched page. Any field except {@code text} may be null.
 */
public record ExtractedListing(String title, String company, String location, String text, String rawExcerpt) {
}
