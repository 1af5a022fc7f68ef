package dev.jobhunter.model;

/**
 * Result of fetching a listing page.
 *
 * @param status HTTP status code
 * @param url    the URL that was requested
 * @param title  document title, empty when the page has none
 * @param html   raw HTML, truncated to the requested maximum length
 * @param text   whitespace-collapsed visible text, truncated to the excerpt length
 */
public record PageContent(int status, String url, String title, String html, String text) {
}
