package dev.jobhunter.worker;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls title, company and location out of a job listing page.
 */
public class ListingExtractor {

    static final int EXCERPT_LENGTH = 400;

    private static final Set<String> COMPANY_META_KEYS = Set.of("og:site_name", "application-name", "company");
    private static final List<String> TITLE_SEPARATORS = List.of(" - ", " | ", " @ ");
    private static final Pattern LOCATION_PATTERN = Pattern.compile("Location[:\\s]+([A-Za-z0-9 ,./-]{3,60})");

    /**
     * @param html         page HTML, possibly truncated
     * @param text         readable page text
     * @param defaultTitle document title reported by the fetch
     */
    public ExtractedListing extract(String html, String text, String defaultTitle) {
        Document document = Jsoup.parse(html != null ? html : "");
        String pageText = text != null ? text : "";

        String title = extractTitle(document, defaultTitle);
        String company = extractCompany(document);
        if (company == null && title != null) {
            company = companyFromTitle(title);
        }

        return new ExtractedListing(title, company, extractLocation(pageText), pageText, excerpt(pageText));
    }

    private String extractTitle(Document document, String defaultTitle) {
        Element h1 = document.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) {
            return h1.text();
        }
        return defaultTitle == null || defaultTitle.isBlank() ? null : defaultTitle;
    }

    private String extractCompany(Document document) {
        for (Element meta : document.select("meta")) {
            String key = meta.hasAttr("property") ? meta.attr("property") : meta.attr("name");
            if (COMPANY_META_KEYS.contains(key) && meta.hasAttr("content")) {
                return meta.attr("content");
            }
        }
        return null;
    }

    static String companyFromTitle(String title) {
        for (String separator : TITLE_SEPARATORS) {
            String[] parts = title.split(Pattern.quote(separator), -1);
            if (parts.length >= 2) {
                return parts[parts.length - 1].trim();
            }
        }
        return null;
    }

    static String extractLocation(String text) {
        Matcher matcher = LOCATION_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String location = matcher.group(1).trim();
        return location.isEmpty() ? null : location;
    }

    private static String excerpt(String text) {
        if (text.isEmpty()) {
            return null;
        }
        return text.length() > EXCERPT_LENGTH ? text.substring(0, EXCERPT_LENGTH) : text;
    }
}
