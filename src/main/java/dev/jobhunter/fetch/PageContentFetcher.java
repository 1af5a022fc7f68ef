package dev.jobhunter.fetch;

import dev.jobhunter.config.FetchConfig;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.model.PageContent;
import dev.jobhunter.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Fetches a listing page and reduces it to title, HTML and readable text.
 */
@Slf4j
@Component
public class PageContentFetcher {

    private final WebClient webClient;
    private final FetchConfig config;

    public PageContentFetcher(WebClient.Builder webClientBuilder, FetchConfig config) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(config.getTimeout())
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(config.getMaxInMemorySize()))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,*/*;q=0.8")
                .build();
        this.config = config;
    }

    /**
     * Fetch a page with the configured default maximum HTML length.
     */
    public Mono<PageContent> fetch(String url) {
        return fetch(url, null);
    }

    /**
     * Fetch a page.
     *
     * @param url       absolute http(s) URL
     * @param maxLength maximum HTML length in characters, null for the configured default
     * @return the page content; errors with FetchFailed on network failure, timeout or non-2xx status
     */
    public Mono<PageContent> fetch(String url, Integer maxLength) {
        String target;
        int limit;
        try {
            target = UrlUtils.requireHttpUrl(url, "url");
            limit = maxLength != null ? maxLength : config.getDefaultMaxLength();
            if (limit <= 0) {
                throw AnalysisException.validation("maxLength must be positive, got " + limit);
            }
        } catch (AnalysisException e) {
            return Mono.error(e);
        }

        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(target)
                .retrieve()
                .toEntity(String.class)
                .timeout(config.getTimeout())
                .map(response -> toPageContent(target, response, limit))
                .doOnNext(page -> log.debug("Fetched {} ({} chars HTML) in {}ms", target, page.html().length(),
                        System.currentTimeMillis() - start))
                .onErrorMap(e -> !(e instanceof AnalysisException), e -> fetchFailed(target, e));
    }

    private PageContent toPageContent(String url, ResponseEntity<String> response, int maxLength) {
        String html = response.getBody() != null ? response.getBody() : "";
        Document document = Jsoup.parse(html, url);
        String text = collapseWhitespace(document.text());
        return new PageContent(
                response.getStatusCode().value(),
                url,
                document.title(),
                truncate(html, maxLength),
                truncate(text, config.getTextExcerptLength()));
    }

    private AnalysisException fetchFailed(String url, Throwable e) {
        String reason;
        if (e instanceof WebClientResponseException responseException) {
            reason = "HTTP " + responseException.getStatusCode().value();
        } else if (e instanceof TimeoutException) {
            reason = "timed out after " + config.getTimeout().toSeconds() + "s";
        } else {
            reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        log.warn("Fetch of {} failed: {}", url, reason);
        return new AnalysisException(ErrorKind.FETCH_FAILED, "Failed to fetch " + url + ": " + reason, e);
    }

    static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
