package com.gateflow.core.page;

import com.gateflow.core.GateflowProperties;
import com.gateflow.core.model.PageContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches pages with the JDK {@link HttpClient} and parses them with jsoup.
 */
@Service
public class HttpPageContentFetcher implements PageContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpPageContentFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpPageContentFetcher(GateflowProperties properties) {
        this.timeout = Duration.ofSeconds(properties.getPageTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public PageContent fetch(String url) {
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Accept", "text/html,application/xhtml+xml")
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warn("Page {} returned HTTP {}; continuing without page content", url, response.statusCode());
                return PageContent.unavailable(url);
            }
            PageContent content = PageContentParser.parse(url, response.body());
            log.info("Fetched page {} ({} input field(s), {} chars of text)", url,
                    content.inputFieldCount(), content.text().length());
            return content;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Page {} could not be fetched ({}); continuing without page content", url, e.getMessage());
            return PageContent.unavailable(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Page fetch of {} interrupted; continuing without page content", url);
            return PageContent.unavailable(url);
        }
    }
}
