package com.tigerwatch.monitor.service.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.ScrapeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Firecrawl-compatible scrape API client ({@code POST {base-url}/scrape}).
 * Returns markdown as {@code content} and the rendered page as {@code html}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FirecrawlScrapeBackend implements ScrapeBackend {

    private static final int EXTRACTED_PREVIEW_LENGTH = 1000;

    private final WebClient webClient;
    private final MonitorProperties properties;

    @Override
    public boolean isConfigured() {
        String apiKey = scrapeSettings().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ScrapeResult scrape(String url, boolean extractStructured) {
        MonitorProperties.Scrape settings = scrapeSettings();
        log.debug("Scraping url={}, extract={}", url, extractStructured);

        JsonNode response = webClient.post()
                .uri(settings.getBaseUrl() + "/scrape")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "url", url,
                        "formats", List.of("markdown", "html"),
                        "onlyMainContent", true))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(settings.getTimeout())
                .block();

        if (response == null) {
            return ScrapeResult.failed(url, "Empty scrape response");
        }
        if (response.has("success") && !response.path("success").asBoolean()) {
            return ScrapeResult.failed(url, response.path("error").asText("Scrape rejected"));
        }

        JsonNode data = response.has("data") ? response.get("data") : response;
        String markdown = data.path("markdown").asText("");
        String html = data.path("html").asText("");

        return ScrapeResult.builder()
                .url(url)
                .content(markdown)
                .html(html)
                .title(data.path("metadata").path("title").asText(""))
                .extracted(extractStructured && !markdown.isEmpty()
                        ? markdown.substring(0, Math.min(markdown.length(), EXTRACTED_PREVIEW_LENGTH))
                        : null)
                .build();
    }

    private MonitorProperties.Scrape scrapeSettings() {
        return properties.getRetrieval().getScrape();
    }
}
