package com.tigerwatch.monitor.service.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.SearchResultItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google search through the Serper API.
 *
 * API 키 필요: https://serper.dev
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SerperSearchProvider implements SearchProvider {

    static final String NAME = "serper";
    private static final String SERPER_SEARCH_URL = "https://google.serper.dev/search";

    private final WebClient webClient;
    private final MonitorProperties properties;

    @Value("${monitor.retrieval.search.serper.api-key:}")
    private String apiKey;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<SearchResultItem> search(String query, int limit) {
        log.debug("Serper search: query='{}', limit={}", query, limit);

        JsonNode response = webClient.post()
                .uri(SERPER_SEARCH_URL)
                .header("X-API-KEY", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("q", query, "num", limit))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getRetrieval().getSearch().getTimeout())
                .block();

        return parseOrganic(response, limit);
    }

    private List<SearchResultItem> parseOrganic(JsonNode response, int limit) {
        List<SearchResultItem> results = new ArrayList<>();
        if (response == null || !response.path("organic").isArray()) {
            return results;
        }
        for (JsonNode item : response.path("organic")) {
            if (results.size() >= limit) {
                break;
            }
            String link = item.path("link").asText("");
            if (link.isBlank()) {
                continue;
            }
            results.add(SearchResultItem.builder()
                    .title(item.path("title").asText(""))
                    .url(link)
                    .snippet(item.path("snippet").asText(""))
                    .position(item.path("position").asInt(results.size() + 1))
                    .publishedDate(item.hasNonNull("date") ? item.get("date").asText() : null)
                    .build());
        }
        return results;
    }
}
