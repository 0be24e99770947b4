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
 * Tavily search API (AI-optimised web search)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TavilySearchProvider implements SearchProvider {

    static final String NAME = "tavily";
    private static final String TAVILY_SEARCH_URL = "https://api.tavily.com/search";

    private final WebClient webClient;
    private final MonitorProperties properties;

    @Value("${monitor.retrieval.search.tavily.api-key:}")
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
        log.debug("Tavily search: query='{}', limit={}", query, limit);

        Map<String, Object> body = Map.of(
                "api_key", apiKey,
                "query", query,
                "max_results", limit,
                "search_depth", "basic"
        );

        JsonNode response = webClient.post()
                .uri(TAVILY_SEARCH_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getRetrieval().getSearch().getTimeout())
                .block();

        List<SearchResultItem> results = new ArrayList<>();
        if (response == null) {
            return results;
        }
        int position = 1;
        for (JsonNode item : response.path("results")) {
            if (results.size() >= limit) {
                break;
            }
            results.add(SearchResultItem.builder()
                    .title(item.path("title").asText(""))
                    .url(item.path("url").asText(""))
                    .snippet(item.path("content").asText(""))
                    .score(item.hasNonNull("score") ? item.get("score").asDouble() : null)
                    .publishedDate(item.hasNonNull("published_date") ? item.get("published_date").asText() : null)
                    .position(position++)
                    .build());
        }
        return results;
    }
}
