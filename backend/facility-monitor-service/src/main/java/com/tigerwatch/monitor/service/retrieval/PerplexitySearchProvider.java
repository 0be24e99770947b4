package com.tigerwatch.monitor.service.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.SearchResultItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LLM-backed search through Perplexity. The answer text is ignored;
 * only the returned citations become search results.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PerplexitySearchProvider implements SearchProvider {

    static final String NAME = "perplexity";
    private static final String PERPLEXITY_CHAT_URL = "https://api.perplexity.ai/chat/completions";

    private final WebClient webClient;
    private final MonitorProperties properties;

    @Value("${monitor.retrieval.search.perplexity.api-key:}")
    private String apiKey;

    @Value("${monitor.retrieval.search.perplexity.model:sonar}")
    private String model;

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
        log.debug("Perplexity search: query='{}', limit={}", query, limit);

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", query)),
                "max_tokens", 1000,
                "return_citations", true
        );

        JsonNode response = webClient.post()
                .uri(PERPLEXITY_CHAT_URL)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
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
        for (JsonNode citation : response.path("citations")) {
            if (results.size() >= limit) {
                break;
            }
            // citations come back either as plain URLs or as {title, url, text} objects
            SearchResultItem.SearchResultItemBuilder item = SearchResultItem.builder()
                    .position(results.size() + 1);
            if (citation.isTextual()) {
                item.url(citation.asText()).title("").snippet("");
            } else {
                item.url(citation.path("url").asText(""))
                        .title(citation.path("title").asText(""))
                        .snippet(citation.path("text").asText(""));
            }
            results.add(item.build());
        }
        return results;
    }
}
