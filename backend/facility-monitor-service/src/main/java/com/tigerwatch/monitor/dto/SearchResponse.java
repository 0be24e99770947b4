package com.tigerwatch.monitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a gateway search. An empty result list is a normal outcome;
 * {@code error} is only set when the whole provider chain was exhausted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private String query;

    @Builder.Default
    private List<SearchResultItem> results = new ArrayList<>();

    private int count;

    /**
     * Provider that actually produced the results
     */
    private String provider;

    private String error;

    private boolean cached;

    public static SearchResponse of(String query, String provider, List<SearchResultItem> results) {
        return SearchResponse.builder()
                .query(query)
                .provider(provider)
                .results(new ArrayList<>(results))
                .count(results.size())
                .build();
    }

    public static SearchResponse empty(String query, String provider, String error) {
        return SearchResponse.builder()
                .query(query)
                .provider(provider)
                .count(0)
                .error(error)
                .build();
    }

    public boolean hasResults() {
        return results != null && !results.isEmpty();
    }
}
