package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.dto.SearchResponse;

import java.util.Optional;

/**
 * Best-effort search result cache. Implementations never throw.
 */
public interface SearchCache {

    Optional<SearchResponse> get(String key);

    void put(String key, SearchResponse response);
}
