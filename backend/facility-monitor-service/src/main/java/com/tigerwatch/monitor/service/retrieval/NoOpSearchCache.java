package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.dto.SearchResponse;

import java.util.Optional;

/**
 * 캐시 비활성화 또는 Redis 연결 불가 시 사용
 */
public class NoOpSearchCache implements SearchCache {

    @Override
    public Optional<SearchResponse> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, SearchResponse response) {
        // nothing to store
    }
}
