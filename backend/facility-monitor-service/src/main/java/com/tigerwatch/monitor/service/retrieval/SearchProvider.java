package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.dto.SearchResultItem;

import java.util.List;

/**
 * Web search capability behind the retrieval gateway.
 *
 * Implementations throw on transport or API failure; the gateway translates
 * every failure into a fall-through to the next provider.
 */
public interface SearchProvider {

    /**
     * Provider name used in configuration and in {@code SearchResponse.provider}
     */
    String getName();

    /**
     * 프로바이더 사용 가능 여부 (API 키 설정 여부)
     */
    boolean isAvailable();

    List<SearchResultItem> search(String query, int limit);
}
