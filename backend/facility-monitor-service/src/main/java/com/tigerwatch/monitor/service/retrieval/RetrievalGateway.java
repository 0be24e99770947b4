package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.ScrapeResult;
import com.tigerwatch.monitor.dto.SearchResponse;
import com.tigerwatch.monitor.dto.SearchResultItem;
import com.tigerwatch.monitor.exception.ProviderExhaustedException;
import com.tigerwatch.monitor.exception.ScrapeUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * Web retrieval gateway: cached multi-provider search with ordered fallback, plus page scraping.
 *
 * 검색 순서:
 * 1. 요청된(또는 설정된) 기본 프로바이더
 * 2. monitor.retrieval.search.fallback-order 의 나머지 프로바이더
 * 3. 검색 결과 페이지 스크래핑 (scrape_fallback)
 *
 * Neither operation throws for provider or backend failures. Search returns an
 * empty response with {@code error} set once the chain is exhausted; scrape
 * returns an empty result with {@code warning} or {@code error}.
 */
@Service
@Slf4j
public class RetrievalGateway {

    private final Map<String, SearchProvider> providersByName;
    private final ScrapeBackend scrapeBackend;
    private final SearchCache searchCache;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    public RetrievalGateway(List<SearchProvider> providers,
                            ScrapeBackend scrapeBackend,
                            SearchCache searchCache,
                            MonitorProperties properties,
                            MeterRegistry meterRegistry) {
        this.providersByName = new LinkedHashMap<>();
        for (SearchProvider provider : providers) {
            providersByName.put(provider.getName(), provider);
        }
        this.scrapeBackend = scrapeBackend;
        this.searchCache = searchCache;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    // ========================================
    // Search
    // ========================================

    public SearchResponse search(String query, int limit) {
        return search(query, limit, null);
    }

    /**
     * @param provider preferred provider name, or {@code null} for the configured default
     */
    public SearchResponse search(String query, int limit, String provider) {
        MonitorProperties.Search settings = properties.getRetrieval().getSearch();
        String primary = (provider == null || provider.isBlank()) ? settings.getProvider() : provider;
        int effectiveLimit = clampLimit(limit, settings);

        if (query == null || query.isBlank()) {
            return SearchResponse.empty(query, primary, "Search query must not be blank");
        }

        String cacheKey = cacheKey(primary, query, effectiveLimit);
        Optional<SearchResponse> cached = searchCache.get(cacheKey);
        if (cached.isPresent()) {
            SearchResponse hit = cached.get();
            hit.setCached(true);
            log.info("Returning cached search result: query='{}', provider={}", abbreviate(query), hit.getProvider());
            return hit;
        }

        List<String> attempted = new ArrayList<>();
        boolean anyProviderAnswered = false;

        for (String name : providerChain(primary, settings)) {
            SearchProvider searchProvider = providersByName.get(name);
            if (searchProvider == null) {
                log.warn("Unknown search provider '{}' in chain, skipping", name);
                continue;
            }
            if (!searchProvider.isAvailable()) {
                log.debug("Search provider {} not configured, skipping", name);
                continue;
            }

            attempted.add(name);
            if (attempted.size() > 1) {
                meterRegistry.counter("monitor.search.fallbacks", "provider", name).increment();
            }

            try {
                List<SearchResultItem> results = searchProvider.search(query, effectiveLimit);
                anyProviderAnswered = true;
                if (results != null && !results.isEmpty()) {
                    SearchResponse response = SearchResponse.of(query, name, results);
                    searchCache.put(cacheKey, response);
                    log.info("Search succeeded: query='{}', provider={}, count={}",
                            abbreviate(query), name, response.getCount());
                    return response;
                }
                log.info("Search provider {} returned no results for query='{}', trying next", name, abbreviate(query));
            } catch (Exception e) {
                log.warn("Search provider {} failed for query='{}': {}", name, abbreviate(query), e.getMessage());
            }
        }

        if (anyProviderAnswered) {
            // providers answered but found nothing; a normal outcome, not an error
            return SearchResponse.empty(query, primary, null);
        }

        ProviderExhaustedException exhausted = new ProviderExhaustedException(query, attempted);
        log.warn("{}", exhausted.getMessage());
        return SearchResponse.empty(query, primary, exhausted.getMessage());
    }

    /**
     * Primary first, then the configured fallback order, then the SERP scrape. Duplicates removed.
     */
    List<String> providerChain(String primary, MonitorProperties.Search settings) {
        LinkedHashSet<String> chain = new LinkedHashSet<>();
        chain.add(primary);
        chain.addAll(settings.getFallbackOrder());
        chain.remove(ScrapeFallbackSearchProvider.NAME);
        chain.add(ScrapeFallbackSearchProvider.NAME);
        return new ArrayList<>(chain);
    }

    // ========================================
    // Scrape
    // ========================================

    public ScrapeResult scrape(String url) {
        return scrape(url, false);
    }

    public ScrapeResult scrape(String url, boolean extractStructured) {
        if (!scrapeBackend.isConfigured()) {
            ScrapeUnavailableException unavailable = ScrapeUnavailableException.notConfigured();
            log.warn("Scrape backend not configured - returning empty result for url={}", url);
            return ScrapeResult.degraded(url, unavailable.getMessage());
        }
        try {
            ScrapeResult result = scrapeBackend.scrape(url, extractStructured);
            return result != null ? result : ScrapeResult.failed(url, "Scrape backend returned nothing");
        } catch (Exception e) {
            log.warn("Scrape failed: url={}, error={}", url, e.getMessage());
            return ScrapeResult.failed(url, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    // ========================================
    // Helpers
    // ========================================

    private int clampLimit(int limit, MonitorProperties.Search settings) {
        if (limit <= 0) {
            return Math.min(settings.getDefaultLimit(), settings.getMaxLimit());
        }
        return Math.min(limit, settings.getMaxLimit());
    }

    /**
     * 캐시 키 생성 (provider + 정규화된 쿼리 + limit 해시)
     */
    static String cacheKey(String provider, String query, int limit) {
        String normalized = query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        String input = "web_search|" + provider + "|" + normalized + "|" + limit;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            return String.valueOf(input.hashCode());
        }
    }

    private static String abbreviate(String query) {
        return query.length() > 50 ? query.substring(0, 50) + "..." : query;
    }
}
