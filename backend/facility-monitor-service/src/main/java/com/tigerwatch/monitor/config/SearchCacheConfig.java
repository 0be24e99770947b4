package com.tigerwatch.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tigerwatch.monitor.service.retrieval.NoOpSearchCache;
import com.tigerwatch.monitor.service.retrieval.RedisSearchCache;
import com.tigerwatch.monitor.service.retrieval.SearchCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses the search cache implementation once at startup.
 *
 * Redis is used when caching is enabled and the server answers a PING;
 * otherwise the gateway runs uncached through {@link NoOpSearchCache}.
 */
@Configuration
@Slf4j
public class SearchCacheConfig {

    @Bean
    public SearchCache searchCache(MonitorProperties properties,
                                   ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                   ObjectMapper objectMapper) {
        MonitorProperties.Cache cache = properties.getRetrieval().getCache();
        if (!cache.isEnabled()) {
            log.info("Search caching disabled by configuration");
            return new NoOpSearchCache();
        }

        StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            log.warn("No Redis connection configured - search caching disabled");
            return new NoOpSearchCache();
        }

        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping(), true);
            log.info("Search cache backed by Redis (ping={}, ttl={})", pong, cache.getTtl());
            return new RedisSearchCache(redisTemplate, objectMapper, cache.getKeyPrefix(), cache.getTtl());
        } catch (Exception e) {
            log.warn("Redis connection failed - search caching disabled: {}", e.getMessage());
            return new NoOpSearchCache();
        }
    }
}
