package com.tigerwatch.monitor.service.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tigerwatch.monitor.dto.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Search result cache in Redis, stored as JSON strings under a key prefix.
 * Redis errors are logged and treated as a miss.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisSearchCache implements SearchCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    @Override
    public Optional<SearchResponse> get(String key) {
        try {
            String cached = redisTemplate.opsForValue().get(keyPrefix + key);
            if (cached == null) {
                log.debug("Cache MISS for search key={}", key);
                return Optional.empty();
            }
            log.debug("Cache HIT for search key={}", key);
            return Optional.of(objectMapper.readValue(cached, SearchResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached search result key={}: {}", key, e.getOriginalMessage());
        } catch (Exception e) {
            log.warn("Error reading from search cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, SearchResponse response) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, objectMapper.writeValueAsString(response), ttl);
            log.debug("Cached search result key={}, count={}", key, response.getCount());
        } catch (Exception e) {
            log.warn("Error caching search result: {}", e.getMessage());
        }
    }
}
