package com.whereq.foundry.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.foundry.config.FoundryProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveRedisCallback;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Best-effort JSON key-value store on top of Redis.
 *
 * <p>A single probe at startup decides whether the facade is {@link CacheMode#ACTIVE}
 * or {@link CacheMode#DISABLED} for the lifetime of the process. No operation ever
 * signals an error: connectivity and serialization failures are logged and turned
 * into the same result as a miss, so callers treat "absent" and "unavailable" alike.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class CacheFacade {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final FoundryProperties.CacheConfig config;

    private volatile CacheMode mode = CacheMode.DISABLED;

    @Autowired
    public CacheFacade(ReactiveRedisTemplate<String, String> redisTemplate,
                       ObjectMapper objectMapper,
                       FoundryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getCache();
    }

    /**
     * Decide the operating mode. Runs once when the bean is created.
     */
    @PostConstruct
    public void probe() {
        if (!config.isEnabled()) {
            mode = CacheMode.DISABLED;
            log.info("Job cache disabled by configuration, using memory-only state");
            return;
        }

        try {
            String pong = redisTemplate.execute((ReactiveRedisCallback<String>) connection -> connection.ping())
                .next()
                .block(config.getProbeTimeout());
            mode = "PONG".equalsIgnoreCase(pong) ? CacheMode.ACTIVE : CacheMode.DISABLED;
        } catch (Exception e) {
            log.warn("Redis probe failed, job cache disabled: {}", e.getMessage());
            mode = CacheMode.DISABLED;
        }

        log.info("Job cache mode: {}", mode);
    }

    public CacheMode getMode() {
        return mode;
    }

    public boolean isActive() {
        return mode == CacheMode.ACTIVE;
    }

    /**
     * Store a value as JSON with an expiry.
     *
     * @return true if Redis accepted the write
     */
    public Mono<Boolean> put(String key, Object value, Duration ttl) {
        if (!isActive()) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
            .flatMap(json -> redisTemplate.opsForValue().set(key, json, ttl))
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Cache put failed for {}: {}", key, e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Read a JSON value.
     *
     * @return the value, empty on miss or when the cache is unavailable
     */
    public <T> Mono<T> get(String key, Class<T> type) {
        return read(key, json -> objectMapper.readValue(json, type));
    }

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        return read(key, json -> objectMapper.readValue(json, type));
    }

    /**
     * Delete keys.
     *
     * @return number of keys removed; 0 when unavailable
     */
    public Mono<Long> delete(String... keys) {
        if (!isActive() || keys.length == 0) {
            return Mono.just(0L);
        }
        return redisTemplate.delete(keys)
            .defaultIfEmpty(0L)
            .onErrorResume(e -> {
                log.warn("Cache delete failed for {} keys: {}", keys.length, e.getMessage());
                return Mono.just(0L);
            });
    }

    public Mono<Boolean> exists(String key) {
        if (!isActive()) {
            return Mono.just(false);
        }
        return redisTemplate.hasKey(key)
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Cache exists check failed for {}: {}", key, e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Count keys matching a glob pattern.
     */
    public Mono<Long> countKeys(String pattern) {
        if (!isActive()) {
            return Mono.just(0L);
        }
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).build())
            .count()
            .onErrorResume(e -> {
                log.warn("Cache scan failed for {}: {}", pattern, e.getMessage());
                return Mono.just(0L);
            });
    }

    /**
     * Delete keys matching a glob pattern that were stored without an expiry.
     *
     * @return number of keys removed
     */
    public Mono<Long> purgeWithoutExpiry(String pattern) {
        if (!isActive()) {
            return Mono.just(0L);
        }
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).build())
            .flatMap(key -> redisTemplate.getExpire(key)
                // Duration.ZERO is how the template reports a key without expiry
                .filter(Duration::isZero)
                .flatMap(persistent -> redisTemplate.delete(key)))
            .reduce(0L, Long::sum)
            .onErrorResume(e -> {
                log.warn("Cache purge failed for {}: {}", pattern, e.getMessage());
                return Mono.just(0L);
            });
    }

    private <T> Mono<T> read(String key, JsonReader<T> reader) {
        if (!isActive()) {
            return Mono.empty();
        }
        return redisTemplate.opsForValue().get(key)
            .flatMap(json -> Mono.fromCallable(() -> reader.read(json)))
            .onErrorResume(e -> {
                log.warn("Cache get failed for {}: {}", key, e.getMessage());
                return Mono.empty();
            });
    }

    @FunctionalInterface
    private interface JsonReader<T> {
        T read(String json) throws Exception;
    }
}
