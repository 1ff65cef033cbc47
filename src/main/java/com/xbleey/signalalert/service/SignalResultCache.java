package com.xbleey.signalalert.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.enums.SignalType;
import com.xbleey.signalalert.model.FetchResult;
import com.xbleey.signalalert.model.TokenRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Falls back to an in-process map while Redis is unreachable; results are then DEGRADED.
@Component
public class SignalResultCache implements SweepableState {

    private static final Logger log = LoggerFactory.getLogger(SignalResultCache.class);
    private static final String KEY_PREFIX = "signal:";
    static final String DEGRADED_REASON = "Shared cache unavailable, using in-process cache";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, LocalEntry> localEntries = new ConcurrentHashMap<>();
    private volatile boolean sharedAvailable = true;

    public SignalResultCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static String cacheKey(SignalType type, TokenRef token) {
        return KEY_PREFIX + type.code() + ":" + token.chainId() + ":" + token.address();
    }

    public <T> FetchResult<T> get(String key, Class<T> type) {
        String cached;
        try {
            cached = redisTemplate.opsForValue().get(key);
            markShared(true);
        } catch (Exception ex) {
            log.warn("Failed to read {} from redis", key, ex);
            markShared(false);
            return FetchResult.degraded(readLocal(key, type), DEGRADED_REASON);
        }
        if (cached == null || cached.isBlank()) {
            return FetchResult.ok(null);
        }
        T value = decode(key, cached, type);
        if (value == null) {
            delete(key);
        }
        return FetchResult.ok(value);
    }

    public boolean set(String key, Object value, Duration ttl) {
        if (value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (Exception ex) {
            log.warn("Failed to serialize cache value for {}", key, ex);
            return false;
        }
        try {
            redisTemplate.opsForValue().set(key, json, ttl);
            markShared(true);
            return true;
        } catch (Exception ex) {
            log.warn("Failed to write {} to redis", key, ex);
            markShared(false);
            localEntries.put(key, new LocalEntry(json, clock.instant().plus(ttl)));
            return false;
        }
    }

    public void delete(String key) {
        localEntries.remove(key);
        try {
            redisTemplate.delete(key);
        } catch (Exception ex) {
            log.warn("Failed to delete {} from redis", key, ex);
            markShared(false);
        }
    }

    public boolean isSharedAvailable() {
        return sharedAvailable;
    }

    @Override
    public String stateName() {
        return "localResultCache";
    }

    @Override
    public int sweep(Instant now) {
        int removed = 0;
        for (Map.Entry<String, LocalEntry> entry : localEntries.entrySet()) {
            if (!entry.getValue().isActive(now) && localEntries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return localEntries.size();
    }

    private <T> T readLocal(String key, Class<T> type) {
        LocalEntry entry = localEntries.get(key);
        if (entry == null) {
            return null;
        }
        if (!entry.isActive(clock.instant())) {
            localEntries.remove(key, entry);
            return null;
        }
        return decode(key, entry.json(), type);
    }

    private <T> T decode(String key, String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to decode cached value for {}", key, ex);
            return null;
        }
    }

    private void markShared(boolean available) {
        if (sharedAvailable != available) {
            if (available) {
                log.info("Redis cache available again");
            } else {
                log.warn("Redis cache unavailable, falling back to in-process cache");
            }
            sharedAvailable = available;
        }
    }

    private record LocalEntry(String json, Instant expiresAt) {

        boolean isActive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
