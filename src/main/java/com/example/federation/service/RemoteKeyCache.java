package com.example.federation.service;

import com.example.federation.kv.KvClient;
import com.example.federation.model.VerifyKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Read-through cache of remote verify keys keyed by (server_name, key_id).
 * Entries expire at the remote's {@code valid_until_ts}. Concurrent misses for
 * the same key wait on a single fetch.
 */
@Service
public class RemoteKeyCache {

    private static final Logger logger = LoggerFactory.getLogger(RemoteKeyCache.class);
    static final String KEY_PREFIX = "federation:keys:";

    private final KvClient kvClient;
    private final RemoteKeyFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, CompletableFuture<List<VerifyKey>>> inFlight = new ConcurrentHashMap<>();

    @Value("${app.federation.remote-keys.fetch-timeout-ms:10000}")
    private long fetchTimeoutMs;

    @Value("${app.federation.remote-keys.min-ttl-ms:60000}")
    private long minTtlMs;

    public RemoteKeyCache(KvClient kvClient, RemoteKeyFetcher fetcher, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    public Optional<VerifyKey> lookup(String serverName, String keyId) {
        Optional<VerifyKey> cached = readCached(serverName, keyId);
        if (cached.isPresent()) {
            return cached;
        }
        String lockKey = cacheKey(serverName, keyId);
        CompletableFuture<List<VerifyKey>> fetch = inFlight.computeIfAbsent(lockKey,
                k -> fetcher.fetch(serverName).toFuture());
        try {
            List<VerifyKey> fetched = fetch.get(fetchTimeoutMs, TimeUnit.MILLISECONDS);
            List<VerifyKey> keys = fetched != null ? fetched : List.of();
            long now = System.currentTimeMillis();
            keys.stream().filter(k -> k.isValidAt(now)).forEach(this::store);
            return keys.stream()
                    .filter(k -> keyId.equals(k.getKeyId()) && k.isValidAt(now))
                    .findFirst();
        } catch (TimeoutException e) {
            logger.warn("Timed out fetching key {} of {} after {}ms", keyId, serverName, fetchTimeoutMs);
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("Failed to fetch key {} of {}: {}", keyId, serverName, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            inFlight.remove(lockKey, fetch);
        }
    }

    public void invalidate(String serverName, String keyId) {
        kvClient.del(cacheKey(serverName, keyId));
    }

    void store(VerifyKey key) {
        long remaining = key.getValidUntilTs() - System.currentTimeMillis();
        Duration ttl = Duration.ofMillis(Math.max(remaining, minTtlMs));
        try {
            String value = objectMapper.writeValueAsString(Map.of(
                    "key", key.getKey(),
                    "valid_until_ts", key.getValidUntilTs()));
            kvClient.set(cacheKey(key.getServerName(), key.getKeyId()), value, ttl);
            logger.info("Cached key {} of {} until {}", key.getKeyId(), key.getServerName(), key.getValidUntilTs());
        } catch (JsonProcessingException e) {
            logger.warn("Could not cache key {} of {}", key.getKeyId(), key.getServerName(), e);
        }
    }

    private Optional<VerifyKey> readCached(String serverName, String keyId) {
        Optional<String> raw = kvClient.get(cacheKey(serverName, keyId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            Map<?, ?> entry = objectMapper.readValue(raw.get(), Map.class);
            Object key = entry.get("key");
            Object validUntil = entry.get("valid_until_ts");
            if (key instanceof String && validUntil instanceof Number) {
                VerifyKey verifyKey = new VerifyKey(serverName, keyId, (String) key, ((Number) validUntil).longValue());
                // the ttl floor can outlive valid_until_ts
                return verifyKey.isValidAt(System.currentTimeMillis()) ? Optional.of(verifyKey) : Optional.empty();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Cache entry for key {} of {} is not JSON", keyId, serverName);
        }
        logger.warn("Dropping unreadable cache entry for key {} of {}", keyId, serverName);
        kvClient.del(cacheKey(serverName, keyId));
        return Optional.empty();
    }

    static String cacheKey(String serverName, String keyId) {
        return KEY_PREFIX + serverName + ":" + keyId;
    }
}
