package com.example.federation.kv;

import java.time.Duration;
import java.util.Optional;

/**
 * Expiring string cache used for remote server keys.
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    void del(String key);
}
