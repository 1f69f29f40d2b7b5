package com.example.federation.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A server verify key together with the time until which it may be trusted.
 */
@Value
@AllArgsConstructor
public class VerifyKey {
    String serverName;
    String keyId;
    String key;
    long validUntilTs;

    public boolean isValidAt(long nowMs) {
        return validUntilTs > nowMs;
    }
}
