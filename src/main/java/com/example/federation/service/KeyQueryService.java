package com.example.federation.service;

import com.example.federation.error.FederationException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Answers key queries: this server from its own key, any other server
 * through the remote key cache.
 */
@Service
public class KeyQueryService {

    private final ServerKeyAuthority keyAuthority;
    private final RemoteKeyCache remoteKeyCache;

    public KeyQueryService(ServerKeyAuthority keyAuthority, RemoteKeyCache remoteKeyCache) {
        this.keyAuthority = keyAuthority;
        this.remoteKeyCache = remoteKeyCache;
    }

    public Map<String, Object> query(String serverName, String keyId) {
        if (!keyAuthority.isEnabled()) {
            throw FederationException.notFound("Federation is disabled");
        }
        if (keyAuthority.getServerName().equals(serverName)) {
            return keyAuthority.serverKeyResponse();
        }
        return remoteKeyCache.lookup(serverName, keyId)
                .map(ServerKeyAuthority::toKeyResponse)
                .orElseThrow(() -> FederationException.notFound("No valid key " + keyId + " for " + serverName));
    }
}
