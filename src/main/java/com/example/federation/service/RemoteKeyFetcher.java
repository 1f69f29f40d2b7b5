package com.example.federation.service;

import com.example.federation.model.VerifyKey;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches the currently published verify keys of a remote server.
 */
public interface RemoteKeyFetcher {
    Mono<List<VerifyKey>> fetch(String serverName);
}
