package com.example.federation.controller;

import com.example.federation.service.KeyQueryService;
import com.example.federation.service.ServerKeyAuthority;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class KeyController {

    private final ServerKeyAuthority keyAuthority;
    private final KeyQueryService keyQueryService;

    public KeyController(ServerKeyAuthority keyAuthority, KeyQueryService keyQueryService) {
        this.keyAuthority = keyAuthority;
        this.keyQueryService = keyQueryService;
    }

    @GetMapping({"/_matrix/key/v2/server", "/_matrix/federation/v2/server"})
    public Mono<Map<String, Object>> serverKey() {
        return Mono.fromCallable(keyAuthority::serverKeyResponse);
    }

    @GetMapping({
            "/_matrix/federation/v1/query/{serverName}/{keyId}",
            "/_matrix/federation/v2/query/{serverName}/{keyId}",
            "/_matrix/key/v2/query/{serverName}/{keyId}"})
    public Mono<Map<String, Object>> queryKey(@PathVariable String serverName, @PathVariable String keyId) {
        return Blocking.call(() -> keyQueryService.query(serverName, keyId));
    }
}
