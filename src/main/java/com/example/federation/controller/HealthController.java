package com.example.federation.controller;

import com.example.federation.kv.KvClient;
import com.example.federation.service.ServerKeyAuthority;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final MongoTemplate mongoTemplate;
    private final ServerKeyAuthority keyAuthority;

    public HealthController(KvClient kvClient, MongoTemplate mongoTemplate, ServerKeyAuthority keyAuthority) {
        this.kvClient = kvClient;
        this.mongoTemplate = mongoTemplate;
        this.keyAuthority = keyAuthority;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "homeserver-federation");
        health.put("serverName", keyAuthority.getServerName());

        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        if (!keyAuthority.isEnabled()) {
            health.put("signingKey", "DISABLED");
        } else if (keyAuthority.isKeyAvailable()) {
            health.put("signingKey", "UP");
            health.put("keyId", keyAuthority.getKeyId());
        } else {
            health.put("signingKey", "DOWN");
            health.put("status", "DEGRADED");
        }

        return ResponseEntity.ok(health);
    }
}
