package com.example.federation.service;

import com.example.federation.model.VerifyKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code https://<server>/_matrix/key/v2/server} and keeps only keys whose
 * self-signature over the response checks out.
 */
@Component
public class WebClientRemoteKeyFetcher implements RemoteKeyFetcher {

    private static final Logger logger = LoggerFactory.getLogger(WebClientRemoteKeyFetcher.class);

    private final WebClient webClient;
    private final CanonicalJson canonicalJson;

    public WebClientRemoteKeyFetcher(WebClient.Builder builder, CanonicalJson canonicalJson) {
        this.webClient = builder.build();
        this.canonicalJson = canonicalJson;
    }

    @Override
    public Mono<List<VerifyKey>> fetch(String serverName) {
        return webClient.get()
                .uri("https://" + serverName + "/_matrix/key/v2/server")
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .map(body -> parse(serverName, body, canonicalJson));
    }

    @SuppressWarnings("unchecked")
    static List<VerifyKey> parse(String serverName, Map<String, Object> body, CanonicalJson canonicalJson) {
        if (!serverName.equals(body.get("server_name"))) {
            logger.warn("Key response for {} names server {}", serverName, body.get("server_name"));
            return List.of();
        }
        Object validUntil = body.get("valid_until_ts");
        if (!(validUntil instanceof Number)) {
            logger.warn("Key response for {} has no valid_until_ts", serverName);
            return List.of();
        }
        Object verifyKeys = body.get("verify_keys");
        if (!(verifyKeys instanceof Map)) {
            return List.of();
        }
        Map<String, Object> signatures = body.get("signatures") instanceof Map
                ? (Map<String, Object>) ((Map<String, Object>) body.get("signatures")).get(serverName)
                : null;
        byte[] signed = canonicalJson.encodeWithout(body, "signatures", "unsigned");

        List<VerifyKey> keys = new ArrayList<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) verifyKeys).entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                continue;
            }
            Object key = ((Map<String, Object>) entry.getValue()).get("key");
            Object signature = signatures != null ? signatures.get(entry.getKey()) : null;
            if (!(key instanceof String) || !(signature instanceof String)) {
                logger.warn("Key {} of {} is unsigned, ignoring it", entry.getKey(), serverName);
                continue;
            }
            if (!ServerKeyAuthority.verify((String) key, signed, (String) signature)) {
                logger.warn("Key {} of {} failed self-signature check", entry.getKey(), serverName);
                continue;
            }
            keys.add(new VerifyKey(serverName, entry.getKey(), (String) key, ((Number) validUntil).longValue()));
        }
        return keys;
    }
}
