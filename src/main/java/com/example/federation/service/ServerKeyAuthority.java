package com.example.federation.service;

import com.example.federation.error.ErrorKind;
import com.example.federation.error.FederationException;
import com.example.federation.model.VerifyKey;
import jakarta.annotation.PostConstruct;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds this server's Ed25519 signing key and answers for its verify key.
 * <p>
 * The seed is read once at startup. A seed that is missing or does not decode
 * to 32 bytes is a configuration error: startup aborts when
 * {@code app.federation.fail-fast-on-invalid-key} is set, otherwise every key
 * request fails with {@link ErrorKind#INTERNAL}.
 */
@Service
public class ServerKeyAuthority {

    private static final Logger logger = LoggerFactory.getLogger(ServerKeyAuthority.class);
    private static final int SEED_LENGTH = 32;

    private final CanonicalJson canonicalJson;

    @Value("${app.federation.enabled:true}")
    private boolean enabled;

    @Value("${app.federation.server-name:localhost}")
    private String serverName;

    @Value("${app.federation.signing-key:}")
    private String signingKey;

    @Value("${app.federation.key-id:ed25519:1}")
    private String keyId;

    @Value("${app.federation.key-validity-ms:3600000}")
    private long keyValidityMs;

    @Value("${app.federation.fail-fast-on-invalid-key:true}")
    private boolean failFast;

    /**
     * Keys this server signed with before a rotation, each as
     * {@code "<key_id> <verify_key> <expired_ts>"}.
     */
    @Value("${app.federation.old-verify-keys:}")
    private List<String> oldVerifyKeyEntries = List.of();

    private volatile Ed25519PrivateKeyParameters privateKey;
    private volatile String verifyKeyBase64;
    private volatile Map<String, Map<String, Object>> oldVerifyKeys = Map.of();

    public ServerKeyAuthority(CanonicalJson canonicalJson) {
        this.canonicalJson = canonicalJson;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Federation disabled, signing key not loaded");
            return;
        }
        this.oldVerifyKeys = parseOldKeys(oldVerifyKeyEntries, keyId);
        Optional<byte[]> seed = decodeSeed(signingKey);
        if (seed.isEmpty()) {
            logger.error("Federation signing key is missing or invalid (server {}, key {}); federation requests cannot be signed",
                    serverName, keyId);
            if (failFast) {
                throw new IllegalStateException("Missing or invalid app.federation.signing-key");
            }
            return;
        }
        Ed25519PrivateKeyParameters key = new Ed25519PrivateKeyParameters(seed.get(), 0);
        this.verifyKeyBase64 = encode(key.generatePublicKey().getEncoded());
        this.privateKey = key;
        logger.info("Loaded signing key {} for {}", keyId, serverName);
    }

    /**
     * Accepts standard and url-safe base64, padded or not, and the
     * {@code "ed25519 <key_id> <seed>"} signing key file line.
     */
    static Optional<byte[]> decodeSeed(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length == 3) {
            trimmed = parts[2];
        }
        for (Base64.Decoder decoder : List.of(Base64.getDecoder(), Base64.getUrlDecoder())) {
            try {
                byte[] bytes = decoder.decode(trimmed);
                if (bytes.length == SEED_LENGTH) {
                    return Optional.of(bytes);
                }
            } catch (IllegalArgumentException e) {
                logger.trace("Seed is not decodable with {}", decoder);
            }
        }
        return Optional.empty();
    }

    static Map<String, Map<String, Object>> parseOldKeys(List<String> entries, String currentKeyId) {
        Map<String, Map<String, Object>> parsed = new LinkedHashMap<>();
        if (entries == null) {
            return parsed;
        }
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split("\\s+");
            if (parts.length != 3 || !parts[0].startsWith("ed25519:")) {
                logger.warn("Ignoring old verify key entry '{}': expected '<key_id> <verify_key> <expired_ts>'", entry);
                continue;
            }
            if (parts[0].equals(currentKeyId)) {
                logger.warn("Ignoring old verify key {}: it is the current key id", parts[0]);
                continue;
            }
            byte[] publicKey;
            long expiredTs;
            try {
                publicKey = Base64.getDecoder().decode(parts[1]);
                expiredTs = Long.parseLong(parts[2]);
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring old verify key {}: {}", parts[0], e.getMessage());
                continue;
            }
            if (publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE) {
                logger.warn("Ignoring old verify key {}: not a 32-byte Ed25519 key", parts[0]);
                continue;
            }
            Map<String, Object> oldKey = new LinkedHashMap<>();
            oldKey.put("key", encode(publicKey));
            oldKey.put("expired_ts", expiredTs);
            parsed.put(parts[0], oldKey);
        }
        if (!parsed.isEmpty()) {
            logger.info("Serving {} old verify key(s): {}", parsed.size(), parsed.keySet());
        }
        return parsed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isKeyAvailable() {
        return privateKey != null;
    }

    public String getServerName() {
        return serverName;
    }

    public String getKeyId() {
        return keyId;
    }

    /**
     * This server's verify key, valid for the configured window from now.
     */
    public VerifyKey localKey() {
        requireKey();
        return new VerifyKey(serverName, keyId, verifyKeyBase64, System.currentTimeMillis() + keyValidityMs);
    }

    /**
     * Body of {@code GET /_matrix/key/v2/server}, self-signed.
     */
    public Map<String, Object> serverKeyResponse() {
        if (!enabled) {
            throw FederationException.notFound("Federation disabled");
        }
        VerifyKey key = localKey();
        Map<String, Object> body = toKeyResponse(key);
        body.put("old_verify_keys", oldVerifyKeys);
        String signature = signJson(body);
        body.put("signatures", Map.of(serverName, Map.of(keyId, signature)));
        return body;
    }

    public static Map<String, Object> toKeyResponse(VerifyKey key) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("server_name", key.getServerName());
        body.put("verify_keys", Map.of(key.getKeyId(), Map.of("key", key.getKey())));
        body.put("old_verify_keys", Map.of());
        body.put("valid_until_ts", key.getValidUntilTs());
        return body;
    }

    public String sign(byte[] message) {
        Ed25519PrivateKeyParameters key = requireKey();
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, key);
        signer.update(message, 0, message.length);
        return encode(signer.generateSignature());
    }

    /**
     * Signs the canonical form of {@code value} without its {@code signatures}
     * and {@code unsigned} members.
     */
    public String signJson(Map<String, Object> value) {
        return sign(canonicalJson.encodeWithout(value, "signatures", "unsigned"));
    }

    public static boolean verify(String verifyKeyBase64, byte[] message, String signatureBase64) {
        try {
            byte[] publicKey = Base64.getDecoder().decode(verifyKeyBase64);
            byte[] signature = Base64.getDecoder().decode(signatureBase64);
            if (publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE
                    || signature.length != Ed25519PrivateKeyParameters.SIGNATURE_SIZE) {
                return false;
            }
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private Ed25519PrivateKeyParameters requireKey() {
        Ed25519PrivateKeyParameters key = privateKey;
        if (key == null) {
            logger.error("Signing key requested but none is loaded for {}; check app.federation.signing-key", serverName);
            throw new FederationException(ErrorKind.INTERNAL, "Missing or invalid federation signing key");
        }
        return key;
    }

    private static String encode(byte[] bytes) {
        return Base64.getEncoder().withoutPadding().encodeToString(bytes);
    }
}
