package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.PduRecord;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a wire PDU into a {@link PduRecord}, rejecting shapes that cannot be
 * stored or ordered. Rejections are {@link FederationException}s of kind
 * BAD_REQUEST.
 */
@Component
public class PduValidator {

    static final int MAX_ID_LENGTH = 255;

    private final CanonicalJson canonicalJson;

    public PduValidator(CanonicalJson canonicalJson) {
        this.canonicalJson = canonicalJson;
    }

    /**
     * @param raw    the PDU as received
     * @param origin the server that delivered it, kept when the PDU names none
     */
    @SuppressWarnings("unchecked")
    public PduRecord validate(Map<String, Object> raw, String origin) {
        if (raw == null) {
            throw FederationException.badRequest("PDU must be a JSON object");
        }
        String eventId = optionalString(raw, "event_id");
        if (eventId == null) {
            eventId = referenceEventId(raw);
        }
        requireId("event_id", eventId);
        String roomId = requireId("room_id", optionalString(raw, "room_id"));
        String sender = requireId("sender", optionalString(raw, "sender"));
        String type = optionalString(raw, "type");
        if (type == null || type.isEmpty()) {
            throw FederationException.badRequest("type must be a non-empty string");
        }

        Object ts = raw.get("origin_server_ts");
        if (ts == null) {
            throw FederationException.badRequest("origin_server_ts missing on " + eventId);
        }
        if (!(ts instanceof Number) || ts instanceof Double || ts instanceof Float) {
            throw FederationException.badRequest("origin_server_ts must be an integer on " + eventId);
        }

        Object content = raw.getOrDefault("content", Map.of());
        if (!(content instanceof Map)) {
            throw FederationException.badRequest("content must be an object on " + eventId);
        }
        Object stateKey = raw.get("state_key");
        if (stateKey != null && !(stateKey instanceof String)) {
            throw FederationException.badRequest("state_key must be a string on " + eventId);
        }
        Object depth = raw.get("depth");

        return PduRecord.builder()
                .eventId(eventId)
                .roomId(roomId)
                .sender(sender)
                .type(type)
                .content(new LinkedHashMap<>((Map<String, Object>) content))
                .stateKey((String) stateKey)
                .originServerTs(((Number) ts).longValue())
                .prevEvents(eventRefs(raw.get("prev_events"), "prev_events", eventId))
                .authEvents(eventRefs(raw.get("auth_events"), "auth_events", eventId))
                .depth(depth instanceof Number ? ((Number) depth).longValue() : null)
                .origin(raw.get("origin") instanceof String ? (String) raw.get("origin") : origin)
                .redacts(optionalString(raw, "redacts"))
                .build();
    }

    /**
     * Reference-hash event id used by room versions 4 and later: SHA-256 over
     * the canonical PDU without signatures and unsigned data.
     */
    public String referenceEventId(Map<String, Object> raw) {
        byte[] canonical = canonicalJson.encodeWithout(raw, "signatures", "unsigned", "event_id");
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(canonical);
            return "$" + Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Accepts both {@code ["$id", ...]} and the older {@code [["$id", {hashes}], ...]}.
     */
    private static List<String> eventRefs(Object value, String field, String eventId) {
        List<String> refs = new ArrayList<>();
        if (value == null) {
            return refs;
        }
        if (!(value instanceof List)) {
            throw FederationException.badRequest(field + " must be an array on " + eventId);
        }
        for (Object entry : (List<?>) value) {
            Object id = entry instanceof List && !((List<?>) entry).isEmpty() ? ((List<?>) entry).get(0) : entry;
            if (!(id instanceof String) || ((String) id).isEmpty()) {
                throw FederationException.badRequest(field + " contains an invalid event id on " + eventId);
            }
            refs.add((String) id);
        }
        return refs;
    }

    private static String optionalString(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        return value instanceof String ? (String) value : null;
    }

    private static String requireId(String field, String value) {
        if (value == null || value.isEmpty()) {
            throw FederationException.badRequest(field + " must be a non-empty string");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length > MAX_ID_LENGTH) {
            throw FederationException.badRequest(field + " exceeds " + MAX_ID_LENGTH + " bytes");
        }
        return value;
    }
}
