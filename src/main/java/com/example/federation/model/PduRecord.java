package com.example.federation.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A persisted federation event. Created once, never mutated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("pdus")
@CompoundIndex(name = "room_state_idx", def = "{'roomId': 1, 'stateKey': 1, 'type': 1}")
@CompoundIndex(name = "room_ts_idx", def = "{'roomId': 1, 'originServerTs': -1}")
public class PduRecord {
    @Id
    private String eventId;
    private String roomId;
    private String sender;
    private String type;
    private Map<String, Object> content;
    private String stateKey;        // null for non-state events
    private Long originServerTs;
    @Builder.Default
    private List<String> prevEvents = new ArrayList<>();
    @Builder.Default
    private List<String> authEvents = new ArrayList<>();
    private Long depth;
    private String origin;
    private String redacts;
    @Field("receivedAt")
    private Instant receivedAt;

    public boolean isStateEvent() {
        return stateKey != null;
    }

    /**
     * Federation wire form of this event.
     */
    public Map<String, Object> toPdu() {
        Map<String, Object> pdu = new LinkedHashMap<>();
        pdu.put("event_id", eventId);
        pdu.put("room_id", roomId);
        pdu.put("sender", sender);
        pdu.put("type", type);
        pdu.put("content", content != null ? content : Map.of());
        if (stateKey != null) {
            pdu.put("state_key", stateKey);
        }
        pdu.put("origin_server_ts", originServerTs);
        pdu.put("prev_events", prevEvents != null ? prevEvents : List.of());
        pdu.put("auth_events", authEvents != null ? authEvents : List.of());
        if (depth != null) {
            pdu.put("depth", depth);
        }
        if (origin != null) {
            pdu.put("origin", origin);
        }
        if (redacts != null) {
            pdu.put("redacts", redacts);
        }
        return pdu;
    }
}
