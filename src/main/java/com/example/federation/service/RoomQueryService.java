package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only federation queries over stored events and room state.
 */
@Service
public class RoomQueryService {

    private final EventStore eventStore;
    private final AuthChainResolver authChainResolver;
    private final MembershipProjection projection;
    private final ServerKeyAuthority keyAuthority;

    @Value("${spring.application.name:homeserver-federation}")
    private String implementationName = "homeserver-federation";

    @Value("${app.federation.server-version:0.1.0}")
    private String implementationVersion = "0.1.0";

    @Value("${app.federation.room-version:10}")
    private String roomVersion = "10";

    public RoomQueryService(EventStore eventStore,
                            AuthChainResolver authChainResolver,
                            MembershipProjection projection,
                            ServerKeyAuthority keyAuthority) {
        this.eventStore = eventStore;
        this.authChainResolver = authChainResolver;
        this.projection = projection;
        this.keyAuthority = keyAuthority;
    }

    public Map<String, Object> version() {
        Map<String, Object> server = new LinkedHashMap<>();
        server.put("name", implementationName);
        server.put("version", implementationVersion);
        return Map.of("server", server);
    }

    /**
     * Answers {@code GET /_matrix/federation/v1}: who we are and which room
     * version we create.
     */
    public Map<String, Object> discovery() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", implementationVersion);
        response.put("server_name", keyAuthority.getServerName());
        response.put("capabilities", Map.of("m.room_versions",
                Map.of("default", roomVersion, "available", Map.of(roomVersion, "stable"))));
        return response;
    }

    public Map<String, Object> event(String eventId) {
        PduRecord event = eventStore.findEvent(eventId)
                .orElseThrow(() -> FederationException.notFound("Unknown event " + eventId));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("origin", keyAuthority.getServerName());
        response.put("origin_server_ts", System.currentTimeMillis());
        response.put("pdus", List.of(event.toPdu()));
        return response;
    }

    /**
     * A single event addressed through its room; an event of another room is
     * rejected rather than leaked.
     */
    public Map<String, Object> roomEvent(String roomId, String eventId) {
        PduRecord event = eventStore.findEvent(eventId)
                .orElseThrow(() -> FederationException.notFound("Unknown event " + eventId));
        if (!roomId.equals(event.getRoomId())) {
            throw FederationException.badRequest("Event " + eventId + " does not belong to " + roomId);
        }
        return event.toPdu();
    }

    public Map<String, Object> state(String roomId) {
        requireRoom(roomId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("pdus", pdus(eventStore.currentState(roomId)));
        response.put("auth_chain", pdus(authChainResolver.resolve(roomId)));
        return response;
    }

    public Map<String, Object> stateIds(String roomId) {
        requireRoom(roomId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("pdu_ids", ids(eventStore.currentState(roomId)));
        response.put("auth_chain_ids", ids(authChainResolver.resolve(roomId)));
        return response;
    }

    public Map<String, Object> roomAuth(String roomId) {
        requireRoom(roomId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room_id", roomId);
        response.put("auth_chain", pdus(authChainResolver.resolve(roomId)));
        return response;
    }

    public Map<String, Object> eventAuth(String roomId, String eventId) {
        return Map.of("auth_chain", pdus(authChainResolver.authChainFor(roomId, eventId)));
    }

    /**
     * A room without an {@code m.room.join_rules} event is invite-only.
     */
    public Map<String, Object> joiningRules(String roomId) {
        requireRoom(roomId);
        Map<String, Object> content = eventStore.currentStateEvent(roomId, "m.room.join_rules", "")
                .map(PduRecord::getContent)
                .orElse(Map.of());
        Object joinRule = content.get("join_rule");
        Object allow = content.get("allow");
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room_id", roomId);
        response.put("join_rule", joinRule instanceof String ? joinRule : "invite");
        response.put("allow", allow instanceof List ? allow : List.of());
        return response;
    }

    public Map<String, Object> joinedMembers(String roomId) {
        requireRoom(roomId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room_id", roomId);
        response.put("joined", projection.joinedMembers(roomId));
        return response;
    }

    /**
     * Every user with a member event in current state, whatever the membership.
     */
    public Map<String, Object> members(String roomId) {
        requireRoom(roomId);
        List<Map<String, Object>> members = projection.memberStates(roomId).stream()
                .map(RoomQueryService::memberEntry)
                .collect(Collectors.toList());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room_id", roomId);
        response.put("members", members);
        response.put("offset", 0);
        response.put("total", members.size());
        return response;
    }

    private static Map<String, Object> memberEntry(PduRecord memberEvent) {
        Map<String, Object> content = memberEvent.getContent() != null ? memberEvent.getContent() : Map.of();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("room_id", memberEvent.getRoomId());
        entry.put("user_id", memberEvent.getStateKey());
        entry.put("membership", MembershipProjection.membershipOf(memberEvent).wireValue());
        entry.put("display_name", content.get("displayname"));
        entry.put("avatar_url", content.get("avatar_url"));
        entry.put("event_id", memberEvent.getEventId());
        return entry;
    }

    private void requireRoom(String roomId) {
        if (!eventStore.roomExists(roomId)) {
            throw FederationException.notFound("Unknown room " + roomId);
        }
    }

    private static List<Map<String, Object>> pdus(List<PduRecord> events) {
        return events.stream().map(PduRecord::toPdu).collect(Collectors.toList());
    }

    private static List<String> ids(List<PduRecord> events) {
        return events.stream().map(PduRecord::getEventId).collect(Collectors.toList());
    }
}
