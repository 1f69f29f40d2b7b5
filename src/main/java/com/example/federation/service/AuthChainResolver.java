package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import com.example.federation.store.StateSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Authorization context of a room. Always reads current state from the store;
 * nothing here is cached across requests.
 */
@Service
public class AuthChainResolver {

    public static final Set<String> AUTH_EVENT_TYPES = Set.of(
            "m.room.create",
            "m.room.member",
            "m.room.power_levels",
            "m.room.join_rules",
            "m.room.history_visibility");

    private final EventStore eventStore;

    public AuthChainResolver(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    /**
     * Current state events of auth-relevant types. A superset of any single
     * event's auth chain.
     */
    public List<PduRecord> resolve(String roomId) {
        return eventStore.currentState(roomId).stream()
                .filter(e -> AUTH_EVENT_TYPES.contains(e.getType()))
                .collect(Collectors.toList());
    }

    /**
     * Transitive closure over the {@code auth_events} edges of {@code event},
     * not including the event itself. Events missing from the store end that
     * branch of the walk.
     */
    public List<PduRecord> resolveTransitive(PduRecord event) {
        Set<String> visited = new HashSet<>();
        visited.add(event.getEventId());
        Deque<String> pending = new ArrayDeque<>();
        for (String id : authEventsOf(event)) {
            if (visited.add(id)) {
                pending.push(id);
            }
        }

        List<PduRecord> chain = new ArrayList<>();
        while (!pending.isEmpty()) {
            List<String> batch = new ArrayList<>(pending);
            pending.clear();
            for (PduRecord authEvent : eventStore.findEvents(batch)) {
                chain.add(authEvent);
                for (String id : authEventsOf(authEvent)) {
                    if (visited.add(id)) {
                        pending.push(id);
                    }
                }
            }
        }
        chain.sort(StateSnapshot.NEWEST_LAST);
        return chain;
    }

    /**
     * Auth chain of one event of the room: its transitive auth_events when it
     * has any, otherwise the room's auth-relevant current state.
     */
    public List<PduRecord> authChainFor(String roomId, String eventId) {
        PduRecord event = eventStore.findEvent(eventId)
                .filter(e -> roomId.equals(e.getRoomId()))
                .orElseThrow(() -> FederationException.notFound("Event " + eventId + " not found in room " + roomId));
        if (!authEventsOf(event).isEmpty()) {
            return resolveTransitive(event);
        }
        return resolve(roomId);
    }

    private static List<String> authEventsOf(PduRecord event) {
        return event.getAuthEvents() != null ? event.getAuthEvents() : List.of();
    }
}
