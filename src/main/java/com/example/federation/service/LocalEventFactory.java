package com.example.federation.service;

import com.example.federation.model.Membership;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds member events on top of a room's current forward extremities.
 */
@Component
public class LocalEventFactory {

    private final EventStore eventStore;
    private final PduValidator validator;
    private final ServerKeyAuthority keyAuthority;

    public LocalEventFactory(EventStore eventStore, PduValidator validator, ServerKeyAuthority keyAuthority) {
        this.eventStore = eventStore;
        this.validator = validator;
        this.keyAuthority = keyAuthority;
    }

    /**
     * Unsigned member event skeleton without an event id, as handed out by
     * make_join and make_leave.
     */
    public Map<String, Object> memberTemplate(String roomId, String sender, String target, Membership membership) {
        List<String> prevEvents = eventStore.latestEventIds(roomId);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("membership", membership.wireValue());

        Map<String, Object> template = new LinkedHashMap<>();
        template.put("room_id", roomId);
        template.put("sender", sender);
        template.put("type", MembershipProjection.MEMBER_EVENT);
        template.put("state_key", target);
        template.put("content", content);
        template.put("origin", domainOf(sender));
        template.put("origin_server_ts", System.currentTimeMillis());
        template.put("prev_events", prevEvents);
        template.put("auth_events", authEventIds(roomId, sender, target));
        template.put("depth", nextDepth(prevEvents));
        return template;
    }

    /**
     * A complete member event authored by this server, with its reference-hash id.
     */
    public PduRecord memberEvent(String roomId, String sender, String target, Map<String, Object> content) {
        Map<String, Object> pdu = memberTemplate(roomId, sender, target, Membership.fromWire(content.get("membership")));
        pdu.put("content", new LinkedHashMap<>(content));
        pdu.put("origin", keyAuthority.getServerName());
        pdu.put("event_id", validator.referenceEventId(pdu));
        return validator.validate(pdu, keyAuthority.getServerName());
    }

    private List<String> authEventIds(String roomId, String sender, String target) {
        Set<String> ids = new LinkedHashSet<>();
        addIfPresent(ids, eventStore.currentStateEvent(roomId, "m.room.create", ""));
        addIfPresent(ids, eventStore.currentStateEvent(roomId, "m.room.power_levels", ""));
        addIfPresent(ids, eventStore.currentStateEvent(roomId, "m.room.join_rules", ""));
        addIfPresent(ids, eventStore.currentStateEvent(roomId, MembershipProjection.MEMBER_EVENT, sender));
        if (!target.equals(sender)) {
            addIfPresent(ids, eventStore.currentStateEvent(roomId, MembershipProjection.MEMBER_EVENT, target));
        }
        return new ArrayList<>(ids);
    }

    private static void addIfPresent(Set<String> ids, Optional<PduRecord> event) {
        event.ifPresent(e -> ids.add(e.getEventId()));
    }

    private long nextDepth(List<String> prevEvents) {
        long max = 0;
        for (PduRecord prev : eventStore.findEvents(prevEvents)) {
            if (prev.getDepth() != null && prev.getDepth() > max) {
                max = prev.getDepth();
            }
        }
        return max + 1;
    }

    static String domainOf(String userId) {
        int colon = userId.indexOf(':');
        return colon >= 0 ? userId.substring(colon + 1) : userId;
    }
}
