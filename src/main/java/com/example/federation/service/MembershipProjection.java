package com.example.federation.service;

import com.example.federation.model.Membership;
import com.example.federation.model.PduRecord;
import com.example.federation.model.RoomMembership;
import com.example.federation.repo.MembershipRepo;
import com.example.federation.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The (room, user) → membership view. The event store is authoritative; the
 * {@code room_memberships} collection is a projection of it.
 */
@Service
public class MembershipProjection {

    private static final Logger logger = LoggerFactory.getLogger(MembershipProjection.class);
    public static final String MEMBER_EVENT = "m.room.member";

    private final EventStore eventStore;
    private final MembershipRepo membershipRepo;

    public MembershipProjection(EventStore eventStore, MembershipRepo membershipRepo) {
        this.eventStore = eventStore;
        this.membershipRepo = membershipRepo;
    }

    public static Membership membershipOf(PduRecord memberEvent) {
        Map<String, Object> content = memberEvent.getContent();
        return Membership.fromWire(content != null ? content.get("membership") : null);
    }

    /**
     * Membership according to the room's current state.
     */
    public Membership currentMembership(String roomId, String userId) {
        return eventStore.currentStateEvent(roomId, MEMBER_EVENT, userId)
                .map(MembershipProjection::membershipOf)
                .orElse(Membership.NONE);
    }

    public RoomMembership project(PduRecord memberEvent) {
        Object displayName = memberEvent.getContent() != null ? memberEvent.getContent().get("displayname") : null;
        RoomMembership row = RoomMembership.builder()
                .id(RoomMembership.idOf(memberEvent.getRoomId(), memberEvent.getStateKey()))
                .roomId(memberEvent.getRoomId())
                .userId(memberEvent.getStateKey())
                .membership(membershipOf(memberEvent))
                .eventId(memberEvent.getEventId())
                .sender(memberEvent.getSender())
                .displayName(displayName instanceof String ? (String) displayName : null)
                .updatedAt(Instant.now())
                .build();
        membershipRepo.save(row);
        logger.info("Membership of {} in {} is now {} (event {})",
                row.getUserId(), row.getRoomId(), row.getMembership().wireValue(), row.getEventId());
        return row;
    }

    /**
     * Replays the user's member events and rewrites the projection row.
     */
    public Membership rebuild(String roomId, String userId) {
        List<PduRecord> events = eventStore.memberEvents(roomId, userId);
        if (events.isEmpty()) {
            membershipRepo.deleteById(RoomMembership.idOf(roomId, userId));
            logger.info("No member events for {} in {}, projection cleared", userId, roomId);
            return Membership.NONE;
        }
        return project(events.get(events.size() - 1)).getMembership();
    }

    /**
     * Member events of the room's current state, ordered by user id. Covers
     * members that arrived through transactions as well as handshakes.
     */
    public List<PduRecord> memberStates(String roomId) {
        return eventStore.currentState(roomId).stream()
                .filter(e -> MEMBER_EVENT.equals(e.getType()) && e.getStateKey() != null)
                .sorted(Comparator.comparing(PduRecord::getStateKey))
                .collect(Collectors.toList());
    }

    public List<String> joinedMembers(String roomId) {
        return memberStates(roomId).stream()
                .filter(e -> membershipOf(e) == Membership.JOIN)
                .map(PduRecord::getStateKey)
                .collect(Collectors.toList());
    }
}
