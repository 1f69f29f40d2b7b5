package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.Membership;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Membership transitions of (room, user): the two-phase join and leave
 * handshakes, invites, knocks, kicks and bans.
 * <p>
 * Writes hold the room's lock from the guard check through persisting the
 * member event and updating the projection. If the projection cannot be
 * written, a newly created event is removed again so neither becomes visible.
 */
@Service
public class MembershipHandshakeCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(MembershipHandshakeCoordinator.class);

    private static final Set<Membership> JOINABLE_FROM =
            EnumSet.of(Membership.NONE, Membership.INVITE, Membership.KNOCK, Membership.LEAVE, Membership.JOIN);
    private static final Set<Membership> LEAVABLE_FROM =
            EnumSet.of(Membership.JOIN, Membership.INVITE, Membership.KNOCK);
    private static final Set<Membership> INVITABLE_FROM =
            EnumSet.of(Membership.NONE, Membership.LEAVE);
    private static final Set<Membership> KNOCKABLE_FROM =
            EnumSet.of(Membership.NONE, Membership.INVITE);

    private final EventStore eventStore;
    private final PduValidator validator;
    private final MembershipProjection projection;
    private final LocalEventFactory eventFactory;
    private final AuthChainResolver authChainResolver;
    private final RoomLocks roomLocks;

    @Value("${app.federation.room-version:10}")
    private String roomVersion;

    public MembershipHandshakeCoordinator(EventStore eventStore,
                                          PduValidator validator,
                                          MembershipProjection projection,
                                          LocalEventFactory eventFactory,
                                          AuthChainResolver authChainResolver,
                                          RoomLocks roomLocks) {
        this.eventStore = eventStore;
        this.validator = validator;
        this.projection = projection;
        this.eventFactory = eventFactory;
        this.authChainResolver = authChainResolver;
        this.roomLocks = roomLocks;
    }

    // ---- join ----

    /**
     * Hands out a join template. Nothing is reserved: send_join does not
     * require a prior make_join.
     */
    public Map<String, Object> makeJoin(String roomId, String userId) {
        requireRoom(roomId);
        if (projection.currentMembership(roomId, userId) == Membership.BAN) {
            throw FederationException.forbidden(userId + " is banned from " + roomId);
        }
        return handshakeTemplate(roomId, userId, Membership.JOIN);
    }

    public Map<String, Object> sendJoin(String roomId, String eventId, Map<String, Object> body) {
        requireRoom(roomId);
        PduRecord event = completedMemberEvent(roomId, eventId, body, Membership.JOIN);
        PduRecord stored = applyRemote(event, JOINABLE_FROM);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("event_id", stored.getEventId());
        response.put("state", toPdus(eventStore.currentState(roomId)));
        response.put("auth_chain", toPdus(authChainResolver.resolve(roomId)));
        return response;
    }

    // ---- leave ----

    public Map<String, Object> makeLeave(String roomId, String userId) {
        requireRoom(roomId);
        Membership current = projection.currentMembership(roomId, userId);
        if (!LEAVABLE_FROM.contains(current)) {
            throw FederationException.forbidden(userId + " cannot leave " + roomId + " from " + current.wireValue());
        }
        return handshakeTemplate(roomId, userId, Membership.LEAVE);
    }

    public Map<String, Object> sendLeave(String roomId, String eventId, Map<String, Object> body) {
        requireRoom(roomId);
        PduRecord event = completedMemberEvent(roomId, eventId, body, Membership.LEAVE);
        PduRecord stored = applyRemote(event, LEAVABLE_FROM);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("event_id", stored.getEventId());
        return response;
    }

    // ---- invite ----

    /**
     * Accepts a remote invite. The body is either the invite PDU itself or
     * an envelope {@code {room_version, event, invite_room_state}}.
     */
    public Map<String, Object> receiveInvite(String roomId, String eventId, Map<String, Object> body) {
        PduRecord event = completedMemberEvent(roomId, eventId, body, Membership.INVITE);
        if (event.getStateKey().equals(event.getSender())) {
            throw FederationException.badRequest("Invite sender and invitee must differ");
        }
        PduRecord stored = applyRemote(event, INVITABLE_FROM);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("event", stored.toPdu());
        return response;
    }

    /**
     * Exchanges a third-party invite for an invite member event for the
     * resolved user.
     */
    public PduRecord thirdPartyInvite(Map<String, Object> body) {
        if (body == null) {
            throw FederationException.badRequest("Request body required");
        }
        String roomId = requireString(body, "room_id");
        String invitee = requireString(body, "invitee");
        String sender = requireString(body, "sender");
        requireRoom(roomId);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("membership", Membership.INVITE.wireValue());
        Object thirdParty = body.get("third_party_invite");
        if (thirdParty instanceof Map) {
            content.put("third_party_invite", thirdParty);
        }
        return roomLocks.withRoomLock(roomId, () -> {
            Membership current = projection.currentMembership(roomId, invitee);
            if (!INVITABLE_FROM.contains(current)) {
                throw FederationException.forbidden(invitee + " cannot be invited to " + roomId + " from " + current.wireValue());
            }
            return persistAndProject(eventFactory.memberEvent(roomId, sender, invitee, content));
        });
    }

    // ---- knock ----

    public PduRecord knock(String roomId, String userId) {
        requireRoom(roomId);
        return roomLocks.withRoomLock(roomId, () -> {
            Optional<PduRecord> currentEvent = eventStore.currentStateEvent(roomId, MembershipProjection.MEMBER_EVENT, userId);
            Membership current = currentEvent.map(MembershipProjection::membershipOf).orElse(Membership.NONE);
            if (current == Membership.KNOCK) {
                return currentEvent.get();
            }
            if (!KNOCKABLE_FROM.contains(current)) {
                throw FederationException.forbidden(userId + " cannot knock on " + roomId + " from " + current.wireValue());
            }
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("membership", Membership.KNOCK.wireValue());
            return persistAndProject(eventFactory.memberEvent(roomId, userId, userId, content));
        });
    }

    // ---- moderation ----

    /**
     * Removes {@code target} from the room with a leave event whose sender is
     * the moderator.
     */
    public PduRecord kick(String roomId, String sender, String target, String reason) {
        if (sender.equals(target)) {
            throw FederationException.badRequest("A user cannot kick themselves; use leave");
        }
        requireRoom(roomId);
        return roomLocks.withRoomLock(roomId, () -> {
            List<PduRecord> state = eventStore.currentState(roomId);
            RoomPowerLevels powers = RoomPowerLevels.from(state);
            checkModerator(roomId, state, powers, sender, target, powers.getKickLevel(), "kick");
            Membership targetMembership = membershipIn(state, target);
            if (!LEAVABLE_FROM.contains(targetMembership)) {
                throw FederationException.forbidden(target + " is not in " + roomId);
            }
            return persistAndProject(eventFactory.memberEvent(roomId, sender, target,
                    moderationContent(Membership.LEAVE, reason)));
        });
    }

    public PduRecord ban(String roomId, String sender, String target, String reason) {
        if (sender.equals(target)) {
            throw FederationException.badRequest("A user cannot ban themselves");
        }
        requireRoom(roomId);
        return roomLocks.withRoomLock(roomId, () -> {
            List<PduRecord> state = eventStore.currentState(roomId);
            RoomPowerLevels powers = RoomPowerLevels.from(state);
            checkModerator(roomId, state, powers, sender, target, powers.getBanLevel(), "ban");
            if (membershipIn(state, target) == Membership.BAN) {
                throw FederationException.forbidden(target + " is already banned from " + roomId);
            }
            return persistAndProject(eventFactory.memberEvent(roomId, sender, target,
                    moderationContent(Membership.BAN, reason)));
        });
    }

    private void checkModerator(String roomId, List<PduRecord> state, RoomPowerLevels powers,
                                String sender, String target, int requiredLevel, String action) {
        boolean admin = powers.isAdmin(sender);
        if (!admin && membershipIn(state, sender) != Membership.JOIN) {
            throw FederationException.forbidden(sender + " must be joined to " + roomId + " to " + action);
        }
        if (!admin && target.equals(powers.getCreator())) {
            throw FederationException.forbidden("Only an admin may " + action + " the creator of " + roomId);
        }
        if (powers.isExplicit()) {
            int senderLevel = powers.levelOf(sender);
            if (senderLevel < requiredLevel) {
                throw FederationException.forbidden(sender + " has power " + senderLevel + ", " + action + " requires " + requiredLevel);
            }
            if (!admin && senderLevel <= powers.levelOf(target)) {
                throw FederationException.forbidden(sender + " cannot " + action + " a user with equal or higher power");
            }
        }
    }

    private static Map<String, Object> moderationContent(Membership membership, String reason) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("membership", membership.wireValue());
        if (reason != null && !reason.isBlank()) {
            content.put("reason", reason);
        }
        return content;
    }

    private static Membership membershipIn(List<PduRecord> state, String userId) {
        return state.stream()
                .filter(e -> MembershipProjection.MEMBER_EVENT.equals(e.getType()) && userId.equals(e.getStateKey()))
                .findFirst()
                .map(MembershipProjection::membershipOf)
                .orElse(Membership.NONE);
    }

    // ---- shared steps ----

    private Map<String, Object> handshakeTemplate(String roomId, String userId, Membership membership) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("room_version", roomVersion);
        response.put("auth_events", toPdus(authChainResolver.resolve(roomId)));
        response.put("event", eventFactory.memberTemplate(roomId, userId, userId, membership));
        return response;
    }

    /**
     * Validates a member event completed by a remote server. The path event id
     * wins when the body carries none; a conflicting one is rejected.
     */
    @SuppressWarnings("unchecked")
    private PduRecord completedMemberEvent(String roomId, String eventId, Map<String, Object> body, Membership expected) {
        if (body == null) {
            throw FederationException.badRequest("Request body required");
        }
        Map<String, Object> raw;
        Object envelope = body.get("event");
        if (envelope instanceof Map) {
            raw = new LinkedHashMap<>((Map<String, Object>) envelope);
        } else if (body.containsKey("type")) {
            raw = new LinkedHashMap<>(body);
        } else {
            throw FederationException.missingParam("event");
        }
        Object bodyEventId = raw.get("event_id");
        if (bodyEventId == null) {
            raw.put("event_id", eventId);
        } else if (!eventId.equals(bodyEventId)) {
            throw FederationException.badRequest("event_id " + bodyEventId + " does not match " + eventId);
        }

        String origin = body.get("origin") instanceof String ? (String) body.get("origin") : null;
        PduRecord event = validator.validate(raw, origin);
        if (!roomId.equals(event.getRoomId())) {
            throw FederationException.badRequest("Event " + eventId + " belongs to " + event.getRoomId() + ", not " + roomId);
        }
        if (!MembershipProjection.MEMBER_EVENT.equals(event.getType())) {
            throw FederationException.badRequest("Event " + eventId + " is not an m.room.member event");
        }
        if (event.getStateKey() == null) {
            throw FederationException.badRequest("Member event " + eventId + " has no state_key");
        }
        Membership membership = MembershipProjection.membershipOf(event);
        if (membership != expected) {
            throw FederationException.badRequest("Expected membership " + expected.wireValue() + " but got " + membership.wireValue());
        }
        if (expected != Membership.INVITE && !event.getStateKey().equals(event.getSender())) {
            throw FederationException.badRequest("state_key must equal sender for " + expected.wireValue());
        }
        if (event.getOrigin() == null) {
            event.setOrigin(LocalEventFactory.domainOf(event.getSender()));
        }
        return event;
    }

    /**
     * Re-delivery of a stored event only refreshes the projection from the
     * authoritative member events.
     */
    private PduRecord applyRemote(PduRecord event, Set<Membership> allowedFrom) {
        String roomId = event.getRoomId();
        String userId = event.getStateKey();
        return roomLocks.withRoomLock(roomId, () -> {
            Optional<PduRecord> existing = eventStore.findEvent(event.getEventId());
            if (existing.isPresent()) {
                logger.debug("Member event {} already stored, rebuilding projection", event.getEventId());
                projection.rebuild(roomId, userId);
                return existing.get();
            }
            Membership current = projection.currentMembership(roomId, userId);
            if (current == Membership.BAN) {
                throw FederationException.forbidden(userId + " is banned from " + roomId);
            }
            if (!allowedFrom.contains(current)) {
                throw FederationException.forbidden("Cannot move " + userId + " in " + roomId + " from "
                        + current.wireValue() + " to " + MembershipProjection.membershipOf(event).wireValue());
            }
            return persistAndProject(event);
        });
    }

    private PduRecord persistAndProject(PduRecord event) {
        EventStore.PersistResult result;
        try {
            result = eventStore.upsert(event);
        } catch (DataAccessException e) {
            logger.error("Failed to persist member event {} in {}", event.getEventId(), event.getRoomId(), e);
            throw FederationException.internal("Failed to persist " + event.getEventId(), e);
        }
        try {
            projection.project(result.getRecord());
        } catch (RuntimeException e) {
            logger.error("Failed to project member event {} in {}", event.getEventId(), event.getRoomId(), e);
            if (result.isCreated()) {
                try {
                    eventStore.delete(event.getEventId());
                } catch (RuntimeException rollback) {
                    logger.error("Could not remove unprojected event {}", event.getEventId(), rollback);
                    e.addSuppressed(rollback);
                }
            }
            throw FederationException.internal("Failed to update membership for " + event.getEventId(), e);
        }
        return result.getRecord();
    }

    private void requireRoom(String roomId) {
        if (!eventStore.roomExists(roomId)) {
            throw FederationException.notFound("Unknown room " + roomId);
        }
    }

    private static String requireString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw FederationException.missingParam(field);
        }
        return (String) value;
    }

    static List<Map<String, Object>> toPdus(List<PduRecord> events) {
        return events.stream().map(PduRecord::toPdu).collect(Collectors.toList());
    }
}
