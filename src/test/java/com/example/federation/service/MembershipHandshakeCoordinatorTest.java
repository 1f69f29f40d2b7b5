package com.example.federation.service;

import com.example.federation.error.ErrorKind;
import com.example.federation.error.FederationException;
import com.example.federation.model.Membership;
import com.example.federation.model.PduRecord;
import com.example.federation.model.RoomMembership;
import com.example.federation.repo.MembershipRepo;
import com.example.federation.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MembershipHandshakeCoordinatorTest {

    private static final String ROOM = "!room:a.test";
    private static final String ALICE = "@alice:a.test";
    private static final String BOB = "@bob:a.test";
    private static final String CAROL = "@carol:b.test";
    private static final String ZED = "@zed:remote.test";

    @Mock
    private MembershipRepo membershipRepo;

    private InMemoryEventStore eventStore;
    private RoomLocks roomLocks;
    private MembershipHandshakeCoordinator coordinator;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        roomLocks = new RoomLocks();
        PduValidator validator = new PduValidator(new CanonicalJson());
        ServerKeyAuthority keyAuthority = new ServerKeyAuthority(new CanonicalJson());
        ReflectionTestUtils.setField(keyAuthority, "serverName", "a.test");
        MembershipProjection projection = new MembershipProjection(eventStore, membershipRepo);
        coordinator = new MembershipHandshakeCoordinator(eventStore, validator, projection,
                new LocalEventFactory(eventStore, validator, keyAuthority),
                new AuthChainResolver(eventStore), roomLocks);
        ReflectionTestUtils.setField(coordinator, "roomVersion", "10");
    }

    private static PduRecord stateEvent(String id, String type, String stateKey, String sender,
                                        Map<String, Object> content, long ts, String... prev) {
        return PduRecord.builder()
                .eventId(id)
                .roomId(ROOM)
                .sender(sender)
                .type(type)
                .stateKey(stateKey)
                .content(content)
                .originServerTs(ts)
                .prevEvents(List.of(prev))
                .depth(ts)
                .build();
    }

    private static PduRecord member(String id, String userId, String membership, long ts, String prev) {
        return stateEvent(id, "m.room.member", userId, userId, Map.of("membership", membership), ts, prev);
    }

    /**
     * Alice created the room; Alice and Bob are joined, Carol is joined from b.test.
     */
    private void seedRoom() {
        eventStore.add(
                stateEvent("$create", "m.room.create", "", ALICE, Map.of("creator", ALICE), 1),
                member("$alice", ALICE, "join", 2, "$create"),
                member("$bob", BOB, "join", 3, "$alice"),
                member("$carol", CAROL, "join", 4, "$bob"));
    }

    private void seedPowerLevels(Map<String, Object> users) {
        eventStore.add(stateEvent("$power", "m.room.power_levels", "", ALICE,
                Map.of("users", users, "kick", 50, "ban", 50), 5, "$carol"));
    }

    private static Map<String, Object> remoteMember(String sender, String stateKey, String membership) {
        Map<String, Object> event = new HashMap<>();
        event.put("room_id", ROOM);
        event.put("sender", sender);
        event.put("type", "m.room.member");
        event.put("state_key", stateKey);
        event.put("content", Map.of("membership", membership));
        event.put("origin_server_ts", System.currentTimeMillis());
        event.put("prev_events", List.of("$carol"));
        event.put("auth_events", List.of("$create"));
        event.put("depth", 5);
        Map<String, Object> body = new HashMap<>();
        body.put("origin", "remote.test");
        body.put("event", event);
        return body;
    }

    private static ErrorKind kindOf(Runnable call) {
        return assertThrows(FederationException.class, call::run).getKind();
    }

    private Membership membershipOf(String userId) {
        return eventStore.currentStateEvent(ROOM, "m.room.member", userId)
                .map(MembershipProjection::membershipOf)
                .orElse(Membership.NONE);
    }

    // ---- kick / ban guards ----

    @Test
    void testKick_NonAdminCannotKickCreator() {
        // Given
        seedRoom();
        int before = eventStore.size();

        // When
        ErrorKind kind = kindOf(() -> coordinator.kick(ROOM, BOB, ALICE, "bye"));

        // Then
        assertEquals(ErrorKind.FORBIDDEN, kind);
        assertEquals(before, eventStore.size());
        assertEquals(Membership.JOIN, membershipOf(ALICE));
        verify(membershipRepo, never()).save(any(RoomMembership.class));
    }

    @Test
    void testKick_JoinedMemberKicksOtherMember() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        PduRecord kick = coordinator.kick(ROOM, BOB, CAROL, "spam");

        // Then
        assertEquals(BOB, kick.getSender());
        assertEquals(CAROL, kick.getStateKey());
        assertEquals("leave", kick.getContent().get("membership"));
        assertEquals("spam", kick.getContent().get("reason"));
        assertEquals("a.test", kick.getOrigin());
        assertTrue(kick.getPrevEvents().contains("$carol"));
        assertTrue(kick.getAuthEvents().containsAll(List.of("$create", "$bob", "$carol")));
        assertEquals(5L, kick.getDepth());
        assertEquals(Membership.LEAVE, membershipOf(CAROL));

        ArgumentCaptor<RoomMembership> saved = ArgumentCaptor.forClass(RoomMembership.class);
        verify(membershipRepo).save(saved.capture());
        assertEquals(Membership.LEAVE, saved.getValue().getMembership());
        assertEquals(RoomMembership.idOf(ROOM, CAROL), saved.getValue().getId());
    }

    @Test
    void testKick_SenderMustBeJoined() {
        // Given
        seedRoom();

        // When / Then
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.kick(ROOM, ZED, CAROL, null)));
        verify(membershipRepo, never()).save(any(RoomMembership.class));
    }

    @Test
    void testKick_WaitsForConcurrentWriteOnSameRoom() throws Exception {
        // Given
        seedRoom();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<?> writer = executor.submit(() -> roomLocks.withRoomLock(ROOM, () -> {
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                eventStore.add(stateEvent("$carolleft", "m.room.member", CAROL, CAROL,
                        Map.of("membership", "leave"), 6, "$carol"));
                return null;
            }));
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            // When
            Future<ErrorKind> kick = executor.submit(() -> kindOf(() -> coordinator.kick(ROOM, BOB, CAROL, "spam")));
            Thread.sleep(100);
            assertFalse(kick.isDone());
            release.countDown();
            writer.get(5, TimeUnit.SECONDS);

            // Then
            assertEquals(ErrorKind.FORBIDDEN, kick.get(5, TimeUnit.SECONDS));
            assertEquals(Membership.LEAVE, membershipOf(CAROL));
            assertEquals("$carolleft", eventStore.currentStateEvent(ROOM, "m.room.member", CAROL)
                    .orElseThrow().getEventId());
            verifyNoInteractions(membershipRepo);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testKick_TargetNotInRoom() {
        // Given
        seedRoom();

        // When / Then
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.kick(ROOM, BOB, ZED, null)));
    }

    @Test
    void testKick_SelfIsBadRequest() {
        assertEquals(ErrorKind.BAD_REQUEST, kindOf(() -> coordinator.kick(ROOM, BOB, BOB, null)));
    }

    @Test
    void testKick_UnknownRoomIsNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, kindOf(() -> coordinator.kick("!nope:a.test", BOB, CAROL, null)));
    }

    @Test
    void testKick_AdminMayKickCreator() {
        // Given
        seedRoom();
        seedPowerLevels(Map.of(ALICE, 100, BOB, 100));
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        PduRecord kick = coordinator.kick(ROOM, BOB, ALICE, null);

        // Then
        assertEquals(ALICE, kick.getStateKey());
        assertFalse(kick.getContent().containsKey("reason"));
        assertTrue(kick.getAuthEvents().contains("$power"));
        assertEquals(Membership.LEAVE, membershipOf(ALICE));
    }

    @Test
    void testBan_PowerBelowBanLevelIsForbidden() {
        // Given
        seedRoom();
        seedPowerLevels(Map.of(ALICE, 100, BOB, 10));

        // When / Then
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.ban(ROOM, BOB, CAROL, null)));
        assertEquals(Membership.JOIN, membershipOf(CAROL));
    }

    @Test
    void testBan_ModeratorCannotBanEqualPower() {
        // Given
        seedRoom();
        seedPowerLevels(Map.of(ALICE, 100, BOB, 50, CAROL, 50));

        // When / Then
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.ban(ROOM, BOB, CAROL, null)));
    }

    @Test
    void testBan_CreatorBansMemberAndBlocksRejoin() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        PduRecord ban = coordinator.ban(ROOM, ALICE, CAROL, "abuse");

        // Then
        assertEquals("ban", ban.getContent().get("membership"));
        assertEquals(Membership.BAN, membershipOf(CAROL));
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.makeJoin(ROOM, CAROL)));
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.ban(ROOM, ALICE, CAROL, null)));
    }

    // ---- join ----

    @Test
    void testMakeJoin_ReturnsTemplateAndAuthEvents() {
        // Given
        seedRoom();

        // When
        Map<String, Object> response = coordinator.makeJoin(ROOM, ZED);

        // Then
        assertEquals("10", response.get("room_version"));
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) response.get("event");
        assertEquals("m.room.member", event.get("type"));
        assertEquals(ZED, event.get("sender"));
        assertEquals(ZED, event.get("state_key"));
        assertEquals(Map.of("membership", "join"), event.get("content"));
        assertEquals(List.of("$carol"), event.get("prev_events"));
        assertEquals(5L, event.get("depth"));
        assertFalse(event.containsKey("event_id"));
        assertEquals(4, ((List<?>) response.get("auth_events")).size());
        verifyNoInteractions(membershipRepo);
    }

    @Test
    void testMakeJoin_UnknownRoomIsNotFound() {
        assertEquals(ErrorKind.NOT_FOUND, kindOf(() -> coordinator.makeJoin(ROOM, ZED)));
    }

    @Test
    void testSendJoin_AcceptedWithoutPriorMakeJoin() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Map<String, Object> response = coordinator.sendJoin(ROOM, "$zedjoin", remoteMember(ZED, ZED, "join"));

        // Then
        assertEquals("$zedjoin", response.get("event_id"));
        assertEquals(5, ((List<?>) response.get("state")).size());
        assertEquals(5, ((List<?>) response.get("auth_chain")).size());
        assertEquals(Membership.JOIN, membershipOf(ZED));
        assertEquals("remote.test", eventStore.findEvent("$zedjoin").orElseThrow().getOrigin());
        verify(membershipRepo).save(argThat(m -> m.getMembership() == Membership.JOIN && ZED.equals(m.getUserId())));
    }

    @Test
    void testSendJoin_RedeliveryRebuildsProjection() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));
        coordinator.sendJoin(ROOM, "$zedjoin", remoteMember(ZED, ZED, "join"));
        int size = eventStore.size();

        // When
        Map<String, Object> response = coordinator.sendJoin(ROOM, "$zedjoin", remoteMember(ZED, ZED, "join"));

        // Then
        assertEquals("$zedjoin", response.get("event_id"));
        assertEquals(size, eventStore.size());
        verify(membershipRepo, times(2)).save(any(RoomMembership.class));
    }

    @Test
    void testSendJoin_ProjectionFailureLeavesNothingVisible() {
        // Given
        seedRoom();
        int before = eventStore.size();
        when(membershipRepo.save(any(RoomMembership.class))).thenThrow(new IllegalStateException("write failed"));

        // When
        ErrorKind kind = kindOf(() -> coordinator.sendJoin(ROOM, "$zedjoin", remoteMember(ZED, ZED, "join")));

        // Then
        assertEquals(ErrorKind.INTERNAL, kind);
        assertEquals(before, eventStore.size());
        assertTrue(eventStore.findEvent("$zedjoin").isEmpty());
    }

    @Test
    void testSendJoin_RejectsMalformedJoins() {
        seedRoom();
        eventStore.add(PduRecord.builder().eventId("$othercreate").roomId("!other:a.test").sender(ALICE)
                .type("m.room.create").stateKey("").content(Map.of("creator", ALICE)).originServerTs(1L).build());

        assertEquals(ErrorKind.BAD_REQUEST,
                kindOf(() -> coordinator.sendJoin(ROOM, "$j", remoteMember(ZED, ZED, "leave"))));
        assertEquals(ErrorKind.BAD_REQUEST,
                kindOf(() -> coordinator.sendJoin(ROOM, "$j", remoteMember(ZED, CAROL, "join"))));
        assertEquals(ErrorKind.BAD_REQUEST,
                kindOf(() -> coordinator.sendJoin("!other:a.test", "$j", remoteMember(ZED, ZED, "join"))));

        Map<String, Object> mismatched = remoteMember(ZED, ZED, "join");
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) mismatched.get("event");
        event.put("event_id", "$different");
        assertEquals(ErrorKind.BAD_REQUEST, kindOf(() -> coordinator.sendJoin(ROOM, "$j", mismatched)));

        assertEquals(ErrorKind.MISSING_PARAM,
                kindOf(() -> coordinator.sendJoin(ROOM, "$j", Map.of("origin", "remote.test"))));
        verifyNoInteractions(membershipRepo);
    }

    @Test
    void testSendJoin_UnknownRoomIsNotFound() {
        // Given
        Map<String, Object> body = remoteMember(ZED, ZED, "join");
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) body.get("event");
        event.put("room_id", "!nowhere:a.test");

        // When
        ErrorKind kind = kindOf(() -> coordinator.sendJoin("!nowhere:a.test", "$zedjoin", body));

        // Then
        assertEquals(ErrorKind.NOT_FOUND, kind);
        assertEquals(0, eventStore.size());
        assertFalse(eventStore.roomExists("!nowhere:a.test"));
        verifyNoInteractions(membershipRepo);
    }

    @Test
    void testSendJoin_BannedUserIsForbidden() {
        // Given
        seedRoom();
        eventStore.add(stateEvent("$zedban", "m.room.member", ZED, ALICE, Map.of("membership", "ban"), 6, "$carol"));

        // When / Then
        assertEquals(ErrorKind.FORBIDDEN,
                kindOf(() -> coordinator.sendJoin(ROOM, "$zedjoin", remoteMember(ZED, ZED, "join"))));
        assertTrue(eventStore.findEvent("$zedjoin").isEmpty());
    }

    // ---- leave ----

    @Test
    void testMakeLeave_RequiresMembership() {
        seedRoom();

        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.makeLeave(ROOM, ZED)));
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) coordinator.makeLeave(ROOM, CAROL).get("event");
        assertEquals(Map.of("membership", "leave"), event.get("content"));
    }

    @Test
    void testSendLeave_FromJoin() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Map<String, Object> response = coordinator.sendLeave(ROOM, "$carolleave", remoteMember(CAROL, CAROL, "leave"));

        // Then
        assertEquals("$carolleave", response.get("event_id"));
        assertEquals(Membership.LEAVE, membershipOf(CAROL));
    }

    @Test
    void testSendLeave_NotInRoomIsForbidden() {
        seedRoom();
        assertEquals(ErrorKind.FORBIDDEN,
                kindOf(() -> coordinator.sendLeave(ROOM, "$zedleave", remoteMember(ZED, ZED, "leave"))));
    }

    @Test
    void testSendLeave_UnknownRoomIsNotFound() {
        // Given
        Map<String, Object> body = remoteMember(ZED, ZED, "leave");
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) body.get("event");
        event.put("room_id", "!nowhere:a.test");

        // When
        ErrorKind kind = kindOf(() -> coordinator.sendLeave("!nowhere:a.test", "$zedleave", body));

        // Then
        assertEquals(ErrorKind.NOT_FOUND, kind);
        assertFalse(eventStore.roomExists("!nowhere:a.test"));
        verifyNoInteractions(membershipRepo);
    }

    // ---- invite / knock ----

    @Test
    void testReceiveInvite_AcceptsBareAndEnvelopedPdu() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));
        @SuppressWarnings("unchecked")
        Map<String, Object> bare = (Map<String, Object>) remoteMember(CAROL, ZED, "invite").get("event");

        // When
        Map<String, Object> response = coordinator.receiveInvite(ROOM, "$inv", bare);

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> event = (Map<String, Object>) response.get("event");
        assertEquals("$inv", event.get("event_id"));
        assertEquals(Membership.INVITE, membershipOf(ZED));
        assertEquals("b.test", eventStore.findEvent("$inv").orElseThrow().getOrigin());
    }

    @Test
    void testReceiveInvite_JoinedUserIsForbidden() {
        seedRoom();
        assertEquals(ErrorKind.FORBIDDEN,
                kindOf(() -> coordinator.receiveInvite(ROOM, "$inv", remoteMember(ZED, CAROL, "invite"))));
    }

    @Test
    void testKnock_CreatesKnockOnceThenJoinAllowed() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        PduRecord first = coordinator.knock(ROOM, ZED);
        PduRecord second = coordinator.knock(ROOM, ZED);

        // Then
        assertEquals("knock", first.getContent().get("membership"));
        assertEquals(ZED, first.getSender());
        assertEquals(first.getEventId(), second.getEventId());
        assertEquals(Membership.KNOCK, membershipOf(ZED));
        verify(membershipRepo, times(1)).save(any(RoomMembership.class));
    }

    @Test
    void testKnock_JoinedUserIsForbidden() {
        seedRoom();
        assertEquals(ErrorKind.FORBIDDEN, kindOf(() -> coordinator.knock(ROOM, CAROL)));
    }

    @Test
    void testThirdPartyInvite_CreatesInviteEvent() {
        // Given
        seedRoom();
        when(membershipRepo.save(any(RoomMembership.class))).thenAnswer(inv -> inv.getArgument(0));
        Map<String, Object> body = new HashMap<>();
        body.put("room_id", ROOM);
        body.put("invitee", ZED);
        body.put("sender", BOB);
        body.put("third_party_invite", Map.of("display_name", "zed@example.org"));

        // When
        PduRecord invite = coordinator.thirdPartyInvite(body);

        // Then
        assertEquals(BOB, invite.getSender());
        assertEquals(ZED, invite.getStateKey());
        assertEquals("invite", invite.getContent().get("membership"));
        assertNotNull(invite.getContent().get("third_party_invite"));
        assertEquals(Membership.INVITE, membershipOf(ZED));
    }

    @Test
    void testThirdPartyInvite_MissingInvitee() {
        assertEquals(ErrorKind.MISSING_PARAM,
                kindOf(() -> coordinator.thirdPartyInvite(Map.of("room_id", ROOM, "sender", BOB))));
    }
}
