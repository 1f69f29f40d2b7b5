package com.example.federation.mcp;

import com.example.federation.model.Membership;
import com.example.federation.model.PduRecord;
import com.example.federation.service.KeyQueryService;
import com.example.federation.service.MembershipHandshakeCoordinator;
import com.example.federation.service.MembershipProjection;
import com.example.federation.service.RemoteKeyCache;
import com.example.federation.service.RoomQueryService;
import com.example.federation.service.ServerKeyAuthority;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
public class FederationTools {

    private final ServerKeyAuthority keyAuthority;
    private final KeyQueryService keyQueryService;
    private final RemoteKeyCache remoteKeyCache;
    private final RoomQueryService roomQueryService;
    private final MembershipProjection projection;
    private final MembershipHandshakeCoordinator coordinator;

    public FederationTools(ServerKeyAuthority keyAuthority,
                           KeyQueryService keyQueryService,
                           RemoteKeyCache remoteKeyCache,
                           RoomQueryService roomQueryService,
                           MembershipProjection projection,
                           MembershipHandshakeCoordinator coordinator) {
        this.keyAuthority = keyAuthority;
        this.keyQueryService = keyQueryService;
        this.remoteKeyCache = remoteKeyCache;
        this.roomQueryService = roomQueryService;
        this.projection = projection;
        this.coordinator = coordinator;
    }

    @Tool(description = "Show this server's signed verify key response")
    public Map<String, Object> federation_server_key() {
        return keyAuthority.serverKeyResponse();
    }

    @Tool(description = "Look up a verify key of a remote server, fetching and caching it when needed")
    public Map<String, Object> federation_query_key(String serverName, String keyId) {
        return keyQueryService.query(serverName, keyId);
    }

    @Tool(description = "Drop a cached remote verify key so the next lookup refetches it")
    public Map<String, Object> federation_invalidate_key(String serverName, String keyId) {
        remoteKeyCache.invalidate(serverName, keyId);
        return Map.of("ok", true, "server_name", serverName, "key_id", keyId);
    }

    @Tool(description = "List the auth-relevant current state of a room")
    public Map<String, Object> federation_auth_chain(String roomId) {
        return roomQueryService.roomAuth(roomId);
    }

    @Tool(description = "Read the current membership of a user in a room")
    public Map<String, Object> federation_membership(String roomId, String userId) {
        return membershipResult(roomId, userId, projection.currentMembership(roomId, userId));
    }

    @Tool(description = "Rebuild the membership projection of a user in a room from its member events")
    public Map<String, Object> federation_rebuild_membership(String roomId, String userId) {
        Map<String, Object> result = membershipResult(roomId, userId, projection.rebuild(roomId, userId));
        result.put("rebuilt", true);
        return result;
    }

    @Tool(description = "Kick a user from a room on behalf of a joined member or admin")
    public Map<String, Object> federation_kick(String roomId, String sender, String target, String reason) {
        return eventResult(coordinator.kick(roomId, sender, target, reason));
    }

    @Tool(description = "Ban a user from a room on behalf of a joined member or admin")
    public Map<String, Object> federation_ban(String roomId, String sender, String target, String reason) {
        return eventResult(coordinator.ban(roomId, sender, target, reason));
    }

    private static Map<String, Object> membershipResult(String roomId, String userId, Membership membership) {
        Map<String, Object> result = new HashMap<>();
        result.put("room_id", roomId);
        result.put("user_id", userId);
        result.put("membership", membership.wireValue());
        return result;
    }

    private static Map<String, Object> eventResult(PduRecord event) {
        Map<String, Object> result = new HashMap<>();
        result.put("ok", true);
        result.put("event_id", event.getEventId());
        result.put("event", event.toPdu());
        return result;
    }
}
