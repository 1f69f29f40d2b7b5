package com.example.federation.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Projection of the latest member event for one (room, user). Rebuildable from
 * the event store at any time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("room_memberships")
public class RoomMembership {
    @Id
    private String id;
    @Indexed
    private String roomId;
    private String userId;
    private Membership membership;
    private String eventId;
    private String sender;
    private String displayName;
    private Instant updatedAt;

    public static String idOf(String roomId, String userId) {
        return roomId + "|" + userId;
    }
}
