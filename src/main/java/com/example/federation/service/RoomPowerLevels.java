package com.example.federation.service;

import com.example.federation.model.PduRecord;

import java.util.List;
import java.util.Map;

/**
 * Power levels of a room as read from its current state. Without an
 * {@code m.room.power_levels} event the creator holds 100 and everyone else 0.
 */
class RoomPowerLevels {

    static final int ADMIN_LEVEL = 100;
    private static final int DEFAULT_KICK_BAN = 50;

    private final String creator;
    private final Map<?, ?> users;
    private final boolean explicit;
    private final int usersDefault;
    private final int kickLevel;
    private final int banLevel;

    private RoomPowerLevels(String creator, Map<?, ?> users, boolean explicit, int usersDefault, int kickLevel, int banLevel) {
        this.creator = creator;
        this.users = users;
        this.explicit = explicit;
        this.usersDefault = usersDefault;
        this.kickLevel = kickLevel;
        this.banLevel = banLevel;
    }

    static RoomPowerLevels from(List<PduRecord> currentState) {
        String creator = null;
        Map<String, Object> levels = null;
        for (PduRecord e : currentState) {
            if ("m.room.create".equals(e.getType()) && "".equals(e.getStateKey())) {
                Object declared = e.getContent() != null ? e.getContent().get("creator") : null;
                creator = declared instanceof String ? (String) declared : e.getSender();
            } else if ("m.room.power_levels".equals(e.getType()) && "".equals(e.getStateKey())) {
                levels = e.getContent();
            }
        }
        if (levels == null) {
            return new RoomPowerLevels(creator, Map.of(), false, 0, DEFAULT_KICK_BAN, DEFAULT_KICK_BAN);
        }
        Object users = levels.get("users");
        return new RoomPowerLevels(creator,
                users instanceof Map ? (Map<?, ?>) users : Map.of(),
                true,
                intOf(levels.get("users_default"), 0),
                intOf(levels.get("kick"), DEFAULT_KICK_BAN),
                intOf(levels.get("ban"), DEFAULT_KICK_BAN));
    }

    String getCreator() {
        return creator;
    }

    boolean isExplicit() {
        return explicit;
    }

    int levelOf(String userId) {
        if (!explicit) {
            return userId != null && userId.equals(creator) ? ADMIN_LEVEL : 0;
        }
        return intOf(users.get(userId), usersDefault);
    }

    boolean isAdmin(String userId) {
        return levelOf(userId) >= ADMIN_LEVEL;
    }

    int getKickLevel() {
        return kickLevel;
    }

    int getBanLevel() {
        return banLevel;
    }

    private static int intOf(Object value, int fallback) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
