package com.example.federation.model;

import java.util.Locale;

/**
 * Values of {@code content.membership} on {@code m.room.member} events.
 */
public enum Membership {
    NONE,
    INVITE,
    KNOCK,
    JOIN,
    LEAVE,
    BAN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Membership values are case-sensitive; anything unrecognised reads as {@link #NONE}.
     */
    public static Membership fromWire(Object value) {
        if (value == null) {
            return NONE;
        }
        for (Membership membership : values()) {
            if (membership != NONE && membership.wireValue().equals(value)) {
                return membership;
            }
        }
        return NONE;
    }
}
