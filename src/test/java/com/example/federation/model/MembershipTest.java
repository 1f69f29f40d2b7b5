package com.example.federation.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MembershipTest {

    @Test
    void testFromWire_ExactLowercaseValues() {
        assertEquals(Membership.JOIN, Membership.fromWire("join"));
        assertEquals(Membership.INVITE, Membership.fromWire("invite"));
        assertEquals(Membership.KNOCK, Membership.fromWire("knock"));
        assertEquals(Membership.LEAVE, Membership.fromWire("leave"));
        assertEquals(Membership.BAN, Membership.fromWire("ban"));
    }

    @Test
    void testFromWire_OtherCasingIsNotAMembership() {
        assertEquals(Membership.NONE, Membership.fromWire("JOIN"));
        assertEquals(Membership.NONE, Membership.fromWire("Ban"));
        assertEquals(Membership.NONE, Membership.fromWire(" join"));
        assertEquals(Membership.NONE, Membership.fromWire("none"));
        assertEquals(Membership.NONE, Membership.fromWire(null));
        assertEquals(Membership.NONE, Membership.fromWire(42));
    }
}
