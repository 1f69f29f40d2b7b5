package com.example.federation.service;

import com.example.federation.model.PduRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DagOrdererTest {

    private DagOrderer dagOrderer;

    @BeforeEach
    void setUp() {
        dagOrderer = new DagOrderer();
    }

    private static PduRecord pdu(String id, String... prev) {
        return PduRecord.builder()
                .eventId(id)
                .roomId("!room:a.test")
                .sender("@u:a.test")
                .type("m.room.message")
                .originServerTs(1L)
                .prevEvents(List.of(prev))
                .build();
    }

    private static List<String> ids(List<PduRecord> pdus) {
        return pdus.stream().map(PduRecord::getEventId).collect(Collectors.toList());
    }

    @Test
    void testOrder_ChainSubmittedInReverse() {
        // Given
        PduRecord a = pdu("$A");
        PduRecord b = pdu("$B", "$A");
        PduRecord c = pdu("$C", "$B");

        // When
        List<PduRecord> ordered = dagOrderer.order(List.of(c, b, a));

        // Then
        assertEquals(List.of("$A", "$B", "$C"), ids(ordered));
    }

    @Test
    void testOrder_CycleFallsBackToInputOrder() {
        // Given
        PduRecord a = pdu("$A", "$B");
        PduRecord b = pdu("$B", "$A");

        // When
        List<PduRecord> ordered = dagOrderer.order(List.of(a, b));

        // Then
        assertEquals(List.of("$A", "$B"), ids(ordered));
    }

    @Test
    void testOrder_ParentsOutsideBatchAreIgnored() {
        // Given
        PduRecord x = pdu("$X", "$unknown");
        PduRecord y = pdu("$Y", "$X", "$other");

        // When
        List<PduRecord> ordered = dagOrderer.order(List.of(y, x));

        // Then
        assertEquals(List.of("$X", "$Y"), ids(ordered));
    }

    @Test
    void testOrder_IndependentEventsKeepInputOrder() {
        // Given
        PduRecord root = pdu("$R");
        PduRecord left = pdu("$L", "$R");
        PduRecord right = pdu("$Q", "$R");
        PduRecord merge = pdu("$M", "$Q", "$L");

        // When
        List<PduRecord> ordered = dagOrderer.order(List.of(merge, right, left, root));

        // Then
        assertEquals(List.of("$R", "$Q", "$L", "$M"), ids(ordered));
    }

    @Test
    void testOrder_DuplicateParentCountsOnce() {
        // Given
        PduRecord a = pdu("$A");
        PduRecord b = pdu("$B", "$A", "$A");

        // When
        List<PduRecord> ordered = dagOrderer.order(List.of(b, a));

        // Then
        assertEquals(List.of("$A", "$B"), ids(ordered));
    }

    @Test
    void testOrder_EmptyAndSingleton() {
        assertTrue(dagOrderer.order(List.of()).isEmpty());
        assertEquals(List.of("$A"), ids(dagOrderer.order(List.of(pdu("$A", "$A")))));
    }
}
