package com.example.federation.store;

import com.example.federation.model.PduRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StateSnapshotTest {

    private static PduRecord state(String id, String type, String stateKey, Long ts) {
        return PduRecord.builder()
                .eventId(id)
                .roomId("!room:a.test")
                .sender("@alice:a.test")
                .type(type)
                .stateKey(stateKey)
                .content(Map.of())
                .originServerTs(ts)
                .build();
    }

    @Test
    void testCurrent_NewestEventWinsPerTypeAndStateKey() {
        // Given
        List<PduRecord> events = List.of(
                state("$topic2", "m.room.topic", "", 20L),
                state("$topic1", "m.room.topic", "", 10L),
                state("$bob", "m.room.member", "@bob:a.test", 5L),
                state("$alice", "m.room.member", "@alice:a.test", 1L));

        // When
        List<PduRecord> current = StateSnapshot.current(events);

        // Then
        assertEquals(List.of("$alice", "$bob", "$topic2"),
                current.stream().map(PduRecord::getEventId).collect(Collectors.toList()));
    }

    @Test
    void testCurrent_EqualTimestampsBreakTiesByEventId() {
        // Given
        PduRecord first = state("$aaa", "m.room.name", "", 7L);
        PduRecord second = state("$bbb", "m.room.name", "", 7L);

        // When / Then
        assertEquals(List.of(second), StateSnapshot.current(List.of(second, first)));
        assertEquals(List.of(second), StateSnapshot.current(List.of(first, second)));
    }

    @Test
    void testCurrent_SkipsNonStateEventsAndMissingTimestamps() {
        // Given
        PduRecord message = state("$msg", "m.room.message", null, 99L);
        PduRecord undated = state("$undated", "m.room.name", "", null);
        PduRecord dated = state("$dated", "m.room.name", "", 1L);

        // When
        List<PduRecord> current = StateSnapshot.current(List.of(message, dated, undated));

        // Then
        assertEquals(List.of(dated), current);
    }
}
