package com.example.federation.store;

import com.example.federation.model.PduRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for PDUs and room state, keyed by (room_id, event_id).
 */
public interface EventStore {

    /**
     * Insert-if-absent. An event id already present is left untouched and
     * reported with {@code created == false}.
     */
    PersistResult upsert(PduRecord pdu);

    Optional<PduRecord> findEvent(String eventId);

    List<PduRecord> findEvents(Collection<String> eventIds);

    /**
     * Current state of the room: per (type, state_key), the newest state event.
     */
    List<PduRecord> currentState(String roomId);

    Optional<PduRecord> currentStateEvent(String roomId, String type, String stateKey);

    /**
     * Every member event ever recorded for the user in the room, oldest first.
     */
    List<PduRecord> memberEvents(String roomId, String userId);

    boolean roomExists(String roomId);

    List<String> latestEventIds(String roomId);

    void delete(String eventId);

    class PersistResult {
        private final PduRecord record;
        private final boolean created;

        private PersistResult(PduRecord record, boolean created) {
            this.record = record;
            this.created = created;
        }

        public static PersistResult created(PduRecord record) {
            return new PersistResult(record, true);
        }

        public static PersistResult alreadyPresent(PduRecord record) {
            return new PersistResult(record, false);
        }

        public PduRecord getRecord() { return record; }
        public boolean isCreated() { return created; }
    }
}
