package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validates a candidate PDU and writes it through the {@link EventStore}.
 * Nothing else happens on write; subscribers to new events live elsewhere.
 */
@Service
public class PduPersister {

    private static final Logger logger = LoggerFactory.getLogger(PduPersister.class);

    private final PduValidator validator;
    private final EventStore eventStore;

    public PduPersister(PduValidator validator, EventStore eventStore) {
        this.validator = validator;
        this.eventStore = eventStore;
    }

    /**
     * Validation only. The outcome is either failed or carries the record to persist.
     */
    public PduOutcome validate(Map<String, Object> raw, String origin) {
        try {
            return PduOutcome.validated(validator.validate(raw, origin));
        } catch (FederationException e) {
            String eventId = bestEffortEventId(raw);
            logger.warn("Rejected PDU {} from {}: {}", eventId, origin, e.getMessage());
            return PduOutcome.failure(eventId, e.getMessage());
        }
    }

    /**
     * Idempotent write of an already validated record.
     */
    public PduOutcome persist(PduRecord record) {
        try {
            EventStore.PersistResult result = eventStore.upsert(record);
            if (!result.isCreated()) {
                logger.debug("Event {} already present, skipping", record.getEventId());
            }
            return PduOutcome.persisted(result.getRecord(), result.isCreated());
        } catch (RuntimeException e) {
            logger.error("Failed to persist PDU {}", record.getEventId(), e);
            return PduOutcome.failure(record.getEventId(), "Failed to persist event: " + e.getMessage());
        }
    }

    public PduOutcome accept(Map<String, Object> raw, String origin) {
        PduOutcome validated = validate(raw, origin);
        return validated.isSuccess() ? persist(validated.getRecord()) : validated;
    }

    private String bestEffortEventId(Map<String, Object> raw) {
        if (raw == null) {
            return "";
        }
        Object id = raw.get("event_id");
        if (id instanceof String && !((String) id).isEmpty()) {
            return (String) id;
        }
        try {
            return validator.referenceEventId(raw);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Per-event result, as reported back to the sending server.
     */
    public static class PduOutcome {
        private final String eventId;
        private final PduRecord record;
        private final boolean created;
        private final String error;

        private PduOutcome(String eventId, PduRecord record, boolean created, String error) {
            this.eventId = eventId;
            this.record = record;
            this.created = created;
            this.error = error;
        }

        static PduOutcome validated(PduRecord record) {
            return new PduOutcome(record.getEventId(), record, false, null);
        }

        static PduOutcome persisted(PduRecord record, boolean created) {
            return new PduOutcome(record.getEventId(), record, created, null);
        }

        static PduOutcome failure(String eventId, String error) {
            return new PduOutcome(eventId, null, false, error);
        }

        public boolean isSuccess() { return error == null; }
        public String getEventId() { return eventId; }
        public PduRecord getRecord() { return record; }
        public boolean isCreated() { return created; }
        public String getError() { return error; }

        public Map<String, Object> toMap() {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("event_id", eventId);
            if (isSuccess()) {
                result.put("success", true);
            } else {
                result.put("error", error);
            }
            return result;
        }
    }
}
