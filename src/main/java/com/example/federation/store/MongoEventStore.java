package com.example.federation.store;

import com.example.federation.model.PduRecord;
import com.example.federation.repo.PduRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class MongoEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventStore.class);
    private static final int EXTREMITY_WINDOW = 50;

    private final PduRepo pduRepo;
    private final MongoTemplate mongo;

    public MongoEventStore(PduRepo pduRepo, MongoTemplate mongo) {
        this.pduRepo = pduRepo;
        this.mongo = mongo;
    }

    @Override
    public PersistResult upsert(PduRecord pdu) {
        Optional<PduRecord> existing = pduRepo.findById(pdu.getEventId());
        if (existing.isPresent()) {
            return PersistResult.alreadyPresent(existing.get());
        }
        if (pdu.getReceivedAt() == null) {
            pdu.setReceivedAt(Instant.now());
        }
        try {
            PduRecord saved = pduRepo.insert(pdu);
            logger.debug("Persisted event {} in room {}", pdu.getEventId(), pdu.getRoomId());
            return PersistResult.created(saved);
        } catch (DuplicateKeyException e) {
            // lost an insert race with a concurrent delivery of the same event
            return PersistResult.alreadyPresent(pduRepo.findById(pdu.getEventId()).orElse(pdu));
        }
    }

    @Override
    public Optional<PduRecord> findEvent(String eventId) {
        return pduRepo.findById(eventId);
    }

    @Override
    public List<PduRecord> findEvents(Collection<String> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            return List.of();
        }
        List<PduRecord> out = new ArrayList<>();
        pduRepo.findAllById(eventIds).forEach(out::add);
        return out;
    }

    @Override
    public List<PduRecord> currentState(String roomId) {
        return StateSnapshot.current(pduRepo.findByRoomIdAndStateKeyNotNull(roomId));
    }

    @Override
    public Optional<PduRecord> currentStateEvent(String roomId, String type, String stateKey) {
        return pduRepo.findByRoomIdAndTypeAndStateKey(roomId, type, stateKey).stream()
                .max(StateSnapshot.NEWEST_LAST);
    }

    @Override
    public List<PduRecord> memberEvents(String roomId, String userId) {
        List<PduRecord> events = new ArrayList<>(
                pduRepo.findByRoomIdAndTypeAndStateKey(roomId, "m.room.member", userId));
        events.sort(StateSnapshot.NEWEST_LAST);
        return events;
    }

    @Override
    public boolean roomExists(String roomId) {
        return pduRepo.existsByRoomId(roomId);
    }

    /**
     * Approximates the forward extremities: among the most recent events of the
     * room, those that no other recent event names as a parent.
     */
    @Override
    public List<String> latestEventIds(String roomId) {
        Query q = new Query(Criteria.where("roomId").is(roomId))
                .with(Sort.by(Sort.Direction.DESC, "originServerTs"))
                .limit(EXTREMITY_WINDOW);
        List<PduRecord> recent = mongo.find(q, PduRecord.class);
        if (recent.isEmpty()) {
            return List.of();
        }
        Set<String> referenced = recent.stream()
                .flatMap(p -> p.getPrevEvents() == null ? Stream.<String>empty() : p.getPrevEvents().stream())
                .collect(Collectors.toSet());
        List<String> tips = recent.stream()
                .map(PduRecord::getEventId)
                .filter(id -> !referenced.contains(id))
                .collect(Collectors.toList());
        return tips.isEmpty() ? List.of(recent.get(0).getEventId()) : tips;
    }

    @Override
    public void delete(String eventId) {
        pduRepo.deleteById(eventId);
    }
}
