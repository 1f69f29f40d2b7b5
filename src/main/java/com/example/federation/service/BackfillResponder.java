package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.PduRecord;
import com.example.federation.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Serves room history to remote servers by walking prev_events backwards and
 * returning the collected events in causal order.
 */
@Service
public class BackfillResponder {

    private static final Logger logger = LoggerFactory.getLogger(BackfillResponder.class);
    static final int DEFAULT_MISSING_EVENTS_LIMIT = 10;

    private final EventStore eventStore;
    private final DagOrderer dagOrderer;
    private final ServerKeyAuthority keyAuthority;

    @Value("${app.federation.backfill.max-limit:100}")
    private int maxLimit = 100;

    public BackfillResponder(EventStore eventStore, DagOrderer dagOrderer, ServerKeyAuthority keyAuthority) {
        this.eventStore = eventStore;
        this.dagOrderer = dagOrderer;
        this.keyAuthority = keyAuthority;
    }

    /**
     * Up to {@code limit} events reachable from {@code from}, the starting
     * events included.
     */
    public Map<String, Object> backfill(String roomId, List<String> from, Integer limit) {
        if (from == null || from.isEmpty()) {
            throw FederationException.missingParam("v");
        }
        if (!eventStore.roomExists(roomId)) {
            throw FederationException.notFound("Unknown room " + roomId);
        }
        int effectiveLimit = clamp(limit, DEFAULT_MISSING_EVENTS_LIMIT);

        List<PduRecord> collected = walkBack(roomId, from, Set.of(), effectiveLimit, null);
        List<PduRecord> ordered = dagOrderer.order(collected);
        logger.debug("Backfill of {} from {} returned {} events", roomId, from, ordered.size());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("origin", keyAuthority.getServerName());
        response.put("origin_server_ts", System.currentTimeMillis());
        response.put("pdus", ordered.stream().map(PduRecord::toPdu).collect(Collectors.toList()));
        response.put("limit", effectiveLimit);
        return response;
    }

    /**
     * Events between {@code earliest_events} and {@code latest_events},
     * exclusive at both ends.
     */
    public Map<String, Object> getMissingEvents(String roomId, Map<String, Object> body) {
        if (body == null) {
            throw FederationException.badRequest("Request body required");
        }
        List<String> latest = stringList(body.get("latest_events"), "latest_events");
        if (latest.isEmpty()) {
            throw FederationException.missingParam("latest_events");
        }
        List<String> earliest = body.containsKey("earliest_events")
                ? stringList(body.get("earliest_events"), "earliest_events")
                : List.of();
        Object rawLimit = body.get("limit");
        Object rawMinDepth = body.get("min_depth");
        int effectiveLimit = clamp(rawLimit instanceof Number ? ((Number) rawLimit).intValue() : null,
                DEFAULT_MISSING_EVENTS_LIMIT);
        Long minDepth = rawMinDepth instanceof Number ? ((Number) rawMinDepth).longValue() : null;
        if (!eventStore.roomExists(roomId)) {
            throw FederationException.notFound("Unknown room " + roomId);
        }

        List<String> start = new ArrayList<>();
        for (PduRecord event : inRoom(roomId, eventStore.findEvents(latest))) {
            start.addAll(event.getPrevEvents() != null ? event.getPrevEvents() : List.of());
        }
        Set<String> stop = new HashSet<>(earliest);
        stop.addAll(latest);
        List<PduRecord> collected = walkBack(roomId, start, stop, effectiveLimit, minDepth);
        logger.debug("get_missing_events for {} returned {} events", roomId, collected.size());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("events", dagOrderer.order(collected).stream().map(PduRecord::toPdu).collect(Collectors.toList()));
        return response;
    }

    /**
     * Breadth-first over prev_events. Ids in {@code stop} are neither collected
     * nor walked through.
     */
    private List<PduRecord> walkBack(String roomId, Collection<String> start, Set<String> stop, int limit, Long minDepth) {
        List<PduRecord> collected = new ArrayList<>();
        Set<String> seen = new HashSet<>(stop);
        Deque<String> frontier = new ArrayDeque<>();
        for (String id : start) {
            if (seen.add(id)) {
                frontier.add(id);
            }
        }
        while (!frontier.isEmpty() && collected.size() < limit) {
            List<String> batch = new ArrayList<>(frontier);
            frontier.clear();
            Map<String, PduRecord> found = inRoom(roomId, eventStore.findEvents(batch)).stream()
                    .collect(Collectors.toMap(PduRecord::getEventId, Function.identity(), (a, b) -> a));
            for (String id : batch) {
                PduRecord event = found.get(id);
                if (event == null || collected.size() >= limit) {
                    continue;
                }
                if (minDepth != null && event.getDepth() != null && event.getDepth() < minDepth) {
                    continue;
                }
                collected.add(event);
                if (event.getPrevEvents() == null) {
                    continue;
                }
                for (String parent : event.getPrevEvents()) {
                    if (seen.add(parent)) {
                        frontier.add(parent);
                    }
                }
            }
        }
        return collected;
    }

    private static List<PduRecord> inRoom(String roomId, List<PduRecord> events) {
        return events.stream().filter(e -> roomId.equals(e.getRoomId())).collect(Collectors.toList());
    }

    private int clamp(Integer requested, int fallback) {
        int value = requested == null ? fallback : requested;
        if (value < 1) {
            throw FederationException.badRequest("limit must be positive");
        }
        return Math.min(value, maxLimit);
    }

    private static List<String> stringList(Object value, String field) {
        if (!(value instanceof List)) {
            throw FederationException.badRequest(field + " must be an array of event ids");
        }
        List<String> ids = new ArrayList<>();
        for (Object id : (List<?>) value) {
            if (!(id instanceof String)) {
                throw FederationException.badRequest(field + " must be an array of event ids");
            }
            ids.add((String) id);
        }
        return ids;
    }
}
