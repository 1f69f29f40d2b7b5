package com.example.federation.service;

import com.example.federation.model.PduRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Orders events so that every parent present in the batch precedes its
 * children (Kahn's algorithm, FIFO seeded in input order). Parents outside the
 * batch are ignored. When the batch cannot be fully ordered the input order is
 * returned unchanged.
 */
@Component
public class DagOrderer {

    private static final Logger logger = LoggerFactory.getLogger(DagOrderer.class);

    public List<PduRecord> order(List<PduRecord> pdus) {
        return order(pdus, PduRecord::getEventId, PduRecord::getPrevEvents);
    }

    public <T> List<T> order(List<T> items, Function<T, String> idOf, Function<T, ? extends Collection<String>> parentsOf) {
        int n = items.size();
        if (n < 2) {
            return new ArrayList<>(items);
        }

        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            String id = idOf.apply(items.get(i));
            if (id != null) {
                indexById.putIfAbsent(id, i);
            }
        }

        List<List<Integer>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            children.add(new ArrayList<>());
        }
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            Collection<String> parents = parentsOf.apply(items.get(i));
            if (parents == null) {
                continue;
            }
            for (String parentId : new LinkedHashSet<>(parents)) {
                Integer parent = indexById.get(parentId);
                if (parent != null) {
                    children.get(parent).add(i);
                    inDegree[i]++;
                }
            }
        }

        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }

        List<T> sorted = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int u = ready.poll();
            sorted.add(items.get(u));
            for (int child : children.get(u)) {
                if (--inDegree[child] == 0) {
                    ready.add(child);
                }
            }
        }

        if (sorted.size() < n) {
            logger.warn("Event graph of {} events has a cycle ({} ordered), keeping input order", n, sorted.size());
            return new ArrayList<>(items);
        }
        return sorted;
    }
}
