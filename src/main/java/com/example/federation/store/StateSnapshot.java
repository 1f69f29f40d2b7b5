package com.example.federation.store;

import com.example.federation.model.PduRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a set of state events to the current value of each
 * (type, state_key). Newer means greater origin_server_ts; equal timestamps
 * fall back to event id so the result does not depend on read order.
 */
public final class StateSnapshot {

    public static final Comparator<PduRecord> NEWEST_LAST = Comparator
            .comparing((PduRecord p) -> p.getOriginServerTs() != null ? p.getOriginServerTs() : Long.MIN_VALUE)
            .thenComparing(PduRecord::getEventId);

    private StateSnapshot() {}

    public static List<PduRecord> current(Collection<PduRecord> stateEvents) {
        Map<String, PduRecord> byKey = new LinkedHashMap<>();
        for (PduRecord pdu : stateEvents) {
            if (!pdu.isStateEvent()) {
                continue;
            }
            String key = pdu.getType() + "\u0000" + pdu.getStateKey();
            PduRecord existing = byKey.get(key);
            if (existing == null || NEWEST_LAST.compare(pdu, existing) > 0) {
                byKey.put(key, pdu);
            }
        }
        List<PduRecord> out = new ArrayList<>(byKey.values());
        out.sort(NEWEST_LAST);
        return out;
    }
}
