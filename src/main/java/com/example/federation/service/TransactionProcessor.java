package com.example.federation.service;

import com.example.federation.error.FederationException;
import com.example.federation.model.FederationTxn;
import com.example.federation.model.PduRecord;
import com.example.federation.repo.FederationTxnRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies an inbound federation transaction. Every PDU is attempted and gets
 * its own result; one bad PDU never fails the others or the request.
 */
@Service
public class TransactionProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TransactionProcessor.class);

    private final PduPersister persister;
    private final DagOrderer dagOrderer;
    private final FederationTxnRepo txnRepo;

    @Value("${app.federation.order-transaction-pdus:true}")
    private boolean orderPdus = true;

    public TransactionProcessor(PduPersister persister, DagOrderer dagOrderer, FederationTxnRepo txnRepo) {
        this.persister = persister;
        this.dagOrderer = dagOrderer;
        this.txnRepo = txnRepo;
    }

    /**
     * @return {@code {results: [{event_id, success|error}, ...]}} in the order the PDUs were supplied
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> process(String txnId, Map<String, Object> body) {
        if (body == null) {
            throw FederationException.badRequest("Transaction body required");
        }
        Object origin = body.get("origin");
        if (!(origin instanceof String) || ((String) origin).isEmpty()) {
            throw FederationException.missingParam("origin");
        }
        Object pdus = body.containsKey("pdus") ? body.get("pdus") : body.get("pdu");
        if (!(pdus instanceof List)) {
            throw FederationException.missingParam("pdus");
        }
        if (body.get("edus") instanceof List && !((List<?>) body.get("edus")).isEmpty()) {
            logger.debug("Ignoring {} EDUs in transaction {}", ((List<?>) body.get("edus")).size(), txnId);
        }

        Optional<FederationTxn> seen = findProcessed((String) origin, txnId);
        if (seen.isPresent()) {
            logger.info("Transaction {} from {} already processed, returning stored results", txnId, origin);
            return Map.of("results", seen.get().getResults());
        }

        List<Map<String, Object>> rawPdus = new ArrayList<>();
        for (Object pdu : (List<Object>) pdus) {
            rawPdus.add(pdu instanceof Map ? (Map<String, Object>) pdu : null);
        }
        List<Map<String, Object>> results = apply((String) origin, rawPdus);
        long failures = results.stream().filter(r -> r.containsKey("error")).count();

        remember((String) origin, txnId, results);
        logger.info("Processed transaction {} from {} with {} PDUs ({} failed)", txnId, origin, rawPdus.size(), failures);
        return Map.of("results", results);
    }

    /**
     * Validates all PDUs, persists the valid ones parents-first, and reports in input order.
     */
    List<Map<String, Object>> apply(String origin, List<Map<String, Object>> rawPdus) {
        PduPersister.PduOutcome[] outcomes = new PduPersister.PduOutcome[rawPdus.size()];
        List<PduRecord> valid = new ArrayList<>();
        Map<PduRecord, Integer> slotOf = new IdentityHashMap<>();
        for (int i = 0; i < rawPdus.size(); i++) {
            outcomes[i] = persister.validate(rawPdus.get(i), origin);
            if (outcomes[i].isSuccess()) {
                valid.add(outcomes[i].getRecord());
                slotOf.put(outcomes[i].getRecord(), i);
            }
        }

        List<PduRecord> ordered = orderPdus ? dagOrderer.order(valid) : valid;
        for (PduRecord record : ordered) {
            outcomes[slotOf.get(record)] = persister.persist(record);
        }

        List<Map<String, Object>> results = new ArrayList<>(outcomes.length);
        for (PduPersister.PduOutcome outcome : outcomes) {
            results.add(outcome.toMap());
        }
        return results;
    }

    private Optional<FederationTxn> findProcessed(String origin, String txnId) {
        try {
            return txnRepo.findById(FederationTxn.idOf(origin, txnId));
        } catch (RuntimeException e) {
            logger.warn("Could not check transaction {} from {} for re-delivery: {}", txnId, origin, e.getMessage());
            return Optional.empty();
        }
    }

    private void remember(String origin, String txnId, List<Map<String, Object>> results) {
        try {
            txnRepo.save(FederationTxn.builder()
                    .id(FederationTxn.idOf(origin, txnId))
                    .origin(origin)
                    .txnId(txnId)
                    .processedAt(Instant.now())
                    .results(results)
                    .build());
        } catch (RuntimeException e) {
            // a re-delivery is then reprocessed event by event
            logger.warn("Could not record transaction {} from {}: {}", txnId, origin, e.getMessage());
        }
    }
}
