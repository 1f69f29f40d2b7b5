package com.example.federation.controller;

import com.example.federation.model.PduRecord;
import com.example.federation.service.MembershipHandshakeCoordinator;
import com.example.federation.service.TransactionProcessor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Write side of the federation API: transactions and membership handshakes.
 * The v1 variants of send_join, send_leave and invite answer
 * {@code [200, body]}.
 */
@RestController
@RequestMapping("/_matrix/federation")
public class FederationController {

    private final TransactionProcessor transactionProcessor;
    private final MembershipHandshakeCoordinator coordinator;

    public FederationController(TransactionProcessor transactionProcessor, MembershipHandshakeCoordinator coordinator) {
        this.transactionProcessor = transactionProcessor;
        this.coordinator = coordinator;
    }

    @PutMapping("/v1/send/{txnId}")
    public Mono<Map<String, Object>> send(@PathVariable String txnId,
                                          @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> transactionProcessor.process(txnId, body));
    }

    @GetMapping("/v1/make_join/{roomId}/{userId}")
    public Mono<Map<String, Object>> makeJoin(@PathVariable String roomId, @PathVariable String userId) {
        return Blocking.call(() -> coordinator.makeJoin(roomId, userId));
    }

    @PutMapping("/v1/send_join/{roomId}/{eventId}")
    public Mono<List<Object>> sendJoinV1(@PathVariable String roomId, @PathVariable String eventId,
                                         @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> List.of(200, coordinator.sendJoin(roomId, eventId, body)));
    }

    @PutMapping("/v2/send_join/{roomId}/{eventId}")
    public Mono<Map<String, Object>> sendJoin(@PathVariable String roomId, @PathVariable String eventId,
                                              @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> coordinator.sendJoin(roomId, eventId, body));
    }

    @GetMapping("/v1/make_leave/{roomId}/{userId}")
    public Mono<Map<String, Object>> makeLeave(@PathVariable String roomId, @PathVariable String userId) {
        return Blocking.call(() -> coordinator.makeLeave(roomId, userId));
    }

    @PutMapping("/v1/send_leave/{roomId}/{eventId}")
    public Mono<List<Object>> sendLeaveV1(@PathVariable String roomId, @PathVariable String eventId,
                                          @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> List.of(200, coordinator.sendLeave(roomId, eventId, body)));
    }

    @PutMapping("/v2/send_leave/{roomId}/{eventId}")
    public Mono<Map<String, Object>> sendLeave(@PathVariable String roomId, @PathVariable String eventId,
                                               @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> coordinator.sendLeave(roomId, eventId, body));
    }

    @PutMapping("/v1/invite/{roomId}/{eventId}")
    public Mono<List<Object>> inviteV1(@PathVariable String roomId, @PathVariable String eventId,
                                       @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> List.of(200, coordinator.receiveInvite(roomId, eventId, body)));
    }

    @PutMapping("/v2/invite/{roomId}/{eventId}")
    public Mono<Map<String, Object>> invite(@PathVariable String roomId, @PathVariable String eventId,
                                            @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> coordinator.receiveInvite(roomId, eventId, body));
    }

    @PostMapping("/v1/thirdparty/invite")
    public Mono<Map<String, Object>> thirdPartyInvite(@RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> eventResponse(coordinator.thirdPartyInvite(body)));
    }

    @RequestMapping(value = "/v1/knock/{roomId}/{userId}",
            method = {RequestMethod.GET, RequestMethod.PUT})
    public Mono<Map<String, Object>> knock(@PathVariable String roomId, @PathVariable String userId) {
        return Blocking.call(() -> eventResponse(coordinator.knock(roomId, userId)));
    }

    private static Map<String, Object> eventResponse(PduRecord event) {
        return Map.of("event", event.toPdu());
    }
}
