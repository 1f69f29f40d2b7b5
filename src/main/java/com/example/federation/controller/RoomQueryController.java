package com.example.federation.controller;

import com.example.federation.service.BackfillResponder;
import com.example.federation.service.RoomQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/_matrix/federation/v1")
public class RoomQueryController {

    private final BackfillResponder backfillResponder;
    private final RoomQueryService roomQueryService;

    public RoomQueryController(BackfillResponder backfillResponder, RoomQueryService roomQueryService) {
        this.backfillResponder = backfillResponder;
        this.roomQueryService = roomQueryService;
    }

    @GetMapping
    public Mono<Map<String, Object>> discovery() {
        return Mono.fromCallable(roomQueryService::discovery);
    }

    @GetMapping("/version")
    public Mono<Map<String, Object>> version() {
        return Mono.fromCallable(roomQueryService::version);
    }

    @GetMapping("/backfill/{roomId}")
    public Mono<Map<String, Object>> backfill(@PathVariable String roomId,
                                              @RequestParam(name = "v", required = false) List<String> v,
                                              @RequestParam(required = false) Integer limit) {
        return Blocking.call(() -> backfillResponder.backfill(roomId, v, limit));
    }

    @PostMapping("/get_missing_events/{roomId}")
    public Mono<Map<String, Object>> getMissingEvents(@PathVariable String roomId,
                                                      @RequestBody(required = false) Map<String, Object> body) {
        return Blocking.call(() -> backfillResponder.getMissingEvents(roomId, body));
    }

    @GetMapping({"/event_auth/{roomId}/{eventId}", "/get_event_auth/{roomId}/{eventId}"})
    public Mono<Map<String, Object>> eventAuth(@PathVariable String roomId, @PathVariable String eventId) {
        return Blocking.call(() -> roomQueryService.eventAuth(roomId, eventId));
    }

    @GetMapping("/event/{eventId}")
    public Mono<Map<String, Object>> event(@PathVariable String eventId) {
        return Blocking.call(() -> roomQueryService.event(eventId));
    }

    @GetMapping("/room/{roomId}/{eventId}")
    public Mono<Map<String, Object>> roomEvent(@PathVariable String roomId, @PathVariable String eventId) {
        return Blocking.call(() -> roomQueryService.roomEvent(roomId, eventId));
    }

    @GetMapping("/state/{roomId}")
    public Mono<Map<String, Object>> state(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.state(roomId));
    }

    @GetMapping("/state_ids/{roomId}")
    public Mono<Map<String, Object>> stateIds(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.stateIds(roomId));
    }

    @GetMapping("/room_auth/{roomId}")
    public Mono<Map<String, Object>> roomAuth(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.roomAuth(roomId));
    }

    @GetMapping("/get_joining_rules/{roomId}")
    public Mono<Map<String, Object>> joiningRules(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.joiningRules(roomId));
    }

    @GetMapping("/members/{roomId}")
    public Mono<Map<String, Object>> members(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.members(roomId));
    }

    @GetMapping("/members/{roomId}/joined")
    public Mono<Map<String, Object>> joinedMembers(@PathVariable String roomId) {
        return Blocking.call(() -> roomQueryService.joinedMembers(roomId));
    }
}
