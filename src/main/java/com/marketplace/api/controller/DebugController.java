package com.marketplace.api.controller;

import com.marketplace.api.dto.request.ChangeEventRequest;
import com.marketplace.api.dto.request.ConnectModeRequest;
import com.marketplace.api.dto.response.ConnectivityResponse;
import com.marketplace.session.RealtimeSessionRegistry;
import com.marketplace.source.InMemoryChangeEventSource;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Debug endpoints for inspecting and driving the realtime system.
 *
 * <p>Lists every session with its handle states, and drives the in-process change stream:
 * inject change events, fail or close a stream, switch how new subscriptions are answered.
 * Intended for developer debugging, not for production dashboards.
 */
@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final RealtimeSessionRegistry realtimeSessionRegistry;
    private final InMemoryChangeEventSource inMemoryChangeEventSource;

    public DebugController(
            RealtimeSessionRegistry realtimeSessionRegistry, InMemoryChangeEventSource inMemoryChangeEventSource) {
        this.realtimeSessionRegistry = realtimeSessionRegistry;
        this.inMemoryChangeEventSource = inMemoryChangeEventSource;
    }

    /**
     * Returns the state of every layer:
     * - realtime sessions with connectivity, retry count and per-handle status
     * - live subscriptions held by the change stream
     */
    @GetMapping("/sessions")
    public Map<String, Object> getSessions() {
        Map<String, Object> result = new LinkedHashMap<>();

        List<ConnectivityResponse> sessions = realtimeSessionRegistry.sessions().stream()
                .map(ConnectivityResponse::from)
                .toList();
        result.put("activeSessions", sessions.size());
        result.put("sessions", sessions);

        Map<String, Object> source = new LinkedHashMap<>();
        source.put("connectMode", inMemoryChangeEventSource.getConnectMode());
        source.put("subscriptions", inMemoryChangeEventSource.activeSubscriptions());
        result.put("changeStream", source);

        return result;
    }

    @PostMapping("/events")
    public Map<String, Object> injectEvent(@Valid @RequestBody ChangeEventRequest request) {
        int delivered = inMemoryChangeEventSource.publish(request.toRawChangeEvent());
        return Map.of("delivered", delivered);
    }

    @PostMapping("/streams/{streamId}/fail")
    public Map<String, Object> failStream(
            @PathVariable String streamId, @RequestParam(required = false) String userId) {
        return Map.of("failed", inMemoryChangeEventSource.failStream(streamId, userId));
    }

    @PostMapping("/streams/{streamId}/close")
    public Map<String, Object> closeStream(
            @PathVariable String streamId, @RequestParam(required = false) String userId) {
        return Map.of("closed", inMemoryChangeEventSource.closeStream(streamId, userId));
    }

    @PutMapping("/connect-mode")
    public Map<String, Object> setConnectMode(@Valid @RequestBody ConnectModeRequest request) {
        inMemoryChangeEventSource.setConnectMode(request.getMode());
        return Map.of("connectMode", request.getMode());
    }

    @PostMapping("/streams/confirm")
    public Map<String, Object> confirmPending() {
        return Map.of("confirmed", inMemoryChangeEventSource.confirmPending());
    }
}
