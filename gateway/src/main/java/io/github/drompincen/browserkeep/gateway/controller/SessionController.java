package io.github.drompincen.browserkeep.gateway.controller;

import io.github.drompincen.browserkeep.protocol.api.SessionDto;
import io.github.drompincen.browserkeep.protocol.api.SessionStatusResponse;
import io.github.drompincen.browserkeep.protocol.api.StartSessionRequest;
import io.github.drompincen.browserkeep.protocol.api.TerminateSessionRequest;
import io.github.drompincen.browserkeep.protocol.api.TerminationResponse;
import io.github.drompincen.browserkeep.protocol.api.UpdateResumeTokenRequest;
import io.github.drompincen.browserkeep.protocol.event.Event;
import io.github.drompincen.browserkeep.runtime.event.EventPersistenceListener;
import io.github.drompincen.browserkeep.runtime.session.SessionManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionManager sessionManager;
    private final ObjectProvider<EventPersistenceListener> eventHistory;

    public SessionController(SessionManager sessionManager,
                             ObjectProvider<EventPersistenceListener> eventHistory) {
        this.sessionManager = sessionManager;
        this.eventHistory = eventHistory;
    }

    @PostMapping
    public ResponseEntity<SessionDto> start(@RequestBody(required = false) StartSessionRequest req) {
        if (req == null) req = new StartSessionRequest(null, null);
        String sessionId = sessionManager.startSession(req.owner(), req.targetUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionManager.describe(sessionId));
    }

    @PostMapping("/{id}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable String id) {
        sessionManager.heartbeat(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public SessionDto get(@PathVariable String id) {
        return sessionManager.describe(id);
    }

    @GetMapping("/{id}/status")
    public SessionStatusResponse status(@PathVariable String id) {
        return new SessionStatusResponse(id, sessionManager.getStatus(id));
    }

    @PutMapping("/{id}/resume-token")
    public ResponseEntity<Void> updateResumeToken(@PathVariable String id,
                                                  @RequestBody(required = false) UpdateResumeTokenRequest req) {
        sessionManager.updateResumeToken(id, req != null ? req.resumeToken() : null);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/terminate")
    public TerminationResponse terminate(@PathVariable String id,
                                         @RequestBody(required = false) TerminateSessionRequest req) {
        return sessionManager.terminate(id, req != null ? req.outcome() : null);
    }

    @GetMapping
    public List<SessionDto> listByOwner(@RequestParam String owner) {
        return sessionManager.listByOwner(owner);
    }

    @GetMapping("/live")
    public List<SessionDto> live() {
        return sessionManager.liveSessions();
    }

    @GetMapping("/{id}/events")
    public List<Event> events(@PathVariable String id) {
        sessionManager.describe(id);
        EventPersistenceListener history = eventHistory.getIfAvailable();
        return history != null ? history.history(id) : List.of();
    }
}
