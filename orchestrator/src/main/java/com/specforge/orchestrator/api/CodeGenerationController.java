package com.specforge.orchestrator.api;

import com.specforge.orchestrator.api.dto.GenerateCodeRequest;
import com.specforge.orchestrator.api.dto.GenerationStartedResponse;
import com.specforge.orchestrator.api.dto.SessionResponse;
import com.specforge.orchestrator.events.SessionEvent;
import com.specforge.orchestrator.events.SessionEventStreamer;
import com.specforge.orchestrator.model.SessionStatus;
import com.specforge.orchestrator.service.SessionOrchestrator;
import com.specforge.orchestrator.store.SessionSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * REST API for generation sessions.
 *
 *   POST /code/generate       start a session from a stored or inline specification
 *   GET  /code/status/{id}    poll session status and per-file results
 *   POST /code/cancel/{id}    cancel a running session
 *   GET  /code/events/{id}    Server-Sent Events stream of status changes
 */
@RestController
@RequestMapping("/code")
public class CodeGenerationController {

    private final SessionOrchestrator  orchestrator;
    private final SessionEventStreamer streamer;

    public CodeGenerationController(SessionOrchestrator orchestrator, SessionEventStreamer streamer) {
        this.orchestrator = orchestrator;
        this.streamer     = streamer;
    }

    /**
     * Start a session. Returns 202 as soon as the session is recorded.
     *
     * Example:
     *   curl -X POST http://localhost:8080/code/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"specId":"<uuid>","frameworks":{"frontend":"React","backend":"FastAPI","database":"PostgreSQL"}}'
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerationStartedResponse> generate(@RequestBody GenerateCodeRequest req) {
        UUID sessionId = orchestrator.start(req.toCommand());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new GenerationStartedResponse(sessionId, SessionStatus.PENDING.name()));
    }

    @GetMapping("/status/{id}")
    public SessionResponse status(@PathVariable UUID id) {
        return SessionResponse.from(requireSession(id));
    }

    /**
     * HTTP 200: cancelled, body is the updated session
     * HTTP 409: session already finished
     * HTTP 404: unknown session
     */
    @PostMapping("/cancel/{id}")
    public SessionResponse cancel(@PathVariable UUID id) {
        if (!orchestrator.cancel(id)) {
            SessionSnapshot current = requireSession(id);
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Session " + id + " already " + current.status());
        }
        return SessionResponse.from(requireSession(id));
    }

    /** Starts with the current status; closes at once for a finished session. */
    @GetMapping(path = "/events/{id}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable UUID id) {
        SessionSnapshot attached = requireSession(id);
        return streamer.open(id, () -> currentState(orchestrator.status(id).orElse(attached)));
    }

    static SessionEvent currentState(SessionSnapshot s) {
        String summary = s.status() == SessionStatus.FAILED ? s.errorMessage() : "Current status";
        return new SessionEvent(s.id(), s.status(), summary, s.updatedAt());
    }

    private SessionSnapshot requireSession(UUID id) {
        return orchestrator.status(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id));
    }
}
