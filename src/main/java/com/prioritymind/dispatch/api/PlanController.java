package com.prioritymind.dispatch.api;

import com.prioritymind.core.model.AdjustedPlan;
import com.prioritymind.core.model.Gap;
import com.prioritymind.core.model.InsertionResult;
import com.prioritymind.core.planner.PlannerException;
import com.prioritymind.core.planner.PrioritizationOutcome;
import com.prioritymind.core.reflection.BaselineExpiredException;
import com.prioritymind.core.reflection.PlanPreconditionException;
import com.prioritymind.core.session.PlanSessionService;
import com.prioritymind.core.session.PrioritizeCommand;
import com.prioritymind.core.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for plan sessions: full prioritization, reflection-based
 * adjustment, bridging-task insertion and the session event stream.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanSessionService sessionService;
    private final SseStreamingService sseStreamingService;

    public PlanController(PlanSessionService sessionService, SseStreamingService sseStreamingService) {
        this.sessionService = sessionService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/sessions/{id}/prioritize: run the planner and store a new baseline.
     */
    @PostMapping("/{id}/prioritize")
    public ResponseEntity<?> prioritize(@PathVariable String id, @RequestBody PrioritizeRequest request) {
        try {
            PrioritizationOutcome outcome = sessionService.prioritize(id,
                    new PrioritizeCommand(request.outcome(), request.tasks(), request.taskSummaries()));
            return ResponseEntity.ok(PrioritizeResponse.from(id, outcome));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (PlannerException e) {
            log.error("Prioritization failed for session {}", id, e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/sessions/{id}: stored tasks, baseline and adjusted plan.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getSession(@PathVariable String id) {
        try {
            return ResponseEntity.ok(sessionService.getSession(id));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/sessions/{id}/adjust: re-rank the baseline with active reflections.
     */
    @PostMapping("/{id}/adjust")
    public ResponseEntity<?> adjust(@PathVariable String id) {
        try {
            AdjustedPlan adjusted = sessionService.adjust(id);
            return ResponseEntity.ok(adjusted);
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (BaselineExpiredException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", e.getMessage(),
                    "age_hours", Math.round(e.ageHours())));
        } catch (PlanPreconditionException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/sessions/{id}/gaps/accept: splice bridging tasks between two tasks.
     */
    @PostMapping("/{id}/gaps/accept")
    public ResponseEntity<?> acceptGap(@PathVariable String id, @RequestBody AcceptGapRequest request) {
        if (isBlank(request.predecessorId()) || isBlank(request.successorId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "predecessor_id and successor_id are required"));
        }
        try {
            InsertionResult result = sessionService.insertBridgingTasks(id,
                    new Gap(request.predecessorId(), request.successorId()),
                    request.bridgingTasks() == null ? List.of() : request.bridgingTasks());
            if (result.success()) {
                return ResponseEntity.ok(new GapAcceptResponse(result.insertedIds(), result.updatedPlan()));
            }
            HttpStatus status = switch (result.failure()) {
                case VALIDATION, REFERENCE -> HttpStatus.BAD_REQUEST;
                case ID_COLLISION, CIRCULAR_DEPENDENCY -> HttpStatus.CONFLICT;
            };
            return ResponseEntity.status(status).body(Map.of(
                    "error", result.error(),
                    "failure", result.failure().name()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/sessions/{id}/events: SSE stream of session events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
