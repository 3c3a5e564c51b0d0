package com.raceplatform.orchestrator.controller;

import com.raceplatform.common.exception.AllocationFailureException;
import com.raceplatform.common.exception.ConfigInvalidException;
import com.raceplatform.common.exception.PipelineException;
import com.raceplatform.common.exception.UnknownPhaseException;
import com.raceplatform.common.model.Decision;
import com.raceplatform.common.model.DecisionArtifact;
import com.raceplatform.common.model.Phase;
import com.raceplatform.orchestrator.guard.ConcurrentInvocationException;
import com.raceplatform.orchestrator.service.RacePipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/races")
public class DecisionController {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    private final RacePipelineService racePipelineService;

    public DecisionController(RacePipelineService racePipelineService) {
        this.racePipelineService = racePipelineService;
    }

    @PostMapping("/{raceId}/phases/{phase}")
    public Mono<ResponseEntity<Decision>> trigger(@PathVariable String raceId,
                                                  @PathVariable String phase,
                                                  @RequestParam String meetingId) {
        Phase parsed = Phase.parse(phase);
        return racePipelineService.run(meetingId, raceId, parsed).map(ResponseEntity::ok);
    }

    @GetMapping("/{raceId}/phases/{phase}")
    public ResponseEntity<DecisionArtifact> latest(@PathVariable String raceId,
                                                   @PathVariable String phase,
                                                   @RequestParam String meetingId) {
        return racePipelineService.latest(meetingId, raceId, Phase.parse(phase))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(UnknownPhaseException.class)
    public ResponseEntity<Map<String, Object>> unknownPhase(UnknownPhaseException e) {
        return error(HttpStatus.BAD_REQUEST, e, List.of());
    }

    @ExceptionHandler(ConcurrentInvocationException.class)
    public ResponseEntity<Map<String, Object>> concurrent(ConcurrentInvocationException e) {
        return error(HttpStatus.CONFLICT, e, List.of());
    }

    @ExceptionHandler(ConfigInvalidException.class)
    public ResponseEntity<Map<String, Object>> configInvalid(ConfigInvalidException e) {
        log.error("[DecisionController] invalid configuration. violations={}", e.getViolations());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e, e.getViolations());
    }

    @ExceptionHandler(AllocationFailureException.class)
    public ResponseEntity<Map<String, Object>> allocationFailure(AllocationFailureException e) {
        log.error("[DecisionController] allocation failure. reason={}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e, List.of());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, PipelineException e,
                                                             List<String> violations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", e.getClass().getSimpleName());
        body.put("component", e.getComponent());
        body.put("message", e.getMessage());
        body.put("fatal", e.isFatal());
        if (!violations.isEmpty()) {
            body.put("violations", violations);
        }
        return ResponseEntity.status(status).body(body);
    }
}
