package org.gc.relaymonitor.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.dto.ScheduleConfigRequest;
import org.gc.relaymonitor.domain.dto.ScheduleStatus;
import org.gc.relaymonitor.domain.dto.StatusResponse;
import org.gc.relaymonitor.scheduling.InvalidScheduleException;
import org.gc.relaymonitor.scheduling.ScheduleOrchestrator;
import org.gc.relaymonitor.service.ScheduleConfigService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleConfigService scheduleConfigService;
    private final ScheduleOrchestrator scheduleOrchestrator;

    /**
     * Returns the global schedule, created with defaults if none exists yet.
     * <p>
     * GET /api/schedule-config
     */
    @GetMapping("/schedule-config")
    public Mono<ResponseEntity<StatusResponse>> getScheduleConfig() {
        return scheduleConfigService.getConfig()
                .map(config -> ResponseEntity.ok(StatusResponse.success("Schedule config", Map.of("config", config))))
                .onErrorResume(error -> {
                    log.error("Error reading schedule config: {}", error.getMessage());
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(StatusResponse.failure("Failed to read schedule config: " + error.getMessage())));
                });
    }

    /**
     * Updates the global schedule and reconfigures the jobs.
     * <p>
     * POST /api/schedule-config
     * {
     *   "enabled": true, "hour": 9, "minute": 0, "interval": 30, "overrideIndividual": false
     * }
     */
    @PostMapping("/schedule-config")
    public Mono<ResponseEntity<StatusResponse>> updateScheduleConfig(@Valid @RequestBody ScheduleConfigRequest request) {
        return scheduleConfigService.updateConfig(request)
                .map(config -> ResponseEntity.ok(StatusResponse.success("Schedule config updated", Map.of("config", config))))
                .onErrorResume(InvalidScheduleException.class, error -> Mono.just(ResponseEntity.badRequest()
                        .body(StatusResponse.failure(error.getMessage()))))
                .onErrorResume(error -> {
                    log.error("Error updating schedule config: {}", error.getMessage());
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(StatusResponse.failure("Failed to update schedule config: " + error.getMessage())));
                });
    }

    /**
     * Lists the live jobs.
     * <p>
     * GET /api/schedule/status
     */
    @GetMapping("/schedule/status")
    public ResponseEntity<ScheduleStatus> getStatus() {
        return ResponseEntity.ok(scheduleOrchestrator.status());
    }
}
