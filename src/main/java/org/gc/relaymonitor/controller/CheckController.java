package org.gc.relaymonitor.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.dto.StatusResponse;
import org.gc.relaymonitor.repository.SiteRepository;
import org.gc.relaymonitor.scheduling.ScheduleOrchestrator;
import org.gc.relaymonitor.service.ManualCheckService;
import org.gc.relaymonitor.service.NoCheckableSitesException;
import org.gc.relaymonitor.service.NotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CheckController {

    private final ManualCheckService manualCheckService;
    private final ScheduleOrchestrator scheduleOrchestrator;
    private final SiteRepository siteRepository;

    /**
     * POST /api/sites/{id}/check?skipNotification=true
     */
    @PostMapping("/sites/{id}/check")
    public Mono<ResponseEntity<StatusResponse>> checkSite(@PathVariable String id,
                                                          @RequestParam(defaultValue = "false") boolean skipNotification) {
        return manualCheckService.checkSite(id, skipNotification)
                .map(result -> ResponseEntity.ok(StatusResponse.success("Site checked", Map.of("result", result))))
                .onErrorResume(error -> Mono.just(errorResponse("check site " + id, error)));
    }

    /**
     * Checks every site not excluded from batch runs, pausing between sites.
     * <p>
     * POST /api/sites/check-all
     */
    @PostMapping("/sites/check-all")
    public Mono<ResponseEntity<StatusResponse>> checkAllSites() {
        log.info("Received request to check all sites");

        return manualCheckService.checkAllSites()
                .map(outcome -> ResponseEntity.ok(StatusResponse.success("All sites checked", results(outcome))))
                .onErrorResume(error -> Mono.just(errorResponse("check all sites", error)));
    }

    /**
     * POST /api/categories/{id}/check?skipNotification=true
     */
    @PostMapping("/categories/{id}/check")
    public Mono<ResponseEntity<StatusResponse>> checkCategory(@PathVariable String id,
                                                              @RequestParam(defaultValue = "false") boolean skipNotification) {
        log.info("Received request to check category {}", id);

        return manualCheckService.checkCategory(id, skipNotification)
                .map(outcome -> ResponseEntity.ok(StatusResponse.success("Category checked", results(outcome))))
                .onErrorResume(error -> Mono.just(errorResponse("check category " + id, error)));
    }

    /**
     * Which tier currently governs the site.
     * <p>
     * GET /api/sites/{id}/schedule-tier
     */
    @GetMapping("/sites/{id}/schedule-tier")
    public Mono<ResponseEntity<StatusResponse>> getScheduleTier(@PathVariable String id) {
        return Mono.fromCallable(() -> siteRepository.findById(id)
                        .map(scheduleOrchestrator::resolveTier)
                        .orElseThrow(() -> new NotFoundException("Site not found: " + id)))
                .map(tier -> ResponseEntity.ok(StatusResponse.success("Schedule tier", Map.of("tier", tier))))
                .onErrorResume(error -> Mono.just(errorResponse("resolve schedule tier of " + id, error)));
    }

    private static Map<String, Object> results(BatchOutcome outcome) {
        return Map.of(
                "changes", outcome.changedSites(),
                "failures", outcome.getFailedSites(),
                "totalSites", outcome.getTotalSites()
        );
    }

    private static ResponseEntity<StatusResponse> errorResponse(String action, Throwable error) {
        HttpStatus status;
        if (error instanceof NotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (error instanceof NoCheckableSitesException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            log.error("Failed to {}: {}", action, error.getMessage());
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).body(StatusResponse.failure(error.getMessage()));
    }
}
