package org.gc.relaymonitor.checker;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.ModelDiff;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import org.gc.relaymonitor.notification.Notifier;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.SiteRepository;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Checks a relay by reading its OpenAI-style model list and comparing it with the stored snapshot.
 * The first successful check only records the baseline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelListSiteChecker implements SiteChecker {

    private final WebClient.Builder webClientBuilder;
    private final SiteRepository siteRepository;
    private final Notifier notifier;
    private final RelayMonitorProperties properties;
    private final Clock clock;

    @Override
    public Mono<SiteCheckResult> check(Site site, CheckOptions options) {
        log.info("Checking site {} ({}), manual: {}", site.getId(), site.getName(), options.isManual());

        return fetchModels(site)
                .flatMap(models -> Mono.fromCallable(() -> saveSnapshot(site, models))
                        .subscribeOn(Schedulers.boundedElastic()))
                .flatMap(result -> notifyIfChanged(site, result, options).thenReturn(result))
                .onErrorMap(error -> !(error instanceof SiteCheckException), error -> new SiteCheckException(describe(error), error))
                .onErrorResume(error -> Mono.fromRunnable(() -> recordFailure(site, error.getMessage()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .then(Mono.<SiteCheckResult>error(error)));
    }

    private Mono<List<String>> fetchModels(Site site) {
        if (site.getBaseUrl() == null || site.getBaseUrl().trim().isEmpty()) {
            return Mono.error(new SiteCheckException("Site " + site.getName() + " has no base URL"));
        }

        WebClient webClient = webClientBuilder.clone()
                .baseUrl(site.getBaseUrl().trim())
                .build();

        return webClient.get()
                .uri(properties.getChecker().getModelsPath())
                .headers(headers -> {
                    if (site.getApiKey() != null && !site.getApiKey().isEmpty()) {
                        headers.setBearerAuth(site.getApiKey());
                    }
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(properties.getChecker().getTimeoutSeconds()))
                .map(this::modelIds);
    }

    List<String> modelIds(JsonNode body) {
        JsonNode data = body.path("data");
        if (!data.isArray()) {
            throw new SiteCheckException("Unexpected model list response: missing 'data' array");
        }

        List<String> ids = new ArrayList<>();
        for (JsonNode model : data) {
            String id = model.path("id").asText("");
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private SiteCheckResult saveSnapshot(Site site, List<String> models) {
        Site current = siteRepository.findById(site.getId()).orElse(site);
        List<String> previous = current.getModels();
        ModelDiff diff = ModelDiff.between(previous, models);
        boolean hasChanges = previous != null && !diff.isEmpty();

        Instant now = clock.instant();
        current.setModels(models);
        current.setLastCheckedAt(now);
        current.setLastError(null);
        current.setUpdatedAt(now);
        siteRepository.save(current);

        log.info("Site {} ({}) has {} models, added {}, removed {}",
                site.getId(), site.getName(), models.size(), diff.getAdded().size(), diff.getRemoved().size());

        return SiteCheckResult.builder()
                .siteId(site.getId())
                .siteName(site.getName())
                .hasChanges(hasChanges)
                .diff(hasChanges ? diff : null)
                .build();
    }

    private Mono<Void> notifyIfChanged(Site site, SiteCheckResult result, CheckOptions options) {
        if (options.isSkipNotification() || !result.isHasChanges()) {
            return Mono.empty();
        }
        return notifier.sendSingle(site, result.getDiff(), result.getCheckInResult())
                .onErrorResume(error -> {
                    log.error("Notification for site {} failed: {}", site.getName(), error.getMessage());
                    return Mono.empty();
                });
    }

    private void recordFailure(Site site, String message) {
        try {
            siteRepository.findById(site.getId()).ifPresent(current -> {
                current.setLastError(message);
                current.setLastCheckedAt(clock.instant());
                siteRepository.save(current);
            });
        } catch (RuntimeException e) {
            log.warn("Could not record check failure for site {}: {}", site.getId(), e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Request timed out";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
