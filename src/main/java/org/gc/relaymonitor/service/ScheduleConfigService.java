package org.gc.relaymonitor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.dto.ScheduleConfigRequest;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.ScheduleConfigRepository;
import org.gc.relaymonitor.scheduling.ScheduleOrchestrator;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleConfigService {

    private final ScheduleConfigRepository scheduleConfigRepository;
    private final ScheduleOrchestrator scheduleOrchestrator;
    private final RelayMonitorProperties properties;
    private final Clock clock;

    /**
     * Returns the global schedule, creating it with defaults on first read.
     */
    public Mono<ScheduleConfig> getConfig() {
        return Mono.fromCallable(() -> scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()
                .orElseGet(() -> {
                    log.info("No global schedule config found, creating defaults");
                    return scheduleConfigRepository.save(defaultConfig());
                }));
    }

    /**
     * Saves the global schedule and re-derives every affected job before returning.
     */
    public Mono<ScheduleConfig> updateConfig(ScheduleConfigRequest request) {
        log.info("Updating global schedule: enabled {}, {}:{}, interval {}s, override {}",
                request.getEnabled(), request.getHour(), request.getMinute(), request.getInterval(),
                request.getOverrideIndividual());

        return Mono.fromCallable(() -> {
            ScheduleConfig config = scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()
                    .orElseGet(this::defaultConfig);

            config.setEnabled(Boolean.TRUE.equals(request.getEnabled()));
            config.setHour(request.getHour());
            config.setMinute(request.getMinute());
            config.setInterval(request.getInterval());
            config.setOverrideIndividual(Boolean.TRUE.equals(request.getOverrideIndividual()));
            config.setUpdatedAt(clock.instant());

            ScheduleConfig saved = scheduleConfigRepository.save(config);
            scheduleOrchestrator.onGlobalConfigUpdated(saved);
            return saved;
        });
    }

    private ScheduleConfig defaultConfig() {
        RelayMonitorProperties.GlobalDefaults defaults = properties.getGlobalDefaults();
        ScheduleConfig config = ScheduleConfig.create(defaults.getHour(), defaults.getMinute(),
                defaults.getInterval(), defaults.getTimezone());
        Instant now = clock.instant();
        config.setCreatedAt(now);
        config.setUpdatedAt(now);
        return config;
    }
}
