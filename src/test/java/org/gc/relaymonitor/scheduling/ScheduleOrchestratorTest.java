package org.gc.relaymonitor.scheduling;

import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.Category;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.dto.ScheduleStatus;
import org.gc.relaymonitor.notification.Notifier;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.CategoryRepository;
import org.gc.relaymonitor.repository.ScheduleConfigRepository;
import org.gc.relaymonitor.repository.SiteRepository;
import org.gc.relaymonitor.support.RecordingTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.gc.relaymonitor.support.TestSites.category;
import static org.gc.relaymonitor.support.TestSites.globalConfig;
import static org.gc.relaymonitor.support.TestSites.recordingPacer;
import static org.gc.relaymonitor.support.TestSites.scheduledSite;
import static org.gc.relaymonitor.support.TestSites.site;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduleOrchestratorTest {

    private RecordingTaskScheduler taskScheduler;
    private SiteRepository siteRepository;
    private CategoryRepository categoryRepository;
    private ScheduleConfigRepository scheduleConfigRepository;
    private SiteJobRegistry siteJobRegistry;
    private CategoryJobRegistry categoryJobRegistry;
    private GlobalJobRegistry globalJobRegistry;
    private ScheduleOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        taskScheduler = new RecordingTaskScheduler();
        siteRepository = mock(SiteRepository.class);
        categoryRepository = mock(CategoryRepository.class);
        scheduleConfigRepository = mock(ScheduleConfigRepository.class);
        SiteChecker siteChecker = mock(SiteChecker.class);
        Notifier notifier = mock(Notifier.class);

        RelayMonitorProperties properties = new RelayMonitorProperties();
        PrecedenceResolver precedenceResolver = new PrecedenceResolver();
        BatchRunner batchRunner = new BatchRunner(recordingPacer(new ArrayList<>()));

        siteJobRegistry = new SiteJobRegistry(taskScheduler, siteRepository, scheduleConfigRepository, siteChecker,
                precedenceResolver, properties);
        categoryJobRegistry = new CategoryJobRegistry(taskScheduler, categoryRepository, siteRepository, siteChecker,
                batchRunner, precedenceResolver, properties);
        globalJobRegistry = new GlobalJobRegistry(taskScheduler, scheduleConfigRepository, siteRepository, siteJobRegistry,
                batchRunner, siteChecker, notifier, precedenceResolver, properties, Clock.systemUTC());
        orchestrator = new ScheduleOrchestrator(siteJobRegistry, categoryJobRegistry, globalJobRegistry,
                siteRepository, categoryRepository, scheduleConfigRepository, precedenceResolver);
    }

    @Test
    void initializeSchedulesEveryTier() {
        when(siteRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(
                scheduledSite("a", "0 * * * *", "UTC"), site("b")));
        when(categoryRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(
                category("c", "0 6 * * *", "UTC"), category("d", null, null)));
        when(scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()).thenReturn(Optional.of(globalConfig(true, false)));

        orchestrator.initialize();

        ScheduleStatus status = orchestrator.status();
        assertThat(status.getSiteJobs()).containsExactly("a");
        assertThat(status.getCategoryJobs()).containsExactly("c");
        assertThat(status.isGlobalJobActive()).isTrue();
        assertThat(status.getGlobalExpression()).isEqualTo("0 9 * * *");
    }

    @Test
    void initializeWithoutConfigLeavesGlobalInactive() {
        when(siteRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(scheduledSite("a", "0 * * * *", "UTC")));

        orchestrator.initialize();

        assertThat(globalJobRegistry.isActive()).isFalse();
        assertThat(siteJobRegistry.jobKeys()).containsExactly("a");
    }

    @Test
    void initializeSurvivesBrokenGlobalConfig() {
        ScheduleConfig broken = globalConfig(true, false);
        broken.setTimezone("Atlantis/Capital");
        when(scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()).thenReturn(Optional.of(broken));
        when(categoryRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(category("c", "0 6 * * *", "UTC")));

        orchestrator.initialize();

        assertThat(globalJobRegistry.isActive()).isFalse();
        assertThat(categoryJobRegistry.jobKeys()).containsExactly("c");
    }

    @Test
    void initializeUnderOverrideStartsNoSiteJobs() {
        when(siteRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(scheduledSite("a", "0 * * * *", "UTC")));
        when(scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()).thenReturn(Optional.of(globalConfig(true, true)));

        orchestrator.initialize();

        assertThat(siteJobRegistry.jobCount()).isZero();
        assertThat(globalJobRegistry.isActive()).isTrue();
    }

    @Test
    void deletedCategoryIsNotRestoredByGlobalSave() {
        orchestrator.onCategoryUpdated(category("c", "0 6 * * *", "UTC"));
        orchestrator.onCategoryDeleted("c");

        orchestrator.onGlobalConfigUpdated(globalConfig(true, true));

        assertThat(categoryJobRegistry.jobCount()).isZero();
        assertThat(taskScheduler.activeJobs()).hasSize(1);
    }

    @Test
    void siteHooksFollowOwnSchedule() {
        Site site = scheduledSite("a", "0 * * * *", "UTC");

        orchestrator.onSiteUpdated(site);
        assertThat(siteJobRegistry.hasJob("a")).isTrue();

        orchestrator.onSiteDeleted("a");
        assertThat(siteJobRegistry.hasJob("a")).isFalse();
    }

    @Test
    void hookRejectsMalformedSchedule() {
        assertThrows(InvalidScheduleException.class,
                () -> orchestrator.onSiteUpdated(scheduledSite("a", "0 0 0 0 0 0 0", "UTC")));
        assertThrows(InvalidScheduleException.class,
                () -> orchestrator.onCategoryUpdated(category("c", "0 6 * * *", "Bad/Zone")));
    }

    @Test
    void resolveTierLooksUpCategory() {
        Site member = site("a");
        member.setCategoryId("c");
        Category category = category("c", "0 6 * * *", "UTC");
        when(categoryRepository.findById("c")).thenReturn(Optional.of(category));

        assertThat(orchestrator.resolveTier(member)).isEqualTo(SchedulingTier.CATEGORY);
        assertThat(orchestrator.resolveTier(site("b"))).isEqualTo(SchedulingTier.UNSCHEDULED);
    }

    @Test
    void shutdownStopsEverything() {
        when(siteRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(scheduledSite("a", "0 * * * *", "UTC")));
        when(categoryRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(category("c", "0 6 * * *", "UTC")));
        when(scheduleConfigRepository.findFirstByOrderByCreatedAtAsc()).thenReturn(Optional.of(globalConfig(true, false)));
        orchestrator.initialize();

        orchestrator.shutdown();

        assertThat(taskScheduler.activeJobs()).isEmpty();
    }
}
