package com.storefront.scraper.service;

import com.storefront.scraper.manager.ProxyPoolManager;
import com.storefront.scraper.model.ProxyEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaintenanceScheduler Tests")
class MaintenanceSchedulerTest {

    @Mock
    private StrategySelector strategySelector;

    @Mock
    private ProxyPoolManager proxyPool;

    @Mock
    private ScrapingJobQueue jobQueue;

    @InjectMocks
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(scheduler, "disableThreshold", 40.0);
        ReflectionTestUtils.setField(scheduler, "reenableAfterHours", 3L);
        ReflectionTestUtils.setField(scheduler, "finishedRetentionHours", 12L);
    }

    @Test
    @DisplayName("maintainStrategies_disablesThenReenablesWithConfiguredValues")
    void maintainStrategies_disablesThenReenablesWithConfiguredValues() {
        scheduler.maintainStrategies();

        verify(strategySelector).disableLowPerforming(40.0);
        verify(strategySelector).reenableAfterCooldown(Duration.ofHours(3));
    }

    @Test
    @DisplayName("refreshProxies_emptyPool_skipsProbing")
    void refreshProxies_emptyPool_skipsProbing() {
        when(proxyPool.all()).thenReturn(List.of());

        scheduler.refreshProxies();

        verify(proxyPool, never()).refresh();
    }

    @Test
    @DisplayName("refreshProxies_populatedPool_rechecks")
    void refreshProxies_populatedPool_rechecks() {
        when(proxyPool.all()).thenReturn(List.of(ProxyEndpoint.parse("http://10.0.0.1:3128")));

        scheduler.refreshProxies();

        verify(proxyPool).refresh();
    }

    @Test
    @DisplayName("purgeFinishedJobs_usesRetentionWindow")
    void purgeFinishedJobs_usesRetentionWindow() {
        when(jobQueue.purgeFinished(Duration.ofHours(12))).thenReturn(2);

        scheduler.purgeFinishedJobs();

        verify(jobQueue).purgeFinished(Duration.ofHours(12));
    }
}
