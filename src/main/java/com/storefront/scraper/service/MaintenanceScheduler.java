package com.storefront.scraper.service;

import com.storefront.scraper.manager.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodic upkeep: strategy disable/re-enable, proxy re-probing and forgetting finished jobs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final StrategySelector strategySelector;
    private final ProxyPoolManager proxyPool;
    private final ScrapingJobQueue jobQueue;

    @Value("${scraper.strategy.disable-threshold:50}")
    private double disableThreshold = 50;

    @Value("${scraper.strategy.reenable-after.hours:2}")
    private long reenableAfterHours = 2;

    @Value("${scraper.queue.finished-retention.hours:6}")
    private long finishedRetentionHours = 6;

    @Scheduled(fixedDelayString = "${scraper.strategy.maintenance.interval.ms:900000}",
            initialDelayString = "${scraper.strategy.maintenance.interval.ms:900000}")
    public void maintainStrategies() {
        int disabled = strategySelector.disableLowPerforming(disableThreshold);
        int reenabled = strategySelector.reenableAfterCooldown(Duration.ofHours(reenableAfterHours));
        log.info("Strategy maintenance | disabled={} | reenabled={}", disabled, reenabled);
    }

    @Scheduled(fixedDelayString = "${scraper.proxy.refresh.interval.ms:1800000}",
            initialDelayString = "${scraper.proxy.refresh.interval.ms:1800000}")
    public void refreshProxies() {
        if (proxyPool.all().isEmpty()) {
            return;
        }
        proxyPool.refresh();
    }

    @Scheduled(fixedDelayString = "${scraper.queue.purge.interval.ms:3600000}")
    public void purgeFinishedJobs() {
        int purged = jobQueue.purgeFinished(Duration.ofHours(finishedRetentionHours));
        if (purged > 0) {
            log.info("Purged {} finished jobs", purged);
        }
    }
}
