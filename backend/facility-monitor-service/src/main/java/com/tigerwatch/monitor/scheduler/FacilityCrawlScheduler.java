package com.tigerwatch.monitor.scheduler;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.BatchDispatchResult;
import com.tigerwatch.monitor.dto.CrawlStatisticsDto;
import com.tigerwatch.monitor.service.crawl.CrawlHistoryLedger;
import com.tigerwatch.monitor.service.crawl.CrawlPriorityScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 시설 크롤링 주기 스케줄러.
 *
 * 크론 주기마다 우선순위가 높은 시설을 선택해 크롤링 작업을 분배하고,
 * 주기적으로 크롤링 이력 통계를 로깅합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "monitor.scheduler.enabled", havingValue = "true", matchIfMissing = false)
public class FacilityCrawlScheduler {

    private final CrawlPriorityScheduler crawlPriorityScheduler;
    private final CrawlHistoryLedger crawlHistoryLedger;
    private final MonitorProperties properties;

    // ========================================
    // 크롤링 주기
    // ========================================

    @Scheduled(cron = "${monitor.scheduler.cron:0 0 */6 * * *}")
    public void runCycle() {
        if (crawlPriorityScheduler.isShuttingDown()) {
            return;
        }
        MonitorProperties.Scheduler settings = properties.getScheduler();
        try {
            log.info("[CrawlCycle] Starting cycle: maxFacilities={}, referenceOnly={}",
                    settings.getBatchMaxFacilities(), settings.isReferenceOnly());

            BatchDispatchResult result = crawlPriorityScheduler.dispatchBatch(
                    null, settings.getBatchMaxFacilities(), settings.isReferenceOnly());

            if (result.getFailedCount() > 0) {
                log.warn("[CrawlCycle] Cycle dispatched {} facilities, {} failed: {}",
                        result.getScheduledCount(), result.getFailedCount(), result.failedFacilityIds());
            } else {
                log.info("[CrawlCycle] Cycle dispatched {} facilities", result.getScheduledCount());
            }
        } catch (Exception e) {
            log.error("[CrawlCycle] Error running crawl cycle: {}", e.getMessage(), e);
        }
    }

    // ========================================
    // 통계 로깅
    // ========================================

    @Scheduled(fixedDelayString = "${monitor.scheduler.stats-interval-ms:600000}")
    public void logCrawlStats() {
        try {
            int days = properties.getScheduler().getStatsWindowDays();
            CrawlStatisticsDto stats = crawlHistoryLedger.statistics(null, days);
            log.info("[CrawlCycle Stats] last {} days: total={}, successful={}, failed={}, images={}, identified={}, avgDurationMs={}",
                    days, stats.totalCrawls(), stats.successfulCrawls(), stats.failedCrawls(),
                    stats.totalImagesFound(), stats.totalTigersIdentified(), stats.averageDurationMs());
        } catch (Exception e) {
            log.error("[CrawlCycle] Error logging stats: {}", e.getMessage(), e);
        }
    }
}
