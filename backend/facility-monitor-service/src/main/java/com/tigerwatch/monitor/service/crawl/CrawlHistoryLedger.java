package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlJobReport;
import com.tigerwatch.monitor.dto.CrawlStatisticsDto;
import com.tigerwatch.monitor.entity.CrawlHistory;
import com.tigerwatch.monitor.entity.CrawlHistoryStatus;
import com.tigerwatch.monitor.repository.CrawlHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Sole writer of {@link CrawlHistory}. Rows are keyed by the job's task id, so one job
 * can never own more than one history row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlHistoryLedger {

    private final CrawlHistoryRepository crawlHistoryRepository;

    @Transactional
    public CrawlHistory record(String taskId,
                               String primarySourceUrl,
                               CrawlJobReport report,
                               Map<String, Object> statistics,
                               LocalDateTime startedAt,
                               LocalDateTime completedAt) {
        CrawlHistory history = CrawlHistory.builder()
                .id(taskId)
                .facilityId(report.getFacilityId())
                .sourceUrl(primarySourceUrl)
                .status(report.isCompleted() ? CrawlHistoryStatus.COMPLETED : CrawlHistoryStatus.FAILED)
                .imagesFound(report.getImagesFound())
                .tigersDetected(report.getTigersDetected())
                .tigersIdentified(report.getTigersIdentified())
                .pagesCrawled(report.getPagesCrawled())
                .crawlDurationMs(report.getDurationMs())
                .errorLog(report.hasErrors() ? List.copyOf(report.getErrors()) : null)
                .crawlStatistics(statistics != null ? new LinkedHashMap<>(statistics) : null)
                .crawledAt(startedAt)
                .completedAt(completedAt)
                .build();

        CrawlHistory saved = crawlHistoryRepository.save(history);
        log.info("Recorded crawl history: crawlId={}, facilityId={}, status={}, images={}, detected={}, identified={}",
                saved.getId(), saved.getFacilityId(), saved.getStatus().getValue(),
                saved.getImagesFound(), saved.getTigersDetected(), saved.getTigersIdentified());
        return saved;
    }

    /**
     * Most recent history row per facility. Facilities never crawled are absent from the map.
     */
    @Transactional(readOnly = true)
    public Map<String, CrawlHistory> latestFor(Collection<String> facilityIds) {
        if (facilityIds == null || facilityIds.isEmpty()) {
            return Map.of();
        }
        Map<String, CrawlHistory> latest = new HashMap<>();
        // ties on completedAt: keep the first row seen
        for (CrawlHistory history : crawlHistoryRepository.findLatestByFacilityIdIn(facilityIds)) {
            latest.putIfAbsent(history.getFacilityId(), history);
        }
        return latest;
    }

    /**
     * Aggregates over the trailing {@code days}; {@code facilityId == null} means all facilities.
     */
    @Transactional(readOnly = true)
    public CrawlStatisticsDto statistics(String facilityId, int days) {
        LocalDateTime since = LocalDateTime.now().minusDays(days);
        List<CrawlHistory> crawls = facilityId != null
                ? crawlHistoryRepository.findByFacilityIdAndCompletedAtGreaterThanEqual(facilityId, since)
                : crawlHistoryRepository.findByCompletedAtGreaterThanEqual(since);

        long successful = crawls.stream().filter(CrawlHistory::isCompleted).count();
        long imagesFound = crawls.stream().mapToLong(h -> nullToZero(h.getImagesFound())).sum();
        long tigersIdentified = crawls.stream().mapToLong(h -> nullToZero(h.getTigersIdentified())).sum();
        long averageDuration = Math.round(crawls.stream()
                .filter(h -> h.getCrawlDurationMs() != null)
                .mapToLong(CrawlHistory::getCrawlDurationMs)
                .average()
                .orElse(0.0));

        return new CrawlStatisticsDto(
                crawls.size(),
                successful,
                crawls.size() - successful,
                imagesFound,
                tigersIdentified,
                averageDuration,
                facilityId,
                days);
    }

    private static long nullToZero(Integer value) {
        return value != null ? value : 0L;
    }
}
