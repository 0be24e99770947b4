package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.BatchDispatchResult;
import com.tigerwatch.monitor.dto.BatchDispatchResult.FailedDispatch;
import com.tigerwatch.monitor.dto.BatchDispatchResult.ScheduledCrawl;
import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.dto.DispatchHandle;
import com.tigerwatch.monitor.dto.FacilityPriority;
import com.tigerwatch.monitor.entity.CrawlHistory;
import com.tigerwatch.monitor.entity.Facility;
import com.tigerwatch.monitor.exception.DispatchException;
import com.tigerwatch.monitor.exception.FacilityNotFoundException;
import com.tigerwatch.monitor.exception.MonitorException;
import com.tigerwatch.monitor.exception.NoSourcesException;
import com.tigerwatch.monitor.repository.FacilityRepository;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Facility crawl prioritisation and dispatch.
 *
 * 우선순위 점수 (가산식, 정규화 없음):
 * - 기준 시설 +100
 * - 알려진 호랑이 수 × 10
 * - 위반 이력 수 × 15
 * - 소셜 미디어 소스 수 × 5
 * - 마지막 크롤링 후 30일 초과 +20, 한 번도 크롤링되지 않음 +30
 *
 * Dispatch hands a command to the {@link CrawlDispatcher} and returns immediately;
 * batch dispatch collects per-facility failures instead of aborting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlPriorityScheduler {

    private final FacilityRepository facilityRepository;
    private final CrawlHistoryLedger crawlHistoryLedger;
    private final CrawlDispatcher crawlDispatcher;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    // ========================================
    // Priority
    // ========================================

    public int priority(Facility facility, Optional<CrawlHistory> latestCrawl) {
        return priority(facility, latestCrawl, LocalDateTime.now());
    }

    int priority(Facility facility, Optional<CrawlHistory> latestCrawl, LocalDateTime now) {
        MonitorProperties.Scheduler weights = properties.getScheduler();
        int score = 0;

        if (facility.isReference()) {
            score += nonNegative(weights.getReferenceBonus());
        }
        score += facility.knownTigerCount() * nonNegative(weights.getPerKnownTiger());
        score += facility.violationCount() * nonNegative(weights.getPerViolation());
        score += facility.socialMediaSourceCount() * nonNegative(weights.getPerSocialMediaSource());

        LocalDateTime lastCrawled = effectiveLastCrawl(facility, latestCrawl);
        if (lastCrawled == null) {
            score += nonNegative(weights.getNeverCrawledBonus());
        } else if (ChronoUnit.DAYS.between(lastCrawled, now) > weights.getStaleBonusAfterDays()) {
            score += nonNegative(weights.getStaleBonus());
        }
        return Math.max(0, score);
    }

    private static int nonNegative(int weight) {
        return Math.max(0, weight);
    }

    /**
     * Later of the facility's own timestamp and the newest crawl-history row.
     */
    static LocalDateTime effectiveLastCrawl(Facility facility, Optional<CrawlHistory> latestCrawl) {
        LocalDateTime fromFacility = facility.getLastCrawledAt();
        LocalDateTime fromHistory = latestCrawl.map(CrawlHistory::getCompletedAt).orElse(null);
        if (fromFacility == null) return fromHistory;
        if (fromHistory == null) return fromFacility;
        return fromHistory.isAfter(fromFacility) ? fromHistory : fromFacility;
    }

    // ========================================
    // Selection
    // ========================================

    /**
     * Facilities not crawled within {@code staleAfter}, best priority first, at most {@code maxCount}.
     */
    public List<FacilityPriority> dueForCrawl(int maxCount, boolean referenceOnly, Duration staleAfter) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime cutoff = now.minus(staleAfter);

        List<Facility> candidates = facilityRepository.findDueForCrawl(cutoff, referenceOnly);
        Map<String, CrawlHistory> latest = crawlHistoryLedger.latestFor(
                candidates.stream().map(Facility::getId).toList());

        List<FacilityPriority> due = new ArrayList<>();
        for (Facility facility : candidates) {
            Optional<CrawlHistory> history = Optional.ofNullable(latest.get(facility.getId()));
            LocalDateTime lastCrawled = effectiveLastCrawl(facility, history);
            if (lastCrawled != null && !lastCrawled.isBefore(cutoff)) {
                // history says it was crawled recently even though the facility row lags behind
                continue;
            }
            due.add(FacilityPriority.builder()
                    .facilityId(facility.getId())
                    .facilityName(facility.getName())
                    .priority(priority(facility, history, now))
                    .lastCrawledAt(lastCrawled)
                    .reference(facility.isReference())
                    .hasSocialMedia(facility.socialMediaSourceCount() > 0)
                    .tigerCount(facility.knownTigerCount())
                    .build());
        }

        due.sort(Comparator.comparingInt(FacilityPriority::getPriority).reversed()
                .thenComparing(FacilityPriority::getFacilityId));
        List<FacilityPriority> selected = due.size() > maxCount ? new ArrayList<>(due.subList(0, Math.max(0, maxCount))) : due;

        log.debug("Due for crawl: candidates={}, due={}, selected={}, referenceOnly={}",
                candidates.size(), due.size(), selected.size(), referenceOnly);
        return selected;
    }

    // ========================================
    // Dispatch
    // ========================================

    /**
     * @throws FacilityNotFoundException unknown facility
     * @throws NoSourcesException        facility has neither website nor social-media links
     * @throws DispatchException         queue backend refused the command or the scheduler is shutting down
     */
    public DispatchHandle dispatch(String facilityId) {
        Facility facility = facilityRepository.findById(facilityId)
                .orElseThrow(() -> new FacilityNotFoundException(facilityId));
        return dispatch(facility);
    }

    private DispatchHandle dispatch(Facility facility) {
        if (shuttingDown.get()) {
            throw DispatchException.shuttingDown(facility.getId());
        }
        if (!facility.hasCrawlSources()) {
            throw new NoSourcesException(facility.getId());
        }

        String taskId = UUID.randomUUID().toString();
        crawlDispatcher.dispatch(new CrawlCommandMessage(taskId, facility.getId(), LocalDateTime.now()));
        meterRegistry.counter("monitor.dispatch", "backend", crawlDispatcher.backendName()).increment();

        log.info("Dispatched crawl: facilityId={}, name={}, taskId={}", facility.getId(), facility.getName(), taskId);
        return DispatchHandle.scheduled(facility.getId(), taskId);
    }

    /**
     * Dispatches the given facilities, or auto-selects the due set when {@code facilityIds} is null or empty.
     * {@code maxCount} and {@code referenceOnly} only shape auto-selection.
     */
    public BatchDispatchResult dispatchBatch(List<String> facilityIds, int maxCount, boolean referenceOnly) {
        List<String> targets = (facilityIds == null || facilityIds.isEmpty())
                ? dueForCrawl(maxCount, referenceOnly, properties.getScheduler().getStaleAfter()).stream()
                        .map(FacilityPriority::getFacilityId)
                        .toList()
                : new ArrayList<>(new LinkedHashSet<>(facilityIds));

        Map<String, Facility> facilities = new HashMap<>();
        for (Facility facility : facilityRepository.findByIdIn(targets)) {
            facilities.put(facility.getId(), facility);
        }

        BatchDispatchResult result = BatchDispatchResult.builder().build();
        for (String facilityId : targets) {
            Facility facility = facilities.get(facilityId);
            try {
                if (facility == null) {
                    throw new FacilityNotFoundException(facilityId);
                }
                DispatchHandle handle = dispatch(facility);
                result.getScheduled().add(new ScheduledCrawl(facilityId, facility.getName(), handle.taskId()));
            } catch (MonitorException e) {
                log.warn("Dispatch failed: facilityId={}, code={}, error={}", facilityId, e.getErrorCode(), e.getMessage());
                result.getFailed().add(new FailedDispatch(facilityId, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Unexpected dispatch failure: facilityId={}", facilityId, e);
                result.getFailed().add(new FailedDispatch(facilityId, e.getMessage()));
            }
        }

        log.info("Batch dispatch complete: scheduled={}, failed={}", result.getScheduledCount(), result.getFailedCount());
        return result;
    }

    @PreDestroy
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            log.info("Crawl scheduler shutting down; new dispatches will be rejected");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
