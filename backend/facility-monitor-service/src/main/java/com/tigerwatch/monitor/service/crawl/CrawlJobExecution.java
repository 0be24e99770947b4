package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlJobReport;
import lombok.Getter;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one running crawl job. Confined to the thread executing the job.
 */
@Getter
class CrawlJobExecution {

    private final String taskId;
    private final String facilityId;
    private final CrawlCancellationToken cancellationToken;

    private CrawlJobState state = CrawlJobState.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private long startNanos;

    private int imagesFound;
    private int imagesProcessed;
    private int imageFailures;
    private int tigersDetected;
    private int tigersIdentified;
    private int evidenceCreated;
    private int pagesCrawled;
    private boolean cancelled;

    private final List<String> errors = new ArrayList<>();
    private final List<String> platformsCrawled = new ArrayList<>();

    CrawlJobExecution(String taskId, String facilityId, CrawlCancellationToken cancellationToken) {
        this.taskId = taskId;
        this.facilityId = facilityId;
        this.cancellationToken = cancellationToken;
    }

    void start() {
        transition(CrawlJobState.RUNNING);
        startedAt = LocalDateTime.now();
        startNanos = System.nanoTime();
    }

    void complete() {
        transition(CrawlJobState.COMPLETED);
        finishedAt = LocalDateTime.now();
    }

    void fail(String error) {
        errors.add(error);
        transition(CrawlJobState.FAILED);
        finishedAt = LocalDateTime.now();
    }

    private void transition(CrawlJobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal crawl job transition " + state + " -> " + next + " for task " + taskId);
        }
        state = next;
    }

    boolean shouldStop() {
        if (!cancelled && cancellationToken.isCancelled()) {
            cancelled = true;
            errors.add("crawl cancelled");
        }
        return cancelled;
    }

    void addError(String error) { errors.add(error); }

    void pageCrawled(String platform) {
        pagesCrawled++;
        platformsCrawled.add(platform);
    }

    void imagesFound(int count) { imagesFound += count; }

    void imageProcessed() { imagesProcessed++; }

    void imageFailed() { imageFailures++; }

    void tigerDetected() { tigersDetected++; }

    void tigerIdentified() { tigersIdentified++; }

    void evidenceCreated(int count) { evidenceCreated += count; }

    long durationMs() {
        return startNanos == 0 ? 0 : Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    CrawlJobReport toReport() {
        return CrawlJobReport.builder()
                .facilityId(facilityId)
                .imagesFound(imagesFound)
                .tigersDetected(tigersDetected)
                .tigersIdentified(tigersIdentified)
                .evidenceCreated(evidenceCreated)
                .pagesCrawled(pagesCrawled)
                .durationMs(durationMs())
                .status(state == CrawlJobState.COMPLETED ? "completed" : "failed")
                .errors(errors.isEmpty() ? null : List.copyOf(errors))
                .build();
    }

    Map<String, Object> statistics(boolean referenceFacility) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("tigers_detected", tigersDetected);
        stats.put("evidence_created", evidenceCreated);
        stats.put("platforms_crawled", List.copyOf(platformsCrawled));
        stats.put("is_reference_facility", referenceFacility);
        stats.put("images_processed", imagesProcessed);
        stats.put("image_failures", imageFailures);
        stats.put("cancelled", cancelled);
        return stats;
    }
}
