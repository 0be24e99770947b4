package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.CrawlJobReport;
import com.tigerwatch.monitor.dto.DetectionResult;
import com.tigerwatch.monitor.dto.IdentificationOptions;
import com.tigerwatch.monitor.dto.IdentificationResult;
import com.tigerwatch.monitor.dto.ScrapeResult;
import com.tigerwatch.monitor.entity.Evidence;
import com.tigerwatch.monitor.entity.Facility;
import com.tigerwatch.monitor.exception.FacilityNotFoundException;
import com.tigerwatch.monitor.exception.ImageFetchException;
import com.tigerwatch.monitor.repository.EvidenceRepository;
import com.tigerwatch.monitor.repository.FacilityRepository;
import com.tigerwatch.monitor.service.evidence.EvidenceSynthesizer;
import com.tigerwatch.monitor.service.image.DetectionStage;
import com.tigerwatch.monitor.service.image.IdentificationStage;
import com.tigerwatch.monitor.service.image.ImageExtractor;
import com.tigerwatch.monitor.service.image.ImageFetcher;
import com.tigerwatch.monitor.service.retrieval.RetrievalGateway;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one facility crawl end to end:
 * scrape each source → extract images → detect → identify → evidence, then one crawl-history row.
 *
 * Sources are processed one after another (social links in configured order, then the website),
 * images within a source in extraction order. A failing source or image is recorded and skipped;
 * only a missing facility fails the job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlJobRunner {

    private final FacilityRepository facilityRepository;
    private final EvidenceRepository evidenceRepository;
    private final RetrievalGateway retrievalGateway;
    private final ImageExtractor imageExtractor;
    private final ImageFetcher imageFetcher;
    private final DetectionStage detectionStage;
    private final IdentificationStage identificationStage;
    private final EvidenceSynthesizer evidenceSynthesizer;
    private final CrawlHistoryLedger crawlHistoryLedger;
    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, CrawlCancellationToken> runningJobs = new ConcurrentHashMap<>();

    public CrawlJobReport run(String facilityId) {
        return run(UUID.randomUUID().toString(), facilityId);
    }

    public CrawlJobReport run(String taskId, String facilityId) {
        CrawlCancellationToken token = new CrawlCancellationToken();
        runningJobs.put(taskId, token);
        try {
            return execute(new CrawlJobExecution(taskId, facilityId, token));
        } finally {
            runningJobs.remove(taskId);
        }
    }

    private CrawlJobReport execute(CrawlJobExecution job) {
        job.start();
        Facility facility = null;
        try {
            Optional<Facility> found = facilityRepository.findById(job.getFacilityId());
            if (found.isEmpty()) {
                FacilityNotFoundException notFound = new FacilityNotFoundException(job.getFacilityId());
                log.warn("Crawl job aborted: taskId={}, {}", job.getTaskId(), notFound.getMessage());
                job.fail(notFound.getMessage());
                return finish(job, null);
            }
            facility = found.get();
            log.info("Starting crawl: taskId={}, facilityId={}, name={}", job.getTaskId(), facility.getId(), facility.getName());

            IdentificationOptions identificationOptions = identificationStage.defaultOptions();
            for (CrawlSource source : CrawlSource.of(facility)) {
                if (job.shouldStop()) {
                    break;
                }
                try {
                    crawlSource(job, facility, source, identificationOptions);
                } catch (Exception e) {
                    log.error("Error crawling {} ({}) for facilityId={}", source.platform(), source.url(), facility.getId(), e);
                    job.addError("Error crawling " + source.platform() + " (" + source.url() + "): " + describe(e));
                }
            }

            markCrawled(job, facility);
            job.complete();
        } catch (RuntimeException e) {
            log.error("Crawl job failed unexpectedly: taskId={}, facilityId={}", job.getTaskId(), job.getFacilityId(), e);
            if (!job.getState().isTerminal()) {
                job.fail("Crawl job failed: " + describe(e));
            }
        }
        return finish(job, facility);
    }

    private void crawlSource(CrawlJobExecution job, Facility facility, CrawlSource source,
                             IdentificationOptions identificationOptions) {
        ScrapeResult page = retrievalGateway.scrape(source.url(), false);
        if (page.hasError()) {
            job.addError(source.platform() + ": " + page.getError());
            return;
        }
        if (page.getWarning() != null) {
            log.debug("Scrape degraded for {}: {}", source.url(), page.getWarning());
        }
        job.pageCrawled(source.platform());

        List<String> images = imageExtractor.extractImages(page.getContent(), page.getHtml(), source.url());
        job.imagesFound(images.size());
        int cap = properties.getCrawl().getMaxImagesPerSource();
        List<String> batch = images.size() > cap ? images.subList(0, cap) : images;

        List<Evidence> created = new ArrayList<>();
        for (String imageUrl : batch) {
            if (job.shouldStop()) {
                break;
            }
            processImage(job, facility, source, imageUrl, identificationOptions).ifPresent(created::add);
        }

        if (!created.isEmpty()) {
            job.evidenceCreated(persist(job, created));
        }
        log.info("Crawled {} for facilityId={}: images={}, processed={}, evidence={}",
                source.platform(), facility.getId(), images.size(), batch.size(), created.size());
    }

    private Optional<Evidence> processImage(CrawlJobExecution job, Facility facility, CrawlSource source,
                                            String imageUrl, IdentificationOptions identificationOptions) {
        job.imageProcessed();
        try {
            byte[] imageBytes = imageFetcher.fetch(imageUrl);
            DetectionResult detection = detectionStage.detect(imageBytes);
            if (!detection.detected()) {
                if (detection.hasError()) {
                    job.imageFailed();
                }
                return Optional.empty();
            }

            IdentificationResult identification = identificationStage.identify(imageBytes, identificationOptions);
            Evidence evidence = evidenceSynthesizer.createEvidence(
                    facility, source.url(), source.sourceType(), imageUrl, detection, identification);

            // counted only once the image has produced evidence
            job.tigerDetected();
            if (identification.identified()) {
                job.tigerIdentified();
            }
            if (identification.hasError()) {
                job.imageFailed();
            }
            return Optional.of(evidence);
        } catch (ImageFetchException e) {
            log.debug("{}", e.getMessage());
            job.imageFailed();
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Image skipped: facilityId={}, imageUrl={}, error={}", facility.getId(), imageUrl, describe(e));
            job.imageFailed();
            return Optional.empty();
        }
    }

    /**
     * Saves a source's evidence in one batch; if the batch is rejected, row by row so one bad row
     * does not drop its siblings.
     *
     * @return number of rows saved
     */
    private int persist(CrawlJobExecution job, List<Evidence> created) {
        try {
            evidenceRepository.saveAll(created);
            return created.size();
        } catch (RuntimeException batchError) {
            log.warn("Evidence batch save failed for facilityId={}, retrying row by row: {}",
                    job.getFacilityId(), describe(batchError));
        }
        int saved = 0;
        for (Evidence evidence : created) {
            try {
                evidenceRepository.save(evidence);
                saved++;
            } catch (RuntimeException e) {
                log.error("Failed to save evidence: facilityId={}, sourceUrl={}", job.getFacilityId(), evidence.getSourceUrl(), e);
                job.imageFailed();
            }
        }
        return saved;
    }

    private void markCrawled(CrawlJobExecution job, Facility facility) {
        try {
            facilityRepository.updateLastCrawledAt(facility.getId(), LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("Failed to update lastCrawledAt for facilityId={}", facility.getId(), e);
            job.addError("Failed to update last crawl time: " + describe(e));
        }
    }

    private CrawlJobReport finish(CrawlJobExecution job, Facility facility) {
        CrawlJobReport report = job.toReport();
        String primarySource = facility == null ? null
                : CrawlSource.of(facility).stream().findFirst().map(CrawlSource::url).orElse(null);
        try {
            crawlHistoryLedger.record(job.getTaskId(), primarySource, report,
                    job.statistics(facility != null && facility.isReference()),
                    job.getStartedAt(), job.getFinishedAt() != null ? job.getFinishedAt() : LocalDateTime.now());
        } catch (RuntimeException e) {
            log.error("Failed to record crawl history: taskId={}, facilityId={}", job.getTaskId(), job.getFacilityId(), e);
        }

        meterRegistry.counter("monitor.crawl.jobs", "status", report.getStatus()).increment();
        log.info("Crawl finished: taskId={}, facilityId={}, status={}, images={}, detected={}, identified={}, evidence={}, errors={}, durationMs={}",
                job.getTaskId(), job.getFacilityId(), report.getStatus(), report.getImagesFound(),
                report.getTigersDetected(), report.getTigersIdentified(), report.getEvidenceCreated(),
                report.hasErrors() ? report.getErrors().size() : 0, report.getDurationMs());
        return report;
    }

    public int runningJobCount() {
        return runningJobs.size();
    }

    /**
     * Requests every running job to stop after its current image. Each job still records its history row.
     */
    @PreDestroy
    public void cancelAll() {
        if (!runningJobs.isEmpty()) {
            log.info("Cancelling {} running crawl jobs", runningJobs.size());
        }
        runningJobs.values().forEach(CrawlCancellationToken::cancel);
    }

    public boolean cancel(String taskId) {
        CrawlCancellationToken token = runningJobs.get(taskId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
