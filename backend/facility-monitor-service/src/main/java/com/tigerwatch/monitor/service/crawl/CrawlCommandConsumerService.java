package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.dto.CrawlJobReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer for crawl commands.
 * The runner records every outcome in the crawl history itself, so a finished job is never retried;
 * only messages that cannot be processed at all reach the DLQ through the KafkaConfig error handler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "monitor.dispatch.mode", havingValue = "kafka", matchIfMissing = true)
public class CrawlCommandConsumerService {

    private final CrawlJobRunner crawlJobRunner;

    @KafkaListener(
            topics = "${monitor.dispatch.topic:tigerwatch.crawl.commands}",
            groupId = "${spring.application.name}-crawl",
            containerFactory = "crawlCommandKafkaListenerContainerFactory"
    )
    public void handleCrawlCommand(CrawlCommandMessage command) {
        if (command == null || command.facilityId() == null || command.facilityId().isBlank()) {
            throw new IllegalArgumentException("Crawl command without facility id: " + command);
        }
        log.info("Processing crawl command: taskId={}, facilityId={}, requestedAt={}",
                command.taskId(), command.facilityId(), command.requestedAt());

        CrawlJobReport report = crawlJobRunner.run(command.taskId(), command.facilityId());

        log.info("Crawl command finished: taskId={}, facilityId={}, status={}, evidence={}",
                command.taskId(), command.facilityId(), report.getStatus(), report.getEvidenceCreated());
    }
}
