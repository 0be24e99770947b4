package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.exception.DispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes crawl commands to Kafka, keyed by facility id.
 * Waits for the broker acknowledgement only, so a dead broker shows up as a per-facility dispatch failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "monitor.dispatch.mode", havingValue = "kafka", matchIfMissing = true)
public class KafkaCrawlDispatcher implements CrawlDispatcher {

    private static final long SEND_ACK_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, CrawlCommandMessage> crawlCommandKafkaTemplate;
    private final MonitorProperties properties;

    @Override
    public void dispatch(CrawlCommandMessage command) {
        String topic = properties.getDispatch().getTopic();
        try {
            crawlCommandKafkaTemplate.send(topic, command.facilityId(), command)
                    .get(SEND_ACK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Published crawl command: topic={}, taskId={}, facilityId={}",
                    topic, command.taskId(), command.facilityId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DispatchException.backendUnavailable(command.facilityId(), e);
        } catch (ExecutionException e) {
            throw DispatchException.backendUnavailable(command.facilityId(), e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            throw DispatchException.backendUnavailable(command.facilityId(), e);
        }
    }

    @Override
    public String backendName() {
        return "kafka";
    }
}
