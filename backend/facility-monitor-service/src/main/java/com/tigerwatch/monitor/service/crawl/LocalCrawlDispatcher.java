package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.exception.DispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * In-process dispatch onto the {@code crawlJobExecutor} pool. Used when no broker is deployed.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "monitor.dispatch.mode", havingValue = "local")
public class LocalCrawlDispatcher implements CrawlDispatcher {

    private final TaskExecutor crawlJobExecutor;
    private final CrawlJobRunner crawlJobRunner;

    public LocalCrawlDispatcher(@Qualifier("crawlJobExecutor") TaskExecutor crawlJobExecutor,
                                CrawlJobRunner crawlJobRunner) {
        this.crawlJobExecutor = crawlJobExecutor;
        this.crawlJobRunner = crawlJobRunner;
    }

    @Override
    public void dispatch(CrawlCommandMessage command) {
        try {
            crawlJobExecutor.execute(() -> crawlJobRunner.run(command.taskId(), command.facilityId()));
        } catch (TaskRejectedException e) {
            throw DispatchException.backendUnavailable(command.facilityId(), e);
        }
        log.debug("Queued crawl job locally: taskId={}, facilityId={}", command.taskId(), command.facilityId());
    }

    @Override
    public String backendName() {
        return "local";
    }
}
