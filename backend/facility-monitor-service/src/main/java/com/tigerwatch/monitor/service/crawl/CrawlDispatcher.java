package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.exception.DispatchException;

/**
 * Hands a crawl command to whatever runs crawl jobs asynchronously.
 * Returns once the command is accepted; never waits for the job itself.
 */
public interface CrawlDispatcher {

    /**
     * @throws DispatchException when the backend does not accept the command
     */
    void dispatch(CrawlCommandMessage command);

    String backendName();
}
