package com.tigerwatch.monitor.service.crawl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one running crawl job.
 * The job checks it between sources and between images.
 */
public class CrawlCancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
