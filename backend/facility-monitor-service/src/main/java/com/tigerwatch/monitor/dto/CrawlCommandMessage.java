package com.tigerwatch.monitor.dto;

import java.time.LocalDateTime;

/**
 * Dispatch payload handed to the crawl queue
 */
public record CrawlCommandMessage(
        String taskId,
        String facilityId,
        LocalDateTime requestedAt
) {
}
