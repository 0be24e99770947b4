package com.tigerwatch.monitor.dto;

/**
 * Aggregate crawl-history statistics over a trailing window of days
 */
public record CrawlStatisticsDto(
        long totalCrawls,
        long successfulCrawls,
        long failedCrawls,
        long totalImagesFound,
        long totalTigersIdentified,
        long averageDurationMs,
        String facilityId,
        int days
) {
}
