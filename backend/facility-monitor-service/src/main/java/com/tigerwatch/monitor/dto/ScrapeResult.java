package com.tigerwatch.monitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scraped page. {@code warning} marks a degraded (unconfigured) backend,
 * {@code error} marks a failed scrape of this particular URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeResult {
    private String url;

    @Builder.Default
    private String content = "";

    @Builder.Default
    private String html = "";

    private String title;
    private String extracted;
    private String warning;
    private String error;

    public static ScrapeResult degraded(String url, String warning) {
        return ScrapeResult.builder().url(url).warning(warning).build();
    }

    public static ScrapeResult failed(String url, String error) {
        return ScrapeResult.builder().url(url).error(error).build();
    }

    public boolean hasError() {
        return error != null;
    }
}
