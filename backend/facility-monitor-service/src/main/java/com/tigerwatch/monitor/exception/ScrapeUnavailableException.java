package com.tigerwatch.monitor.exception;

/**
 * 스크래핑 백엔드 미설정/사용 불가
 */
public class ScrapeUnavailableException extends MonitorException {

    public ScrapeUnavailableException(String message) {
        super("SCRAPE_UNAVAILABLE", message);
    }

    /**
     * API 키 미설정
     */
    public static ScrapeUnavailableException notConfigured() {
        return new ScrapeUnavailableException(
                "Scrape backend API key not configured. Set SCRAPE_API_KEY to enable web scraping.");
    }
}
