package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.dto.ScrapeResult;

/**
 * Page scraping capability. Throws on failure; the gateway decides how to degrade.
 */
public interface ScrapeBackend {

    boolean isConfigured();

    ScrapeResult scrape(String url, boolean extractStructured);
}
