package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.entity.EvidenceSourceType;
import com.tigerwatch.monitor.entity.Facility;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One crawl target of a facility.
 *
 * @param platform social platform key, or {@code "website"}
 */
public record CrawlSource(String platform, String url, EvidenceSourceType sourceType) {

    static final String WEBSITE = "website";

    /**
     * Social-media links in their configured order, then the website.
     */
    static List<CrawlSource> of(Facility facility) {
        List<CrawlSource> sources = new ArrayList<>();
        if (facility.getSocialMediaLinks() != null) {
            for (Map.Entry<String, String> link : facility.getSocialMediaLinks().entrySet()) {
                if (link.getValue() != null && !link.getValue().isBlank()) {
                    sources.add(new CrawlSource(link.getKey(), link.getValue().trim(), EvidenceSourceType.SOCIAL_MEDIA));
                }
            }
        }
        if (facility.hasWebsite()) {
            sources.add(new CrawlSource(WEBSITE, facility.getWebsite().trim(), EvidenceSourceType.WEB_SEARCH));
        }
        return sources;
    }
}
