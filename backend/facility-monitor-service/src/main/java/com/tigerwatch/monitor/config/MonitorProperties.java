package com.tigerwatch.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Facility monitoring pipeline settings.
 *
 * Scoring constants are heuristics; only their relative ordering is relied on
 * (reference facilities first, more evidence never lowers a score).
 */
@Configuration
@ConfigurationProperties(prefix = "monitor")
@Data
public class MonitorProperties {

    private Scheduler scheduler = new Scheduler();
    private Dispatch dispatch = new Dispatch();
    private Retrieval retrieval = new Retrieval();
    private Crawl crawl = new Crawl();
    private Detection detection = new Detection();
    private Identification identification = new Identification();
    private EvidenceScoring evidence = new EvidenceScoring();

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String cron = "0 0 */6 * * *";
        /** Facilities last crawled within this window are not due */
        private Duration staleAfter = Duration.ofHours(24);
        private int batchMaxFacilities = 20;
        private boolean referenceOnly = true;
        private long statsIntervalMs = 600_000L;
        private int statsWindowDays = 30;

        // priority weights
        private int referenceBonus = 100;
        private int perKnownTiger = 10;
        private int perViolation = 15;
        private int perSocialMediaSource = 5;
        private int staleBonus = 20;
        private int staleBonusAfterDays = 30;
        private int neverCrawledBonus = 30;
    }

    @Data
    public static class Dispatch {
        /** kafka | local */
        private String mode = "kafka";
        private String topic = "tigerwatch.crawl.commands";
    }

    @Data
    public static class Retrieval {
        private Search search = new Search();
        private Cache cache = new Cache();
        private Scrape scrape = new Scrape();
    }

    @Data
    public static class Search {
        /** Primary provider, tried first */
        private String provider = "serper";
        /** Alternates tried in order after the primary */
        private List<String> fallbackOrder = new ArrayList<>(List.of("serper", "tavily", "perplexity"));
        private int defaultLimit = 10;
        private int maxLimit = 20;
        private Duration timeout = Duration.ofSeconds(30);
        private String serpUrlTemplate = "https://www.google.com/search?q=%s&num=%d";
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private String keyPrefix = "tigerwatch:search:";
    }

    @Data
    public static class Scrape {
        private String baseUrl = "https://api.firecrawl.dev/v1";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Crawl {
        private int maxImagesPerPage = 50;
        private int maxImagesPerSource = 20;
        private Duration imageFetchTimeout = Duration.ofSeconds(30);
        private int maxImageBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class Detection {
        private String baseUrl = "http://model-serving:8000";
        private double minConfidence = 0.5;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Identification {
        private String model = "wildlife_tools";
        private double similarityThreshold = 0.8;
        private int maxMatches = 5;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class EvidenceScoring {
        private double baseScore = 0.5;
        private double socialMediaBonus = 0.10;
        private double webSearchBonus = 0.05;
        private double trustedDomainBonus = 0.10;
        private List<String> trustedDomainSuffixes = new ArrayList<>(List.of(".gov", ".edu", ".org"));
        private double referenceFacilityBonus = 0.20;
        /** Weight applied to the aggregate detection confidence */
        private double detectionConfidenceWeight = 0.10;
        private double identifiedBonus = 0.10;
        private double highRelevanceThreshold = 0.8;
    }
}
