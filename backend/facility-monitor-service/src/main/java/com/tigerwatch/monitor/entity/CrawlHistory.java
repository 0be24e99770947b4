package com.tigerwatch.monitor.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One row per crawl job execution. Written once by the ledger, never updated.
 */
@Entity
@Immutable
@Table(name = "crawl_history", indexes = {
        @Index(name = "idx_crawl_history_facility", columnList = "facility_id, completed_at"),
        @Index(name = "idx_crawl_history_status", columnList = "status"),
        @Index(name = "idx_crawl_history_crawled_at", columnList = "crawled_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CrawlHistory {

    @Id
    @Column(name = "crawl_id", length = 36)
    private String id;

    @Column(name = "facility_id", length = 36)
    private String facilityId;

    @Column(name = "source_url", nullable = false, length = 500)
    private String sourceUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CrawlHistoryStatus status;

    @Column(name = "images_found")
    @Builder.Default
    private Integer imagesFound = 0;

    @Column(name = "tigers_detected")
    @Builder.Default
    private Integer tigersDetected = 0;

    @Column(name = "tigers_identified")
    @Builder.Default
    private Integer tigersIdentified = 0;

    @Column(name = "pages_crawled")
    @Builder.Default
    private Integer pagesCrawled = 0;

    @Column(name = "crawl_duration_ms")
    private Long crawlDurationMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_log", columnDefinition = "jsonb")
    private List<String> errorLog;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "crawl_statistics", columnDefinition = "jsonb")
    private Map<String, Object> crawlStatistics;

    @CreationTimestamp
    @Column(name = "crawled_at", updatable = false)
    private LocalDateTime crawledAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public boolean isCompleted() {
        return status == CrawlHistoryStatus.COMPLETED;
    }
}
