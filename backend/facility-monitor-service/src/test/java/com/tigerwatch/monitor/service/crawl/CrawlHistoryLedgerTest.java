package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.dto.CrawlJobReport;
import com.tigerwatch.monitor.dto.CrawlStatisticsDto;
import com.tigerwatch.monitor.entity.CrawlHistory;
import com.tigerwatch.monitor.entity.CrawlHistoryStatus;
import com.tigerwatch.monitor.repository.CrawlHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlHistoryLedgerTest {

    @Mock
    private CrawlHistoryRepository crawlHistoryRepository;

    private CrawlHistoryLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new CrawlHistoryLedger(crawlHistoryRepository);
    }

    private static CrawlHistory history(String id, String facilityId, CrawlHistoryStatus status,
                                        int images, int identified, Long durationMs, LocalDateTime completedAt) {
        return CrawlHistory.builder()
                .id(id)
                .facilityId(facilityId)
                .sourceUrl("https://example.com")
                .status(status)
                .imagesFound(images)
                .tigersIdentified(identified)
                .crawlDurationMs(durationMs)
                .completedAt(completedAt)
                .build();
    }

    @Test
    @DisplayName("작업 보고서를 이력 행으로 기록 - ID는 task id, 오류 없으면 error_log null")
    void record_mapsReport() {
        // given
        when(crawlHistoryRepository.save(any(CrawlHistory.class))).thenAnswer(inv -> inv.getArgument(0));
        CrawlJobReport report = CrawlJobReport.builder()
                .facilityId("fac-1")
                .imagesFound(7)
                .tigersDetected(2)
                .tigersIdentified(1)
                .pagesCrawled(3)
                .durationMs(1500)
                .status("completed")
                .build();
        LocalDateTime started = LocalDateTime.of(2024, 5, 1, 12, 0);

        // when
        CrawlHistory saved = ledger.record("task-1", "https://facebook.com/zoo", report,
                Map.of("tigers_detected", 2), started, started.plusSeconds(2));

        // then
        assertThat(saved.getId()).isEqualTo("task-1");
        assertThat(saved.getFacilityId()).isEqualTo("fac-1");
        assertThat(saved.getStatus()).isEqualTo(CrawlHistoryStatus.COMPLETED);
        assertThat(saved.getImagesFound()).isEqualTo(7);
        assertThat(saved.getTigersIdentified()).isEqualTo(1);
        assertThat(saved.getPagesCrawled()).isEqualTo(3);
        assertThat(saved.getCrawlDurationMs()).isEqualTo(1500L);
        assertThat(saved.getErrorLog()).isNull();
        assertThat(saved.getCrawlStatistics()).containsEntry("tigers_detected", 2);
        assertThat(saved.getCompletedAt()).isEqualTo(started.plusSeconds(2));
    }

    @Test
    @DisplayName("실패 보고서는 FAILED 상태와 오류 목록으로 기록")
    void record_failedReport() {
        // given
        when(crawlHistoryRepository.save(any(CrawlHistory.class))).thenAnswer(inv -> inv.getArgument(0));
        CrawlJobReport report = CrawlJobReport.builder()
                .facilityId("ghost")
                .status("failed")
                .errors(List.of("Facility not found: ghost"))
                .build();

        // when
        CrawlHistory saved = ledger.record("task-2", null, report, Map.of(), LocalDateTime.now(), LocalDateTime.now());

        // then
        assertThat(saved.getStatus()).isEqualTo(CrawlHistoryStatus.FAILED);
        assertThat(saved.getErrorLog()).containsExactly("Facility not found: ghost");
    }

    @Test
    @DisplayName("시설별 최신 이력 - 완료 시각이 같은 행이 여러 개면 첫 행만 유지")
    void latestFor_keepsOneRowPerFacility() {
        // given
        LocalDateTime now = LocalDateTime.now();
        CrawlHistory newestA = history("h3", "a", CrawlHistoryStatus.COMPLETED, 1, 0, 10L, now);
        CrawlHistory newestB = history("h2", "b", CrawlHistoryStatus.FAILED, 0, 0, 5L, now.minusDays(1));
        CrawlHistory tiedA = history("h1", "a", CrawlHistoryStatus.COMPLETED, 1, 0, 10L, now);
        when(crawlHistoryRepository.findLatestByFacilityIdIn(anyCollection()))
                .thenReturn(List.of(newestA, newestB, tiedA));

        // when
        Map<String, CrawlHistory> latest = ledger.latestFor(List.of("a", "b", "c"));

        // then
        assertThat(latest).containsOnlyKeys("a", "b");
        assertThat(latest.get("a").getId()).isEqualTo("h3");
    }

    @Test
    @DisplayName("빈 ID 목록은 저장소 조회 없이 빈 맵")
    void latestFor_emptyIds() {
        assertThat(ledger.latestFor(List.of())).isEmpty();
        verifyNoInteractions(crawlHistoryRepository);
    }

    @Test
    @DisplayName("기간 통계 - 성공/실패 건수, 이미지/식별 합계, 평균 소요 시간")
    void statistics_aggregatesWindow() {
        // given
        LocalDateTime now = LocalDateTime.now();
        when(crawlHistoryRepository.findByFacilityIdAndCompletedAtGreaterThanEqual(eq("fac-1"), any()))
                .thenReturn(List.of(
                        history("h1", "fac-1", CrawlHistoryStatus.COMPLETED, 10, 2, 1000L, now),
                        history("h2", "fac-1", CrawlHistoryStatus.COMPLETED, 4, 1, 3000L, now),
                        history("h3", "fac-1", CrawlHistoryStatus.FAILED, 0, 0, null, now)));

        // when
        CrawlStatisticsDto stats = ledger.statistics("fac-1", 30);

        // then
        assertThat(stats.totalCrawls()).isEqualTo(3);
        assertThat(stats.successfulCrawls()).isEqualTo(2);
        assertThat(stats.failedCrawls()).isEqualTo(1);
        assertThat(stats.totalImagesFound()).isEqualTo(14);
        assertThat(stats.totalTigersIdentified()).isEqualTo(3);
        assertThat(stats.averageDurationMs()).isEqualTo(2000);
        assertThat(stats.facilityId()).isEqualTo("fac-1");
        assertThat(stats.days()).isEqualTo(30);
    }

    @Test
    @DisplayName("시설 미지정 통계는 전체 이력 대상")
    void statistics_allFacilities() {
        when(crawlHistoryRepository.findByCompletedAtGreaterThanEqual(any())).thenReturn(List.of());

        CrawlStatisticsDto stats = ledger.statistics(null, 7);

        assertThat(stats.totalCrawls()).isZero();
        assertThat(stats.averageDurationMs()).isZero();
    }
}
