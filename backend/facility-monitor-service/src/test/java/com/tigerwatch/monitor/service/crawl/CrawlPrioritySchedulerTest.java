package com.tigerwatch.monitor.service.crawl;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.BatchDispatchResult;
import com.tigerwatch.monitor.dto.CrawlCommandMessage;
import com.tigerwatch.monitor.dto.DispatchHandle;
import com.tigerwatch.monitor.dto.FacilityPriority;
import com.tigerwatch.monitor.entity.CrawlHistory;
import com.tigerwatch.monitor.entity.CrawlHistoryStatus;
import com.tigerwatch.monitor.entity.Facility;
import com.tigerwatch.monitor.exception.DispatchException;
import com.tigerwatch.monitor.exception.NoSourcesException;
import com.tigerwatch.monitor.repository.FacilityRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * CrawlPriorityScheduler 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CrawlPrioritySchedulerTest {

    @Mock
    private FacilityRepository facilityRepository;

    @Mock
    private CrawlHistoryLedger crawlHistoryLedger;

    @Mock
    private CrawlDispatcher crawlDispatcher;

    private CrawlPriorityScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new CrawlPriorityScheduler(facilityRepository, crawlHistoryLedger, crawlDispatcher,
                new MonitorProperties(), new SimpleMeterRegistry());
    }

    private static Facility facility(String id, String website, Map<String, String> socialLinks) {
        return Facility.builder()
                .id(id)
                .name("Facility " + id)
                .website(website)
                .socialMediaLinks(new LinkedHashMap<>(socialLinks))
                .build();
    }

    private static List<Map<String, Object>> violations(int count) {
        List<Map<String, Object>> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            list.add(Map.of("citation", "c-" + i));
        }
        return list;
    }

    // ========================================
    // priority
    // ========================================

    @Test
    @DisplayName("우선순위 - 기준 시설, 호랑이 수, 위반 이력, 소셜 링크, 미크롤링 보너스 합산")
    void priority_addsEveryTerm() {
        // given
        Facility f = facility("f1", "https://zoo.example.com",
                Map.of("facebook", "https://facebook.com/zoo", "instagram", "https://instagram.com/zoo"));
        f.setReferenceFacility(true);
        f.setTigerCount(3);
        f.setViolationHistory(violations(2));

        // when
        int score = scheduler.priority(f, Optional.empty());

        // then: 100 + 3*10 + 2*15 + 2*5 + 30
        assertThat(score).isEqualTo(200);
    }

    @Test
    @DisplayName("우선순위 - 30일 넘게 크롤링되지 않으면 +20, 최근이면 보너스 없음")
    void priority_staleBonus() {
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 12, 0);
        Facility stale = facility("f1", "https://a.example.com", Map.of());
        stale.setLastCrawledAt(now.minusDays(45));
        Facility fresh = facility("f2", "https://b.example.com", Map.of());
        fresh.setLastCrawledAt(now.minusDays(3));

        assertThat(scheduler.priority(stale, Optional.empty(), now)).isEqualTo(20);
        assertThat(scheduler.priority(fresh, Optional.empty(), now)).isZero();
    }

    @Test
    @DisplayName("우선순위 - 크롤링 이력이 더 최신이면 이력 기준으로 경과일 계산")
    void priority_usesNewestHistory() {
        // given
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 12, 0);
        Facility f = facility("f1", "https://a.example.com", Map.of());
        CrawlHistory recent = CrawlHistory.builder()
                .id("c1").facilityId("f1").status(CrawlHistoryStatus.COMPLETED)
                .completedAt(now.minusDays(2))
                .build();

        // when / then: never-crawled bonus does not apply once history exists
        assertThat(scheduler.priority(f, Optional.of(recent), now)).isZero();
    }

    @Test
    @DisplayName("음수로 설정된 가중치는 0으로 취급 - 점수가 줄어들지 않음")
    void priority_negativeWeightsAreIgnored() {
        // given
        MonitorProperties properties = new MonitorProperties();
        properties.getScheduler().setPerKnownTiger(-10);
        properties.getScheduler().setPerViolation(-15);
        properties.getScheduler().setReferenceBonus(-100);
        CrawlPriorityScheduler misconfigured = new CrawlPriorityScheduler(facilityRepository, crawlHistoryLedger,
                crawlDispatcher, properties, new SimpleMeterRegistry());
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 12, 0);

        Facility few = facility("f1", "https://a.example.com", Map.of());
        few.setTigerCount(1);
        Facility many = facility("f2", "https://b.example.com", Map.of());
        many.setTigerCount(8);
        many.setViolationHistory(violations(4));
        many.setReferenceFacility(true);

        // when
        int fewScore = misconfigured.priority(few, Optional.empty(), now);
        int manyScore = misconfigured.priority(many, Optional.empty(), now);

        // then: only the never-crawled bonus remains
        assertThat(fewScore).isEqualTo(30);
        assertThat(manyScore).isGreaterThanOrEqualTo(fewScore);
    }

    @Test
    @DisplayName("우선순위는 항상 0 이상이며 호랑이 수, 위반 수, 소셜 소스 수에 대해 단조 증가")
    void priority_nonNegativeAndMonotonic() {
        LocalDateTime now = LocalDateTime.of(2024, 6, 1, 12, 0);
        int previous = -1;
        for (int n = 0; n <= 5; n++) {
            Map<String, String> links = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                links.put("platform" + i, "https://social.example.com/" + i);
            }
            Facility f = facility("f", null, links);
            f.setTigerCount(n);
            f.setViolationHistory(violations(n));
            f.setLastCrawledAt(now.minusDays(1));

            int score = scheduler.priority(f, Optional.empty(), now);

            assertThat(score).isGreaterThanOrEqualTo(0);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }

        Facility negative = facility("neg", "https://a.example.com", Map.of());
        negative.setTigerCount(-4);
        assertThat(scheduler.priority(negative, Optional.empty(), now)).isGreaterThanOrEqualTo(0);
    }

    // ========================================
    // dueForCrawl
    // ========================================

    @Test
    @DisplayName("크롤링 대상 - 우선순위 내림차순 정렬 후 최대 개수로 제한")
    void dueForCrawl_sortsAndCaps() {
        // given
        Facility low = facility("low", "https://low.example.com", Map.of());
        low.setLastCrawledAt(LocalDateTime.now().minusDays(2));
        Facility high = facility("high", "https://high.example.com", Map.of());
        high.setReferenceFacility(true);
        Facility mid = facility("mid", "https://mid.example.com", Map.of());
        mid.setTigerCount(5);
        mid.setLastCrawledAt(LocalDateTime.now().minusDays(2));

        when(facilityRepository.findDueForCrawl(any(LocalDateTime.class), eq(false))).thenReturn(List.of(low, high, mid));
        when(crawlHistoryLedger.latestFor(anyCollection())).thenReturn(Map.of());

        // when
        List<FacilityPriority> due = scheduler.dueForCrawl(2, false, Duration.ofHours(24));

        // then
        assertThat(due).extracting(FacilityPriority::getFacilityId).containsExactly("high", "mid");
        assertThat(due.get(0).isReference()).isTrue();
        assertThat(due.get(0).getLastCrawledAt()).isNull();
    }

    @Test
    @DisplayName("크롤링 대상 - 이력상 최근에 크롤링된 시설은 제외")
    void dueForCrawl_skipsRecentlyCrawledByHistory() {
        // given
        Facility f = facility("f1", "https://a.example.com", Map.of());
        CrawlHistory recent = CrawlHistory.builder()
                .id("c1").facilityId("f1").status(CrawlHistoryStatus.COMPLETED)
                .completedAt(LocalDateTime.now().minusHours(1))
                .build();
        when(facilityRepository.findDueForCrawl(any(LocalDateTime.class), anyBoolean())).thenReturn(List.of(f));
        when(crawlHistoryLedger.latestFor(anyCollection())).thenReturn(Map.of("f1", recent));

        // when
        List<FacilityPriority> due = scheduler.dueForCrawl(10, true, Duration.ofHours(24));

        // then
        assertThat(due).isEmpty();
    }

    // ========================================
    // dispatch
    // ========================================

    @Test
    @DisplayName("소스가 없는 시설 분배 시 NoSourcesException")
    void dispatch_noSources() {
        // given
        when(facilityRepository.findById("empty")).thenReturn(Optional.of(facility("empty", null, Map.of())));

        // when / then
        assertThatThrownBy(() -> scheduler.dispatch("empty"))
                .isInstanceOf(NoSourcesException.class)
                .extracting("facilityId").isEqualTo("empty");
        verifyNoInteractions(crawlDispatcher);
    }

    @Test
    @DisplayName("웹사이트만 있는 시설은 분배 성공, 즉시 핸들 반환")
    void dispatch_websiteOnly() {
        // given
        when(facilityRepository.findById("web")).thenReturn(Optional.of(facility("web", "https://zoo.example.com", Map.of())));
        when(crawlDispatcher.backendName()).thenReturn("local");

        // when
        DispatchHandle handle = scheduler.dispatch("web");

        // then
        ArgumentCaptor<CrawlCommandMessage> captor = ArgumentCaptor.forClass(CrawlCommandMessage.class);
        verify(crawlDispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().facilityId()).isEqualTo("web");
        assertThat(handle.taskId()).isEqualTo(captor.getValue().taskId());
        assertThat(handle.status()).isEqualTo("scheduled");
    }

    @Test
    @DisplayName("종료 중에는 새 분배 거부")
    void dispatch_rejectedWhileShuttingDown() {
        // given
        when(facilityRepository.findById("web")).thenReturn(Optional.of(facility("web", "https://zoo.example.com", Map.of())));
        scheduler.shutdown();

        // when / then
        assertThatThrownBy(() -> scheduler.dispatch("web")).isInstanceOf(DispatchException.class);
        verifyNoInteractions(crawlDispatcher);
    }

    // ========================================
    // dispatchBatch
    // ========================================

    @Test
    @DisplayName("일괄 분배 - N개 중 M개 소스 없음 → scheduled=N-M, failed=M, 실패 시설 ID 포함")
    void dispatchBatch_collectsPerFacilityFailures() {
        // given
        List<Facility> facilities = List.of(
                facility("a", "https://a.example.com", Map.of()),
                facility("b", null, Map.of()),
                facility("c", null, Map.of("facebook", "https://facebook.com/c")),
                facility("d", null, Map.of("instagram", " ")),
                facility("e", "https://e.example.com", Map.of()));
        when(facilityRepository.findByIdIn(anyCollection())).thenReturn(facilities);
        when(crawlDispatcher.backendName()).thenReturn("local");

        // when
        BatchDispatchResult result = scheduler.dispatchBatch(List.of("a", "b", "c", "d", "e"), 50, false);

        // then
        assertThat(result.getScheduledCount()).isEqualTo(3);
        assertThat(result.getFailedCount()).isEqualTo(2);
        assertThat(result.failedFacilityIds()).containsExactly("b", "d");
        assertThat(result.getFailed()).allSatisfy(f -> assertThat(f.error()).contains("no social media links or website"));
    }

    @Test
    @DisplayName("일괄 분배 - 큐 백엔드 오류는 해당 시설만 실패 처리")
    void dispatchBatch_backendFailureDoesNotAbortBatch() {
        // given
        when(facilityRepository.findByIdIn(anyCollection())).thenReturn(List.of(
                facility("a", "https://a.example.com", Map.of()),
                facility("b", "https://b.example.com", Map.of())));
        when(crawlDispatcher.backendName()).thenReturn("kafka");
        doThrow(DispatchException.backendUnavailable("a", new IllegalStateException("broker down")))
                .doNothing()
                .when(crawlDispatcher).dispatch(any(CrawlCommandMessage.class));

        // when
        BatchDispatchResult result = scheduler.dispatchBatch(List.of("a", "b", "missing"), 50, false);

        // then
        assertThat(result.getScheduled()).extracting(BatchDispatchResult.ScheduledCrawl::facilityId).containsExactly("b");
        assertThat(result.failedFacilityIds()).containsExactly("a", "missing");
    }

    @Test
    @DisplayName("일괄 분배 - ID 미지정 시 우선순위 상위 시설 자동 선택")
    void dispatchBatch_autoSelect() {
        // given
        Facility ref = facility("ref", "https://ref.example.com", Map.of());
        ref.setReferenceFacility(true);
        when(facilityRepository.findDueForCrawl(any(LocalDateTime.class), eq(true))).thenReturn(List.of(ref));
        when(crawlHistoryLedger.latestFor(anyCollection())).thenReturn(Map.of());
        when(facilityRepository.findByIdIn(anyCollection())).thenReturn(List.of(ref));
        when(crawlDispatcher.backendName()).thenReturn("local");

        // when
        BatchDispatchResult result = scheduler.dispatchBatch(null, 20, true);

        // then
        assertThat(result.getScheduled()).hasSize(1);
        assertThat(result.getScheduled().get(0).facilityName()).isEqualTo("Facility ref");
    }
}
