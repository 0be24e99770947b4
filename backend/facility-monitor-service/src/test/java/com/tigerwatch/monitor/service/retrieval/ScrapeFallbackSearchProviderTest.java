package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.ScrapeResult;
import com.tigerwatch.monitor.dto.SearchResultItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeFallbackSearchProviderTest {

    @Mock
    private ScrapeBackend scrapeBackend;

    @Test
    @DisplayName("검색 결과 페이지에서 외부 URL 추출, 검색엔진 자체 링크와 꼬리 구두점 제거")
    void search_extractsResultUrls() {
        // given
        ScrapeResult serp = ScrapeResult.builder()
                .url("https://www.google.com/search?q=tiger")
                .html("<a href=\"https://www.google.com/preferences\">prefs</a>"
                        + "<a href=\"https://zoo.example.com/tigers\">zoo</a>")
                .content("See https://news.example.org/story). Also https://zoo.example.com/tigers.")
                .build();
        when(scrapeBackend.scrape(startsWith("https://www.google.com/search?q=tiger+zoo"), eq(false))).thenReturn(serp);
        ScrapeFallbackSearchProvider provider = new ScrapeFallbackSearchProvider(scrapeBackend, new MonitorProperties());

        // when
        List<SearchResultItem> results = provider.search("tiger zoo", 10);

        // then
        assertThat(results).extracting(SearchResultItem::getUrl)
                .containsExactly("https://zoo.example.com/tigers", "https://news.example.org/story");
        assertThat(results.get(0).getTitle()).isEqualTo("Result 1");
    }

    @Test
    @DisplayName("SERP 스크래핑 오류는 예외로 전파")
    void search_scrapeErrorThrows() {
        when(scrapeBackend.scrape(startsWith("https://www.google.com/search"), eq(false)))
                .thenReturn(ScrapeResult.failed("https://www.google.com/search", "403"));
        ScrapeFallbackSearchProvider provider = new ScrapeFallbackSearchProvider(scrapeBackend, new MonitorProperties());

        assertThatThrownBy(() -> provider.search("tiger", 10)).hasMessageContaining("403");
    }
}
