package com.tigerwatch.monitor.service.retrieval;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.ScrapeResult;
import com.tigerwatch.monitor.dto.SearchResultItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last link of the search chain: scrapes a public search-engine results page
 * and pulls result URLs out of it. Titles and snippets are placeholders.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrapeFallbackSearchProvider implements SearchProvider {

    public static final String NAME = "scrape_fallback";

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"')\\]]+");
    private static final String TRAILING_PUNCTUATION = ".,;:!?)";

    private final ScrapeBackend scrapeBackend;
    private final MonitorProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return scrapeBackend.isConfigured();
    }

    @Override
    public List<SearchResultItem> search(String query, int limit) {
        String serpUrl = String.format(properties.getRetrieval().getSearch().getSerpUrlTemplate(),
                URLEncoder.encode(query, StandardCharsets.UTF_8), limit);

        ScrapeResult page = scrapeBackend.scrape(serpUrl, false);
        if (page.hasError()) {
            throw new IllegalStateException("SERP scrape failed: " + page.getError());
        }

        String serpHost = hostOf(serpUrl);
        Set<String> urls = new LinkedHashSet<>();
        collectAnchors(page.getHtml(), serpUrl, urls);
        collectFreeText(page.getContent(), urls);

        List<SearchResultItem> results = new ArrayList<>();
        for (String url : urls) {
            if (results.size() >= limit) {
                break;
            }
            if (serpHost != null && serpHost.equalsIgnoreCase(hostOf(url))) {
                continue;
            }
            int position = results.size() + 1;
            results.add(SearchResultItem.builder()
                    .title("Result " + position)
                    .url(url)
                    .snippet("Found via web search results page")
                    .position(position)
                    .build());
        }
        log.debug("SERP fallback extracted {} urls for query='{}'", results.size(), query);
        return results;
    }

    private void collectAnchors(String html, String baseUrl, Set<String> urls) {
        if (html == null || html.isBlank()) {
            return;
        }
        for (Element anchor : Jsoup.parse(html, baseUrl).select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.startsWith("http")) {
                urls.add(trim(href));
            }
        }
    }

    private void collectFreeText(String content, Set<String> urls) {
        if (content == null || content.isBlank()) {
            return;
        }
        Matcher matcher = URL_PATTERN.matcher(content);
        while (matcher.find()) {
            urls.add(trim(matcher.group()));
        }
    }

    private static String trim(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }

    private static String hostOf(String url) {
        try {
            return java.net.URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
