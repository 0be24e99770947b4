package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls candidate image URLs out of a scraped page.
 *
 * <ul>
 *   <li>{@code <img src>} values from the HTML, in document order, then image URLs found in the text content</li>
 *   <li>{@code //host/path} becomes {@code https://host/path}; {@code /path} is resolved against the base URL's
 *       scheme and host; other relative values are kept as-is</li>
 *   <li>case-insensitive de-duplication, known image extensions only, capped per page</li>
 * </ul>
 *
 * Stateless and deterministic: the same input always yields the same list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageExtractor {

    static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp");

    private static final Pattern CONTENT_IMAGE_URL = Pattern.compile(
            "https?://[^\\s<>\"'()\\[\\]]+\\.(?:jpg|jpeg|png|gif|webp|bmp)", Pattern.CASE_INSENSITIVE);

    private final MonitorProperties properties;

    public List<String> extractImages(String content, String html, String baseUrl) {
        List<String> candidates = new ArrayList<>();

        if (html != null && !html.isBlank()) {
            for (Element img : Jsoup.parse(html).select("img[src]")) {
                String resolved = resolve(img.attr("src").trim(), baseUrl);
                if (resolved != null) {
                    candidates.add(resolved);
                }
            }
        }

        if (content != null && !content.isBlank()) {
            Matcher matcher = CONTENT_IMAGE_URL.matcher(content);
            while (matcher.find()) {
                candidates.add(matcher.group());
            }
        }

        int cap = properties.getCrawl().getMaxImagesPerPage();
        Set<String> seen = new HashSet<>();
        List<String> images = new ArrayList<>();
        for (String candidate : candidates) {
            if (images.size() >= cap) {
                break;
            }
            String lower = candidate.toLowerCase(Locale.ROOT);
            if (hasImageExtension(lower) && seen.add(lower)) {
                images.add(candidate);
            }
        }

        log.debug("Extracted {} image urls from {} (candidates={})", images.size(), baseUrl, candidates.size());
        return images;
    }

    static String resolve(String src, String baseUrl) {
        if (src == null || src.isEmpty()) {
            return null;
        }
        if (src.startsWith("http")) {
            return src;
        }
        if (src.startsWith("//")) {
            return "https:" + src;
        }
        if (src.startsWith("/")) {
            String origin = origin(baseUrl);
            return origin != null ? origin + src : src;
        }
        return src;
    }

    private static String origin(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(baseUrl.trim());
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return null;
            }
            return uri.getScheme() + "://" + uri.getRawAuthority();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean hasImageExtension(String lowerUrl) {
        String path = lowerUrl;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        for (String ext : IMAGE_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private static int indexOfAny(String value, char a, char b) {
        int ia = value.indexOf(a);
        int ib = value.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }
}
