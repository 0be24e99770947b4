package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.exception.ImageFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Downloads image bytes for the detection stage.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageFetcher {

    private final WebClient webClient;
    private final MonitorProperties properties;

    /**
     * @throws ImageFetchException on HTTP error, timeout, empty or oversized body
     */
    public byte[] fetch(String imageUrl) {
        MonitorProperties.Crawl settings = properties.getCrawl();
        if (imageUrl == null || !imageUrl.startsWith("http")) {
            throw new ImageFetchException(String.valueOf(imageUrl), "not an absolute http(s) url");
        }

        byte[] bytes;
        try {
            bytes = webClient.get()
                    .uri(imageUrl)
                    .accept(MediaType.IMAGE_JPEG, MediaType.IMAGE_PNG, MediaType.IMAGE_GIF, MediaType.ALL)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .timeout(settings.getImageFetchTimeout())
                    .block();
        } catch (Exception e) {
            throw new ImageFetchException(imageUrl, e);
        }

        if (bytes == null || bytes.length == 0) {
            throw new ImageFetchException(imageUrl, "empty body");
        }
        if (bytes.length > settings.getMaxImageBytes()) {
            throw new ImageFetchException(imageUrl, "image exceeds " + settings.getMaxImageBytes() + " bytes");
        }
        log.debug("Fetched image url={}, bytes={}", imageUrl, bytes.length);
        return bytes;
    }
}
