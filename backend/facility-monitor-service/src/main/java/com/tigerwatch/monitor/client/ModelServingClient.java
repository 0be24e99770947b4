package com.tigerwatch.monitor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.BoundingBox;
import com.tigerwatch.monitor.dto.Detection;
import com.tigerwatch.monitor.service.image.DetectionModel;
import com.tigerwatch.monitor.service.image.ReidModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for the model-serving service hosting the tiger detector and the re-identification models.
 *
 * POST {base-url}/detect            raw image bytes -> {"detections": [{"bbox": [x1,y1,x2,y2], "confidence": 0.93}]}
 * POST {base-url}/embed?model=name  raw image bytes -> {"embedding": [ ... ]}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelServingClient implements DetectionModel, ReidModel {

    private final WebClient webClient;
    private final MonitorProperties properties;

    @Override
    public List<Detection> detect(byte[] imageBytes) {
        JsonNode response = webClient.post()
                .uri(endpoint("detect"))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(imageBytes)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getDetection().getTimeout())
                .block();

        List<Detection> detections = new ArrayList<>();
        if (response == null) {
            return detections;
        }
        for (JsonNode node : response.path("detections")) {
            JsonNode bbox = node.path("bbox");
            if (!bbox.isArray() || bbox.size() < 4) {
                log.debug("Skipping detection without a 4-point bbox: {}", node);
                continue;
            }
            detections.add(new Detection(
                    new BoundingBox(bbox.get(0).asDouble(), bbox.get(1).asDouble(),
                            bbox.get(2).asDouble(), bbox.get(3).asDouble()),
                    node.path("confidence").asDouble(0.0)));
        }
        return detections;
    }

    @Override
    public float[] embed(byte[] imageBytes, String modelName) {
        JsonNode response = webClient.post()
                .uri(endpoint("embed") + "?model={model}", modelName)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(imageBytes)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getIdentification().getTimeout())
                .block();

        JsonNode values = response == null ? null : response.path("embedding");
        if (values == null || !values.isArray()) {
            return new float[0];
        }
        float[] embedding = new float[values.size()];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = (float) values.get(i).asDouble();
        }
        return embedding;
    }

    private String endpoint(String path) {
        String baseUrl = properties.getDetection().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl + path : baseUrl + "/" + path;
    }
}
