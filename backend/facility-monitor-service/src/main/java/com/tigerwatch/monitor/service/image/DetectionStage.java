package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.Detection;
import com.tigerwatch.monitor.dto.DetectionResult;
import com.tigerwatch.monitor.exception.DetectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tiger detection for one image. Never throws: model failures come back as
 * a negative result with {@code error} set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DetectionStage {

    private final DetectionModel detectionModel;
    private final MonitorProperties properties;

    public DetectionResult detect(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            return DetectionResult.failed(DetectionException.emptyImage().getMessage());
        }
        try {
            double minConfidence = properties.getDetection().getMinConfidence();
            List<Detection> detections = detectionModel.detect(imageBytes);
            List<Detection> kept = detections == null ? List.of() : detections.stream()
                    .filter(d -> d.confidence() >= minConfidence)
                    .toList();
            return DetectionResult.of(kept);
        } catch (Exception e) {
            DetectionException failure = DetectionException.modelFailed(e);
            log.warn("{}", failure.getMessage());
            return DetectionResult.failed(failure.getMessage());
        }
    }
}
