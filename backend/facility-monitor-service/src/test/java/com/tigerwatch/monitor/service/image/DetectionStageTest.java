package com.tigerwatch.monitor.service.image;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.BoundingBox;
import com.tigerwatch.monitor.dto.Detection;
import com.tigerwatch.monitor.dto.DetectionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DetectionStageTest {

    private static final byte[] IMAGE = {1, 2, 3};

    @Mock
    private DetectionModel detectionModel;

    private DetectionStage stage;

    @BeforeEach
    void setUp() {
        stage = new DetectionStage(detectionModel, new MonitorProperties());
    }

    @Test
    @DisplayName("신뢰도 기준 미만 박스는 제외하고 최고 신뢰도를 집계")
    void detect_filtersLowConfidence() {
        // given
        when(detectionModel.detect(IMAGE)).thenReturn(List.of(
                new Detection(new BoundingBox(0, 0, 10, 10), 0.3),
                new Detection(new BoundingBox(5, 5, 50, 40), 0.91),
                new Detection(new BoundingBox(60, 5, 90, 40), 0.72)));

        // when
        DetectionResult result = stage.detect(IMAGE);

        // then
        assertThat(result.detected()).isTrue();
        assertThat(result.detections()).hasSize(2);
        assertThat(result.confidence()).isEqualTo(0.91);
        assertThat(result.error()).isNull();
    }

    @Test
    @DisplayName("박스가 없으면 detected=false")
    void detect_nothingFound() {
        when(detectionModel.detect(IMAGE)).thenReturn(List.of());

        DetectionResult result = stage.detect(IMAGE);

        assertThat(result.detected()).isFalse();
        assertThat(result.hasError()).isFalse();
    }

    @Test
    @DisplayName("모델 오류는 예외 대신 error가 담긴 음성 결과")
    void detect_modelFailureDegrades() {
        when(detectionModel.detect(any())).thenThrow(new IllegalStateException("CUDA out of memory"));

        DetectionResult result = stage.detect(IMAGE);

        assertThat(result.detected()).isFalse();
        assertThat(result.detections()).isEmpty();
        assertThat(result.confidence()).isZero();
        assertThat(result.error()).contains("CUDA out of memory");
    }

    @Test
    @DisplayName("빈 이미지는 모델 호출 없이 오류 결과")
    void detect_emptyImage() {
        DetectionResult result = stage.detect(new byte[0]);

        assertThat(result.hasError()).isTrue();
        verifyNoInteractions(detectionModel);
    }
}
