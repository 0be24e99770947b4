package com.tigerwatch.monitor.client;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModelServingClient 테스트 (ExchangeFunction 스텁)
 */
class ModelServingClientTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x01};

    private ModelServingClient client(ExchangeFunction exchange) {
        MonitorProperties properties = new MonitorProperties();
        properties.getDetection().setBaseUrl("http://models.internal:8000/");
        return new ModelServingClient(WebClient.builder().exchangeFunction(exchange).build(), properties);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("탐지 응답 파싱 - bbox 4개 좌표가 없는 항목은 제외")
    void detect_parsesDetections() {
        // given
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        ModelServingClient client = client(request -> {
            captured.set(request);
            return json(HttpStatus.OK, """
                    {"detections": [
                      {"bbox": [10, 20, 110, 220], "confidence": 0.93},
                      {"bbox": [1, 2], "confidence": 0.99},
                      {"bbox": [5, 5, 50, 50], "confidence": 0.41}
                    ]}
                    """);
        });

        // when
        List<Detection> detections = client.detect(IMAGE);

        // then
        assertThat(detections).extracting(Detection::confidence).containsExactly(0.93, 0.41);
        assertThat(detections.get(0).bbox().area()).isEqualTo(100.0 * 200.0);
        assertThat(captured.get().url().toString()).isEqualTo("http://models.internal:8000/detect");
    }

    @Test
    @DisplayName("임베딩 요청은 모델 이름을 쿼리 파라미터로 전달")
    void embed_passesModelName() {
        // given
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        ModelServingClient client = client(request -> {
            captured.set(request);
            return json(HttpStatus.OK, "{\"embedding\": [0.5, -0.25, 1.0]}");
        });

        // when
        float[] embedding = client.embed(IMAGE, "megadescriptor");

        // then
        assertThat(embedding).containsExactly(0.5f, -0.25f, 1.0f);
        assertThat(captured.get().url().getQuery()).isEqualTo("model=megadescriptor");
    }

    @Test
    @DisplayName("임베딩 필드 없음 → 빈 배열")
    void embed_missingEmbedding() {
        ModelServingClient client = client(request -> json(HttpStatus.OK, "{\"status\": \"ok\"}"));

        assertThat(client.embed(IMAGE, "wildlife_tools")).isEmpty();
    }

    @Test
    @DisplayName("모델 서버 오류는 예외로 전파")
    void detect_serverErrorPropagates() {
        ModelServingClient client = client(request -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        assertThatThrownBy(() -> client.detect(IMAGE)).isInstanceOf(WebClientResponseException.class);
    }
}
