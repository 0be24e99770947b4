package com.tigerwatch.monitor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 크롤링 작업 실행자 설정 테스트
 */
class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor(int poolSize, int queueCapacity) {
        AsyncConfig config = new AsyncConfig();
        ReflectionTestUtils.setField(config, "crawlJobCorePoolSize", poolSize);
        ReflectionTestUtils.setField(config, "crawlJobMaxPoolSize", poolSize);
        ReflectionTestUtils.setField(config, "crawlJobQueueCapacity", queueCapacity);
        return config.crawlJobExecutor();
    }

    @Test
    @DisplayName("크롤링 실행자 - 설정값 적용과 스레드 이름 접두사")
    void crawlJobExecutor_appliesSettings() {
        ThreadPoolTaskExecutor executor = executor(3, 7);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(3);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
            assertThat(executor.getQueueCapacity()).isEqualTo(7);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("crawl-job-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("크롤링 실행자 포화 시 작업 거부 (호출자에게 TaskRejectedException)")
    void crawlJobExecutor_rejectsWhenSaturated() throws InterruptedException {
        // given: one worker busy, one task queued
        ThreadPoolTaskExecutor executor = executor(1, 1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                started.countDown();
                awaitQuietly(release);
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            executor.execute(() -> awaitQuietly(release));

            // when & then
            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
