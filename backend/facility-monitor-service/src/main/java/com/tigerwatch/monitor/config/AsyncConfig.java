package com.tigerwatch.monitor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${async.crawl-job.core-pool-size:4}")
    private int crawlJobCorePoolSize;

    @Value("${async.crawl-job.max-pool-size:8}")
    private int crawlJobMaxPoolSize;

    @Value("${async.crawl-job.queue-capacity:200}")
    private int crawlJobQueueCapacity;

    /**
     * 시설 크롤링 작업 전용 실행자 (local dispatch 모드).
     * 작업 하나가 시설 하나를 처리하며, 거부된 작업은 호출자에게 예외로 전달됩니다.
     */
    @Bean(name = "crawlJobExecutor")
    public ThreadPoolTaskExecutor crawlJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(crawlJobCorePoolSize);
        executor.setMaxPoolSize(crawlJobMaxPoolSize);
        executor.setQueueCapacity(crawlJobQueueCapacity);
        executor.setThreadNamePrefix("crawl-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(300); // in-flight jobs finish their history write
        executor.initialize();
        return executor;
    }
}
