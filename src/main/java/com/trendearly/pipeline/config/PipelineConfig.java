package com.trendearly.pipeline.config;

import com.trendearly.pipeline.publisher.DirectoryMover;
import com.trendearly.pipeline.ratelimit.RateGate;
import com.trendearly.pipeline.ratelimit.RetryPolicy;
import com.trendearly.pipeline.ratelimit.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Trends 호출 전체가 공유하는 단일 gate (키워드 무관) */
    @Bean
    public RateGate trendsRateGate(PipelineProperties properties, Clock clock, Sleeper sleeper) {
        return new RateGate(properties.getTrends().getMinRequestDelay(), clock, sleeper);
    }

    @Bean
    public RetryPolicy trendsRetryPolicy(PipelineProperties properties, Sleeper sleeper) {
        PipelineProperties.Trends trends = properties.getTrends();
        return new RetryPolicy(trends.getMaxAttempts(), trends.getInitialBackoff(), trends.getMaxBackoff(), sleeper);
    }

    @Bean
    public DirectoryMover directoryMover() {
        return DirectoryMover.atomicRename();
    }
}
