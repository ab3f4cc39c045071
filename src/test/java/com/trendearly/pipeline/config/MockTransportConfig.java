package com.trendearly.pipeline.config;

import com.trendearly.pipeline.crawler.KeywordSource;
import com.trendearly.pipeline.crawler.TrendsTransport;
import org.mockito.Mockito;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class MockTransportConfig {

    @Bean
    @Primary
    public TrendsTransport trendsTransport() {
        return Mockito.mock(TrendsTransport.class);
    }

    @Bean
    @Primary
    public KeywordSource keywordSource() {
        return Mockito.mock(KeywordSource.class);
    }
}
