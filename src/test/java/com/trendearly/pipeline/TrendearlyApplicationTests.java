package com.trendearly.pipeline;

import com.trendearly.pipeline.config.MockTransportConfig;
import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.crawler.KeywordSource;
import com.trendearly.pipeline.crawler.TrendsTransport;
import com.trendearly.pipeline.dto.PipelineRunReport;
import com.trendearly.pipeline.dto.PipelineState;
import com.trendearly.pipeline.scheduler.DailyPipelineScheduler;
import com.trendearly.pipeline.service.DailyPipelineService;
import com.trendearly.pipeline.support.Series;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Import(MockTransportConfig.class)
class TrendearlyApplicationTests {

	@Autowired
	private ApplicationContext context;

	@Autowired
	private DailyPipelineService pipelineService;

	@Autowired
	private KeywordSource keywordSource;

	@Autowired
	private TrendsTransport trendsTransport;

	@Autowired
	private PipelineProperties properties;

	@Test
	void contextLoads() {
		assertThat(context.getBeansOfType(DailyPipelineScheduler.class)).isEmpty();
		assertThat(properties.getCacheTtl()).hasDays(7);
	}

	@Test
	void runsPipelineAgainstDatabase() throws Exception {
		when(keywordSource.fetchCandidateKeywords(any())).thenReturn(List.of("Matcha Latte", "#matcha latte", "cold plunge"));
		when(trendsTransport.fetch(anyString(), anyString(), anyString())).thenReturn(Series.rising(52));

		PipelineRunReport report = pipelineService.run(LocalDate.of(2024, 6, 1), null);

		assertThat(report.state()).isEqualTo(PipelineState.DONE);
		assertThat(report.success()).isTrue();
		assertThat(report.keywordsFetched()).isEqualTo(2);
		assertThat(report.keywordsScored()).isEqualTo(2);
		assertThat(Files.readString(properties.getSite().getLiveDir().resolve("index.html"))).contains("matcha latte");
	}
}
