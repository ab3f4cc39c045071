package com.trendearly.pipeline.scheduler;

import com.trendearly.pipeline.dto.PipelineRunReport;
import com.trendearly.pipeline.service.DailyPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pipeline.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DailyPipelineScheduler {

    private final DailyPipelineService pipelineService;
    private final Clock clock;

    // 매일 02:00 UTC
    @Scheduled(cron = "${pipeline.schedule.cron:0 0 2 * * *}", zone = "${pipeline.schedule.zone:UTC}")
    public void runDaily() {
        LocalDate today = LocalDate.now(clock);
        log.info("[Pipeline] scheduled run triggered for {}", today);
        PipelineRunReport report = pipelineService.run(today);
        if (report.failed()) {
            log.error("[Pipeline] scheduled run for {} failed: {}", today, report.fatalError());
        }
    }
}
