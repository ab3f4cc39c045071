package com.trendearly.pipeline.dto;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Builder
public record PipelineRunReport(
        LocalDate date,
        PipelineState state,
        Instant startedAt,
        Duration duration,
        int keywordsFetched,
        int keywordsScored,
        int keywordsFailed,
        int snapshotsCreated,
        boolean published,
        boolean success,
        List<KeywordError> errors,
        List<String> withheldKeywords, // 금지어 포함으로 사이트에서 제외된 키워드
        String fatalError
) {

    public record KeywordError(String keyword, KeywordOutcome.Stage stage, String message) {
    }

    public boolean failed() {
        return state == PipelineState.FAILED;
    }
}
