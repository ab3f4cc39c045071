package com.trendearly.pipeline.dto;

/**
 * Result of one keyword's cache/score/persist step. Failed outcomes never abort the run.
 */
public record KeywordOutcome(
        String keyword,
        boolean scored,
        Stage stage,            // 실패한 단계 (성공이면 null)
        String message,
        Integer momentumScore,
        boolean snapshotCreated // false: 같은 날짜 스냅샷이 이미 있음
) {

    public enum Stage {
        FETCH,
        SCORE
    }

    public static KeywordOutcome scored(String keyword, int momentumScore, boolean snapshotCreated) {
        return new KeywordOutcome(keyword, true, null, null, momentumScore, snapshotCreated);
    }

    public static KeywordOutcome failed(String keyword, Stage stage, String message) {
        return new KeywordOutcome(keyword, false, stage, message, null, false);
    }
}
