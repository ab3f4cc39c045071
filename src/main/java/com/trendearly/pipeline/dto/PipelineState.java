package com.trendearly.pipeline.dto;

public enum PipelineState {
    INGESTING,
    CACHE_AND_SCORE,
    PUBLISHING,
    DONE,
    FAILED
}
