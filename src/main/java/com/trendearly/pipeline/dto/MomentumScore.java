package com.trendearly.pipeline.dto;

import lombok.Builder;

@Builder
public record MomentumScore(
        double lift,
        double acceleration,
        double novelty,
        double noise,
        double rawScore,
        int momentumScore // 1..100
) {
}
