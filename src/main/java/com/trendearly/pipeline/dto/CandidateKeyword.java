package com.trendearly.pipeline.dto;

import com.trendearly.pipeline.entity.KeywordType;

public record CandidateKeyword(
        String text, // 정규화 완료
        KeywordType type
) {
}
