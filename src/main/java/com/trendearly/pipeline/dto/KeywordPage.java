package com.trendearly.pipeline.dto;

import com.trendearly.pipeline.entity.DailySnapshot;
import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.entity.TrendsCacheEntry;

/**
 * One rendered keyword page. {@code trends} is null when no cache entry exists.
 */
public record KeywordPage(
        Keyword keyword,
        DailySnapshot snapshot,
        TrendsCacheEntry trends
) {
}
