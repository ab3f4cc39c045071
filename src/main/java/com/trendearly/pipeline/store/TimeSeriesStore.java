package com.trendearly.pipeline.store;

import com.trendearly.pipeline.entity.DailySnapshot;
import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.entity.KeywordType;
import com.trendearly.pipeline.entity.TrendsCacheEntry;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence handle passed to the pipeline components. Implementations translate storage
 * failures into {@link com.trendearly.pipeline.exception.InfrastructureException}.
 */
public interface TimeSeriesStore {

    /**
     * Creates the keyword on first sighting, otherwise moves {@code lastSeen} forward.
     *
     * @param text already normalized keyword text
     */
    Keyword upsertKeyword(String text, KeywordType type, LocalDate seenOn);

    Optional<Keyword> findKeyword(Long keywordId);

    /**
     * @return {@code true} if a row was written, {@code false} if one already existed for
     * the same (keyword, date)
     */
    boolean insertSnapshotIfAbsent(DailySnapshot snapshot);

    List<DailySnapshot> findSnapshots(LocalDate date);

    Optional<TrendsCacheEntry> findCacheEntry(Long keywordId, String geo, String timeframe);

    TrendsCacheEntry replaceCacheEntry(Long keywordId, String geo, String timeframe,
                                       List<Double> weeklySeries, Instant fetchedAt);

    int deleteCacheEntries(Long keywordId);
}
