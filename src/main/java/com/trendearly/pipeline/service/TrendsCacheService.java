package com.trendearly.pipeline.service;

import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.entity.TrendsCacheEntry;
import com.trendearly.pipeline.exception.FetchException;
import com.trendearly.pipeline.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fetch-or-reuse in front of {@link TrendsFetchService}. Entries younger than the TTL are
 * served without an external call; a failed refetch falls back to the stale entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendsCacheService {

    private final TimeSeriesStore store;
    private final TrendsFetchService fetcher;
    private final Clock clock;

    public List<Double> getOrFetch(Keyword keyword, String geo, String timeframe, Duration ttl) throws FetchException {
        Optional<TrendsCacheEntry> cached = store.findCacheEntry(keyword.getId(), geo, timeframe);
        Instant now = clock.instant();

        if (cached.isPresent() && cached.get().isFresh(now, ttl)) {
            log.debug("[Cache] hit keyword='{}' fetchedAt={}", keyword.getText(), cached.get().getFetchedAt());
            return cached.get().getWeeklySeries();
        }

        try {
            List<Double> series = fetcher.fetch(keyword.getText(), geo, timeframe);
            TrendsCacheEntry entry = store.replaceCacheEntry(keyword.getId(), geo, timeframe, series, clock.instant());
            return entry.getWeeklySeries();
        } catch (FetchException e) {
            if (cached.isPresent()) {
                log.warn("[Cache] refetch failed, serving stale series keyword='{}' fetchedAt={}: {}",
                        keyword.getText(), cached.get().getFetchedAt(), e.getMessage());
                return cached.get().getWeeklySeries();
            }
            throw e;
        }
    }

    public int invalidate(Keyword keyword) {
        int removed = store.deleteCacheEntries(keyword.getId());
        log.info("[Cache] invalidated keyword='{}' entries={}", keyword.getText(), removed);
        return removed;
    }
}
