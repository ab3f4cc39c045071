package com.trendearly.pipeline.store;

import com.trendearly.pipeline.entity.DailySnapshot;
import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.entity.KeywordType;
import com.trendearly.pipeline.entity.TrendsCacheEntry;
import com.trendearly.pipeline.exception.InfrastructureException;
import com.trendearly.pipeline.repository.DailySnapshotRepository;
import com.trendearly.pipeline.repository.KeywordRepository;
import com.trendearly.pipeline.repository.TrendsCacheEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTimeSeriesStore implements TimeSeriesStore {

    private final KeywordRepository keywordRepository;
    private final DailySnapshotRepository snapshotRepository;
    private final TrendsCacheEntryRepository cacheRepository;

    @Override
    @Transactional
    public Keyword upsertKeyword(String text, KeywordType type, LocalDate seenOn) {
        try {
            Keyword keyword = keywordRepository.findByText(text)
                    .orElseGet(() -> Keyword.builder()
                            .text(text)
                            .type(type)
                            .firstSeen(seenOn)
                            .lastSeen(seenOn)
                            .build());
            keyword.markSeen(seenOn);
            return keywordRepository.save(keyword);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to upsert keyword '" + text + "'", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Keyword> findKeyword(Long keywordId) {
        try {
            return keywordRepository.findById(keywordId);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to load keyword id=" + keywordId, e);
        }
    }

    /**
     * 트랜잭션 없이 실행: 유니크 제약 위반을 잡아도 바깥 트랜잭션이 rollback-only 로 남지 않게.
     */
    @Override
    public boolean insertSnapshotIfAbsent(DailySnapshot snapshot) {
        try {
            if (snapshotRepository.existsByKeywordIdAndSnapshotDate(snapshot.getKeywordId(), snapshot.getSnapshotDate())) {
                return false;
            }
            snapshotRepository.saveAndFlush(snapshot);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[Store] snapshot already exists keywordId={} date={}",
                    snapshot.getKeywordId(), snapshot.getSnapshotDate());
            return false;
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to insert snapshot keywordId=" + snapshot.getKeywordId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailySnapshot> findSnapshots(LocalDate date) {
        try {
            return snapshotRepository.findBySnapshotDateOrderByMomentumScoreDesc(date);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to load snapshots for " + date, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TrendsCacheEntry> findCacheEntry(Long keywordId, String geo, String timeframe) {
        try {
            return cacheRepository.findByKeywordIdAndGeoAndTimeframe(keywordId, geo, timeframe);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to read cache entry keywordId=" + keywordId, e);
        }
    }

    @Override
    @Transactional
    public TrendsCacheEntry replaceCacheEntry(Long keywordId, String geo, String timeframe,
                                              List<Double> weeklySeries, Instant fetchedAt) {
        try {
            TrendsCacheEntry entry = cacheRepository.findByKeywordIdAndGeoAndTimeframe(keywordId, geo, timeframe)
                    .orElseGet(() -> TrendsCacheEntry.builder()
                            .keywordId(keywordId)
                            .geo(geo)
                            .timeframe(timeframe)
                            .build());
            entry.replaceSeries(weeklySeries, fetchedAt);
            return cacheRepository.save(entry);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to replace cache entry keywordId=" + keywordId, e);
        }
    }

    @Override
    @Transactional
    public int deleteCacheEntries(Long keywordId) {
        try {
            return cacheRepository.deleteByKeywordId(keywordId);
        } catch (DataAccessException e) {
            throw new InfrastructureException("Failed to delete cache entries keywordId=" + keywordId, e);
        }
    }
}
