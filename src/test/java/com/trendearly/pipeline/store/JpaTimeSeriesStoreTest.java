package com.trendearly.pipeline.store;

import com.trendearly.pipeline.entity.DailySnapshot;
import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.entity.KeywordType;
import com.trendearly.pipeline.entity.TrendsCacheEntry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaTimeSeriesStore.class)
class JpaTimeSeriesStoreTest {

    private static final LocalDate DAY1 = LocalDate.of(2024, 6, 1);
    private static final LocalDate DAY2 = LocalDate.of(2024, 6, 2);

    @Autowired
    private JpaTimeSeriesStore store;

    @Test
    void upsertCreatesOnceAndMovesLastSeen() {
        Keyword created = store.upsertKeyword("matcha latte", KeywordType.KEYWORD, DAY1);
        Keyword again = store.upsertKeyword("matcha latte", KeywordType.HASHTAG, DAY2);

        assertThat(again.getId()).isEqualTo(created.getId());
        assertThat(again.getType()).isEqualTo(KeywordType.KEYWORD);
        assertThat(again.getFirstSeen()).isEqualTo(DAY1);
        assertThat(again.getLastSeen()).isEqualTo(DAY2);
    }

    @Test
    void snapshotInsertIsIdempotentPerKeywordAndDate() {
        Keyword keyword = store.upsertKeyword("cold plunge", KeywordType.KEYWORD, DAY1);

        assertThat(store.insertSnapshotIfAbsent(snapshot(keyword.getId(), DAY1, 70))).isTrue();
        assertThat(store.insertSnapshotIfAbsent(snapshot(keyword.getId(), DAY1, 12))).isFalse();
        assertThat(store.insertSnapshotIfAbsent(snapshot(keyword.getId(), DAY2, 12))).isTrue();

        List<DailySnapshot> day1 = store.findSnapshots(DAY1);
        assertThat(day1).singleElement().satisfies(s -> assertThat(s.getMomentumScore()).isEqualTo(70));
    }

    @Test
    void snapshotsAreOrderedByScore() {
        Keyword a = store.upsertKeyword("a", KeywordType.KEYWORD, DAY1);
        Keyword b = store.upsertKeyword("b", KeywordType.KEYWORD, DAY1);
        store.insertSnapshotIfAbsent(snapshot(a.getId(), DAY1, 30));
        store.insertSnapshotIfAbsent(snapshot(b.getId(), DAY1, 90));

        assertThat(store.findSnapshots(DAY1))
                .extracting(DailySnapshot::getKeywordId)
                .containsExactly(b.getId(), a.getId());
    }

    @Test
    void cacheEntryIsReplacedNotMerged() {
        Keyword keyword = store.upsertKeyword("run club", KeywordType.KEYWORD, DAY1);
        Instant first = Instant.parse("2024-06-01T02:00:00Z");
        Instant second = Instant.parse("2024-06-09T02:00:00Z");

        store.replaceCacheEntry(keyword.getId(), "", "today 12-m", List.of(1.0, 2.0, 3.0), first);
        store.replaceCacheEntry(keyword.getId(), "", "today 12-m", List.of(9.0), second);

        TrendsCacheEntry entry = store.findCacheEntry(keyword.getId(), "", "today 12-m").orElseThrow();
        assertThat(entry.getWeeklySeries()).containsExactly(9.0);
        assertThat(entry.getFetchedAt()).isEqualTo(second);
        assertThat(store.findCacheEntry(keyword.getId(), "US", "today 12-m")).isEmpty();
    }

    @Test
    void deleteCacheEntriesRemovesEveryGeo() {
        Keyword keyword = store.upsertKeyword("tinned fish", KeywordType.KEYWORD, DAY1);
        Instant now = Instant.parse("2024-06-01T02:00:00Z");
        store.replaceCacheEntry(keyword.getId(), "", "today 12-m", List.of(1.0), now);
        store.replaceCacheEntry(keyword.getId(), "US", "today 12-m", List.of(2.0), now);

        assertThat(store.deleteCacheEntries(keyword.getId())).isEqualTo(2);
        assertThat(store.findCacheEntry(keyword.getId(), "", "today 12-m")).isEmpty();
    }

    private static DailySnapshot snapshot(Long keywordId, LocalDate date, int score) {
        return DailySnapshot.builder()
                .keywordId(keywordId)
                .snapshotDate(date)
                .momentumScore(score)
                .rawScore(0.1)
                .lift(0.2)
                .acceleration(0.3)
                .novelty(0.4)
                .noise(0.5)
                .build();
    }
}
