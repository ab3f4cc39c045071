package com.trendearly.pipeline.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Entity
@Table(
        name = "trends_cache",
        uniqueConstraints = @UniqueConstraint(columnNames = {"keyword_id", "geo", "timeframe"})
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendsCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "keyword_id", nullable = false)
    private Long keywordId;

    @Column(nullable = false, length = 10)
    private String geo;

    @Column(nullable = false, length = 50)
    private String timeframe;

    /** 오래된 값이 앞, 최신 값이 마지막 */
    @Convert(converter = WeeklySeriesConverter.class)
    @Column(name = "weekly_series", nullable = false, length = 8000)
    private List<Double> weeklySeries;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    /** 부분 병합 없이 통째로 교체 */
    public void replaceSeries(List<Double> series, Instant fetchedAt) {
        this.weeklySeries = List.copyOf(series);
        this.fetchedAt = fetchedAt;
    }
}
