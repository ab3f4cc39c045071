package com.trendearly.pipeline.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Append-only: a row is written once per (keyword, date) and never updated.
 */
@Entity
@Table(
        name = "daily_snapshots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"keyword_id", "snapshot_date"})
)
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "keyword_id", nullable = false, updatable = false)
    private Long keywordId;

    @Column(name = "snapshot_date", nullable = false, updatable = false)
    private LocalDate snapshotDate;

    @Column(name = "momentum_score", nullable = false, updatable = false)
    private int momentumScore;

    @Column(name = "raw_score", nullable = false, updatable = false)
    private double rawScore;

    @Column(nullable = false, updatable = false)
    private double lift;

    @Column(nullable = false, updatable = false)
    private double acceleration;

    @Column(nullable = false, updatable = false)
    private double novelty;

    @Column(nullable = false, updatable = false)
    private double noise;
}
