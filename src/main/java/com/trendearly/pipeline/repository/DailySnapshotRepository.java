package com.trendearly.pipeline.repository;

import com.trendearly.pipeline.entity.DailySnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DailySnapshotRepository extends JpaRepository<DailySnapshot, Long> {

    boolean existsByKeywordIdAndSnapshotDate(Long keywordId, LocalDate snapshotDate);

    List<DailySnapshot> findBySnapshotDateOrderByMomentumScoreDesc(LocalDate snapshotDate);
}
