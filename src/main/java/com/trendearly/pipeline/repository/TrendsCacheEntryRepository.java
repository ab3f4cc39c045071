package com.trendearly.pipeline.repository;

import com.trendearly.pipeline.entity.TrendsCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TrendsCacheEntryRepository extends JpaRepository<TrendsCacheEntry, Long> {

    Optional<TrendsCacheEntry> findByKeywordIdAndGeoAndTimeframe(Long keywordId, String geo, String timeframe);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM TrendsCacheEntry e WHERE e.keywordId = :keywordId")
    int deleteByKeywordId(@Param("keywordId") Long keywordId);
}
