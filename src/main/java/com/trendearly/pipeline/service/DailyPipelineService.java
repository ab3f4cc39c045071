package com.trendearly.pipeline.service;

import com.trendearly.pipeline.config.PipelineProperties;
import com.trendearly.pipeline.crawler.KeywordSource;
import com.trendearly.pipeline.dto.CandidateKeyword;
import com.trendearly.pipeline.dto.KeywordOutcome;
import com.trendearly.pipeline.dto.KeywordPage;
import com.trendearly.pipeline.dto.MomentumScore;
import com.trendearly.pipeline.dto.PipelineRunReport;
import com.trendearly.pipeline.dto.PipelineState;
import com.trendearly.pipeline.entity.DailySnapshot;
import com.trendearly.pipeline.entity.Keyword;
import com.trendearly.pipeline.exception.FetchException;
import com.trendearly.pipeline.exception.InfrastructureException;
import com.trendearly.pipeline.exception.InsufficientDataException;
import com.trendearly.pipeline.exception.PublishException;
import com.trendearly.pipeline.extractor.KeywordNormalizer;
import com.trendearly.pipeline.publisher.AtomicPublisher;
import com.trendearly.pipeline.publisher.StagedSiteVerifier;
import com.trendearly.pipeline.publisher.StaticPageBuilder;
import com.trendearly.pipeline.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Nightly run: ingest candidates, cache/fetch and score each keyword, persist snapshots,
 * build the static tree and publish it.
 *
 * <p>Per-keyword failures become {@link KeywordOutcome}s and are folded into the report.
 * Only a missing keyword list, an unreachable store, or a staging/publish failure end the
 * run in {@link PipelineState#FAILED}. {@link #run} never throws.</p>
 */
@Slf4j
@Service
public class DailyPipelineService {

    private final KeywordSource keywordSource;
    private final KeywordNormalizer normalizer;
    private final TimeSeriesStore store;
    private final TrendsCacheService trendsCache;
    private final MomentumScoringService scorer;
    private final StaticPageBuilder pageBuilder;
    private final StagedSiteVerifier siteVerifier;
    private final AtomicPublisher publisher;
    private final PipelineProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public DailyPipelineService(KeywordSource keywordSource,
                                KeywordNormalizer normalizer,
                                TimeSeriesStore store,
                                TrendsCacheService trendsCache,
                                MomentumScoringService scorer,
                                StaticPageBuilder pageBuilder,
                                StagedSiteVerifier siteVerifier,
                                AtomicPublisher publisher,
                                PipelineProperties properties,
                                Clock clock) {
        this.keywordSource = keywordSource;
        this.normalizer = normalizer;
        this.store = store;
        this.trendsCache = trendsCache;
        this.scorer = scorer;
        this.pageBuilder = pageBuilder;
        this.siteVerifier = siteVerifier;
        this.publisher = publisher;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineRunReport run(LocalDate date) {
        return run(date, properties.getKeywordLimit());
    }

    public PipelineRunReport run(LocalDate date, Integer keywordLimit) {
        RunTracker tracker = new RunTracker(date, clock.instant());

        // 겹치는 실행은 큐잉하지 않고 거절
        if (!running.compareAndSet(false, true)) {
            log.warn("[Pipeline] run for {} rejected: another run is in progress", date);
            tracker.fail("run already in progress");
            return tracker.toReport(clock.instant());
        }

        try {
            log.info("[Pipeline] starting run date={} keywordLimit={}", date, keywordLimit);

            tracker.state = PipelineState.INGESTING;
            List<CandidateKeyword> candidates = ingest(keywordLimit);
            tracker.keywordsFetched = candidates.size();

            tracker.state = PipelineState.CACHE_AND_SCORE;
            for (int i = 0; i < candidates.size(); i++) {
                CandidateKeyword candidate = candidates.get(i);
                log.info("[Pipeline] processing keyword {}/{}: {}", i + 1, candidates.size(), candidate.text());
                tracker.record(processKeyword(candidate, date));
            }

            if (tracker.keywordsScored == 0) {
                log.warn("[Pipeline] no keywords scored for {}, skipping publish", date);
                tracker.state = PipelineState.DONE;
                tracker.success = false;
            } else {
                tracker.state = PipelineState.PUBLISHING;
                publishSite(date, tracker);
                tracker.published = true;
                tracker.state = PipelineState.DONE;
                tracker.success = true;
            }
        } catch (InfrastructureException e) {
            log.error("[Pipeline] run {} failed in {}", date, tracker.state, e);
            tracker.fail(e.getMessage());
        } catch (PublishException e) {
            log.error("[Pipeline] publish for {} failed, live tree unchanged", date, e);
            tracker.fail("publish failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Pipeline] unexpected error in run {} during {}", date, tracker.state, e);
            tracker.fail("unexpected error: " + e);
        } finally {
            running.set(false);
        }

        PipelineRunReport report = tracker.toReport(clock.instant());
        logSummary(report);
        return report;
    }

    public boolean isRunning() {
        return running.get();
    }

    private List<CandidateKeyword> ingest(Integer keywordLimit) {
        List<String> raw;
        try {
            raw = keywordSource.fetchCandidateKeywords(keywordLimit);
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InfrastructureException("Keyword source failed: " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new InfrastructureException("Keyword source returned no list");
        }

        List<CandidateKeyword> candidates = normalizer.normalizeAll(raw);
        if (keywordLimit != null && candidates.size() > keywordLimit) {
            candidates = candidates.subList(0, keywordLimit);
        }
        log.info("[Pipeline] {} raw candidates -> {} unique keywords", raw.size(), candidates.size());
        return candidates;
    }

    /**
     * Any other error of the fetch or scoring step becomes a failed outcome. Store errors are
     * not caught here: they surface as {@link InfrastructureException} and end the run.
     */
    KeywordOutcome processKeyword(CandidateKeyword candidate, LocalDate date) {
        Keyword keyword = store.upsertKeyword(candidate.text(), candidate.type(), date);

        List<Double> series;
        try {
            series = trendsCache.getOrFetch(keyword, properties.getGeo(), properties.getTimeframe(), properties.getCacheTtl());
        } catch (FetchException e) {
            log.warn("[Pipeline] fetch failed keyword='{}': {}", keyword.getText(), e.getMessage());
            return KeywordOutcome.failed(keyword.getText(), KeywordOutcome.Stage.FETCH, e.getMessage());
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Pipeline] unexpected fetch error keyword='{}'", keyword.getText(), e);
            return KeywordOutcome.failed(keyword.getText(), KeywordOutcome.Stage.FETCH, e.toString());
        }

        MomentumScore score;
        try {
            score = scorer.score(series);
        } catch (InsufficientDataException e) {
            log.warn("[Pipeline] cannot score keyword='{}': {}", keyword.getText(), e.getMessage());
            return KeywordOutcome.failed(keyword.getText(), KeywordOutcome.Stage.SCORE, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Pipeline] unexpected scoring error keyword='{}'", keyword.getText(), e);
            return KeywordOutcome.failed(keyword.getText(), KeywordOutcome.Stage.SCORE, e.toString());
        }

        boolean created = store.insertSnapshotIfAbsent(DailySnapshot.builder()
                .keywordId(keyword.getId())
                .snapshotDate(date)
                .momentumScore(score.momentumScore())
                .rawScore(score.rawScore())
                .lift(score.lift())
                .acceleration(score.acceleration())
                .novelty(score.novelty())
                .noise(score.noise())
                .build());
        if (!created) {
            log.debug("[Pipeline] snapshot already exists keyword='{}' date={}", keyword.getText(), date);
        }
        return KeywordOutcome.scored(keyword.getText(), score.momentumScore(), created);
    }

    private void publishSite(LocalDate date, RunTracker tracker) throws PublishException {
        PipelineProperties.Site site = properties.getSite();
        Path staging = site.resolveStagingDir();
        Path live = site.getLiveDir();

        try {
            FileSystemUtils.deleteRecursively(staging);
            Files.createDirectories(staging.getParent());
            pageBuilder.build(staging, date, collectPages(date, tracker));
        } catch (IOException e) {
            throw new InfrastructureException("Failed to stage pages in " + staging + ": " + e.getMessage(), e);
        }

        try {
            siteVerifier.verify(staging);
            publisher.publish(staging, live);
        } finally {
            discardStaging(staging);
        }
    }

    /**
     * Snapshots of the date joined with their keyword and cache entry. Keywords whose text
     * contains a forbidden term stay in the store but are left off the site.
     */
    private List<KeywordPage> collectPages(LocalDate date, RunTracker tracker) {
        List<KeywordPage> pages = new ArrayList<>();
        for (DailySnapshot snapshot : store.findSnapshots(date)) {
            Optional<Keyword> found = store.findKeyword(snapshot.getKeywordId());
            if (found.isEmpty()) {
                continue;
            }
            Keyword keyword = found.get();
            if (siteVerifier.containsForbiddenTerm(keyword.getText())) {
                log.warn("[Publish] keyword '{}' withheld from site: forbidden term", keyword.getText());
                tracker.withheldKeywords.add(keyword.getText());
                continue;
            }
            pages.add(new KeywordPage(
                    keyword,
                    snapshot,
                    store.findCacheEntry(keyword.getId(), properties.getGeo(), properties.getTimeframe()).orElse(null)));
        }
        return pages;
    }

    private void discardStaging(Path staging) {
        try {
            if (FileSystemUtils.deleteRecursively(staging)) {
                log.debug("[Pipeline] discarded staging tree {}", staging);
            }
        } catch (IOException e) {
            log.warn("[Pipeline] failed to discard staging tree {}: {}", staging, e.getMessage());
        }
    }

    private void logSummary(PipelineRunReport r) {
        String summary = "[Pipeline] run {} finished state={} success={} fetched={} scored={} failed={} created={} published={} duration={}ms";
        Object[] args = {r.date(), r.state(), r.success(), r.keywordsFetched(), r.keywordsScored(),
                r.keywordsFailed(), r.snapshotsCreated(), r.published(), r.duration().toMillis()};
        if (r.failed()) {
            log.error(summary, args);
        } else if (!r.success()) {
            log.warn(summary, args);
        } else {
            log.info(summary, args);
        }
    }

    /** Mutable state of a single run; never shared between runs. */
    private static final class RunTracker {
        private final LocalDate date;
        private final Instant startedAt;
        private final List<PipelineRunReport.KeywordError> errors = new ArrayList<>();
        private final List<String> withheldKeywords = new ArrayList<>();
        private PipelineState state = PipelineState.INGESTING;
        private int keywordsFetched;
        private int keywordsScored;
        private int keywordsFailed;
        private int snapshotsCreated;
        private boolean published;
        private boolean success;
        private String fatalError;

        private RunTracker(LocalDate date, Instant startedAt) {
            this.date = date;
            this.startedAt = startedAt;
        }

        private void record(KeywordOutcome outcome) {
            if (outcome.scored()) {
                keywordsScored++;
                if (outcome.snapshotCreated()) {
                    snapshotsCreated++;
                }
            } else {
                keywordsFailed++;
                errors.add(new PipelineRunReport.KeywordError(outcome.keyword(), outcome.stage(), outcome.message()));
            }
        }

        private void fail(String message) {
            state = PipelineState.FAILED;
            success = false;
            fatalError = message;
        }

        private PipelineRunReport toReport(Instant finishedAt) {
            return PipelineRunReport.builder()
                    .date(date)
                    .state(state)
                    .startedAt(startedAt)
                    .duration(Duration.between(startedAt, finishedAt))
                    .keywordsFetched(keywordsFetched)
                    .keywordsScored(keywordsScored)
                    .keywordsFailed(keywordsFailed)
                    .snapshotsCreated(snapshotsCreated)
                    .published(published)
                    .success(success)
                    .errors(List.copyOf(errors))
                    .withheldKeywords(List.copyOf(withheldKeywords))
                    .fatalError(fatalError)
                    .build();
        }
    }
}
