package com.trendearly.pipeline.service;

import com.trendearly.pipeline.dto.MomentumScore;
import com.trendearly.pipeline.exception.InsufficientDataException;
import com.trendearly.pipeline.support.Series;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MomentumScoringServiceTest {

    private final MomentumScoringService scorer = new MomentumScoringService();

    @Test
    void rejectsSeriesShorterThan28Weeks() {
        assertThatThrownBy(() -> scorer.score(Series.constant(10.0, 27)))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("27");
    }

    @Test
    void acceptsExactly28Weeks() throws Exception {
        assertThat(scorer.score(Series.constant(10.0, 28)).momentumScore()).isBetween(1, 100);
    }

    @Test
    void rejectsNullAndEmptySeries() {
        assertThatThrownBy(() -> scorer.score(null)).isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> scorer.score(List.of())).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void rejectsInvalidPoints() {
        List<Double> withNull = Series.constant(10.0, 30);
        withNull.set(5, null);
        List<Double> withNegative = Series.constant(10.0, 30);
        withNegative.set(5, -1.0);
        List<Double> withNaN = Series.constant(10.0, 30);
        withNaN.set(5, Double.NaN);

        assertThatThrownBy(() -> scorer.score(withNull)).isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> scorer.score(withNegative)).isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> scorer.score(withNaN)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void constantSeriesFollowsLiteralFormula() throws Exception {
        MomentumScore score = scorer.score(Series.constant(10.0, 28));

        assertThat(score.lift()).isEqualTo(0.0);
        assertThat(score.acceleration()).isEqualTo(0.0);
        assertThat(score.noise()).isEqualTo(0.0);
        // 모든 값이 같으면 percentile rank = 0.5
        assertThat(score.novelty()).isEqualTo(0.5);
        assertThat(score.rawScore()).isCloseTo(0.125, within(1e-12));

        int expected = (int) Math.round(100.0 / (1.0 + Math.exp(-0.125)));
        assertThat(score.momentumScore()).isEqualTo(expected).isEqualTo(53);
    }

    @Test
    void recentSpikeScoresHigh() throws Exception {
        MomentumScore score = scorer.score(Series.rising(52));

        assertThat(score.lift()).isGreaterThan(3.0);
        assertThat(score.acceleration()).isGreaterThan(0.0);
        assertThat(score.momentumScore()).isGreaterThan(90);
    }

    @Test
    void sameInputGivesIdenticalOutput() throws Exception {
        List<Double> series = randomSeries(new Random(42), 80);

        MomentumScore first = scorer.score(series);
        MomentumScore second = scorer.score(new ArrayList<>(series));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void scoreStaysWithinRangeForArbitrarySeries() throws Exception {
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            List<Double> series = randomSeries(random, 28 + random.nextInt(150));
            assertThat(scorer.score(series).momentumScore()).isBetween(1, 100);
        }
    }

    @Test
    void squashIsClampedAtBothEnds() {
        assertThat(MomentumScoringService.toMomentumScore(-1000)).isEqualTo(1);
        assertThat(MomentumScoringService.toMomentumScore(Double.NEGATIVE_INFINITY)).isEqualTo(1);
        assertThat(MomentumScoringService.toMomentumScore(1000)).isEqualTo(100);
        assertThat(MomentumScoringService.toMomentumScore(0)).isEqualTo(50);
    }

    @Test
    void slopeIsOrdinaryLeastSquares() {
        assertThat(MomentumScoringService.slope(new double[]{1, 2, 3, 4})).isCloseTo(1.0, within(1e-12));
        assertThat(MomentumScoringService.slope(new double[]{5, 5, 5})).isEqualTo(0.0);
        assertThat(MomentumScoringService.slope(new double[]{3})).isEqualTo(0.0);
    }

    @Test
    void percentileRankCountsTiesAsHalf() {
        double[] population = {1, 2, 2, 3};

        assertThat(MomentumScoringService.percentileRank(2, population)).isEqualTo(0.5);
        assertThat(MomentumScoringService.percentileRank(0, population)).isEqualTo(0.0);
        assertThat(MomentumScoringService.percentileRank(4, population)).isEqualTo(1.0);
    }

    @Test
    void stdevUsesSampleDenominator() {
        assertThat(MomentumScoringService.stdev(new double[]{2, 4, 4, 4, 5, 5, 7, 9}))
                .isCloseTo(Math.sqrt(32.0 / 7), within(1e-12));
    }

    private static List<Double> randomSeries(Random random, int weeks) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < weeks; i++) {
            values.add((double) random.nextInt(101));
        }
        return values;
    }
}
