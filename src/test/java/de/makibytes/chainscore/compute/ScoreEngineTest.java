/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.chainscore.compute;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.chainscore.catalog.DefinitionCatalog;
import de.makibytes.chainscore.model.AbsenceReason;
import de.makibytes.chainscore.model.Direction;
import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.model.MetricDefinition;
import de.makibytes.chainscore.model.PercentileSnapshot;
import de.makibytes.chainscore.model.PillarDefinition;
import de.makibytes.chainscore.model.ScoreKind;
import de.makibytes.chainscore.model.ScoreRecord;
import de.makibytes.chainscore.model.ScoreResult;
import de.makibytes.chainscore.model.TargetBand;
import de.makibytes.chainscore.store.InMemoryChainScoreStore;

@DisplayName("ScoreEngine Tests")
class ScoreEngineTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    private InMemoryChainScoreStore store;
    private ScoreEngine engine;
    private MetricDefinition hashprice;
    private MetricDefinition difficultyMomentum;
    private MetricDefinition rbfActivity;

    @BeforeEach
    void setUp() {
        hashprice = MetricDefinition.ranked("security.hashprice", "security", Direction.HIGHER_BETTER, 0.25);
        difficultyMomentum = MetricDefinition.ranked("security.difficulty_momentum", "security", Direction.LOWER_BETTER, 0.25);
        MetricDefinition feeShare = MetricDefinition.ranked("security.fee_share", "security", Direction.HIGHER_BETTER, 0.25);
        MetricDefinition stale = MetricDefinition.ranked("security.stale_incidence", "security", Direction.LOWER_BETTER, 0.25);
        rbfActivity = MetricDefinition.band("adoption.rbf_activity", "adoption", 2, 15, 0.35);
        MetricDefinition segwit = MetricDefinition.ranked("adoption.segwit_usage", "adoption", Direction.HIGHER_BETTER, null);
        DefinitionCatalog catalog = DefinitionCatalog.of(
                List.of(new PillarDefinition("security", "Security", 0.30),
                        new PillarDefinition("adoption", "Adoption", 0.15),
                        new PillarDefinition("lightning", "Lightning", 0.15)),
                List.of(hashprice, feeShare, difficultyMomentum, stale, rbfActivity, segwit));

        store = new InMemoryChainScoreStore();
        Normalizer normalizer = new Normalizer(store, store, 365, 90, 30, 10);
        engine = new ScoreEngine(catalog, normalizer, store, store);
    }

    private void evenDistribution(String metricId) {
        store.upsertSnapshot(new PercentileSnapshot(metricId, 365, NOW, 10, 25, 50, 75, 90, 0, 100));
    }

    private static Map<String, ScoreResult> scores(Object... idsAndValues) {
        Map<String, ScoreResult> map = new HashMap<>();
        for (int i = 0; i < idsAndValues.length; i += 2) {
            Object value = idsAndValues[i + 1];
            map.put((String) idsAndValues[i], value instanceof ScoreResult result
                    ? result
                    : ScoreResult.present(((Number) value).doubleValue()));
        }
        return map;
    }

    @Test
    @DisplayName("higher_better: score is 100 times the rank")
    void higherBetter() {
        evenDistribution(hashprice.getMetricId());

        ScoreResult result = engine.scoreMetric(hashprice, 30);

        assertEquals(30.0, result.getValue(), 1e-9);
    }

    @Test
    @DisplayName("lower_better: score is 100 times one minus the rank")
    void lowerBetter() {
        evenDistribution(difficultyMomentum.getMetricId());

        ScoreResult result = engine.scoreMetric(difficultyMomentum, 30);

        assertEquals(70.0, result.getValue(), 1e-9);
    }

    @Test
    @DisplayName("ranked metric without a distribution is absent, not defaulted")
    void rankedWithoutDistribution() {
        ScoreResult result = engine.scoreMetric(hashprice, 30);

        assertFalse(result.isPresent());
        assertEquals(AbsenceReason.NO_DISTRIBUTION, result.getReason());
    }

    @Test
    @DisplayName("target_band: center scores 100, edges score 0")
    void targetBand_InBand() {
        assertEquals(100.0, engine.scoreMetric(rbfActivity, 8.5).getValue(), 1e-9);
        assertEquals(0.0, engine.scoreMetric(rbfActivity, 2).getValue(), 1e-9);
        assertEquals(0.0, engine.scoreMetric(rbfActivity, 15).getValue(), 1e-9);
        assertEquals(50.0, engine.scoreMetric(rbfActivity, 5.25).getValue(), 1e-9);
    }

    @Test
    @DisplayName("target_band: out-of-band scores are capped at 50 and floored at 0")
    void targetBand_OutOfBand() {
        assertEquals(33.333333, engine.scoreMetric(rbfActivity, 20).getValue(), 1e-6);
        assertEquals(25.0, engine.scoreMetric(rbfActivity, 1).getValue(), 1e-9);
        assertEquals(0.0, engine.scoreMetric(rbfActivity, 40).getValue(), 1e-9);
        assertEquals(0.0, engine.scoreMetric(rbfActivity, -10).getValue(), 1e-9);
    }

    @Test
    @DisplayName("target_band: just outside the band scores close to 50, above the in-band edge")
    void targetBand_Asymmetry() {
        double justInside = ScoreEngine.targetBandScore(new TargetBand(2, 15), 15);
        double justOutside = ScoreEngine.targetBandScore(new TargetBand(2, 15), 15.001);

        assertEquals(0.0, justInside, 1e-9);
        assertTrue(justOutside > 49.9);
    }

    @Test
    @DisplayName("scoreMetric by id: unknown id and missing data are absent")
    void scoreMetricById_Absences() {
        assertEquals(AbsenceReason.MISSING_DEFINITION, engine.scoreMetric("nope").getReason());
        assertEquals(AbsenceReason.NO_MEASUREMENT, engine.scoreMetric("security.hashprice").getReason());
    }

    @Test
    @DisplayName("scoreMetric by id: uses the latest measurement")
    void scoreMetricById_Latest() {
        store.upsertMeasurement(Measurement.of("adoption.rbf_activity", NOW.minusSeconds(60), 20));
        store.upsertMeasurement(Measurement.of("adoption.rbf_activity", NOW, 8.5));

        assertEquals(100.0, engine.scoreMetric("adoption.rbf_activity").getValue(), 1e-9);
    }

    @Test
    @DisplayName("scorePillar: absent metrics leave both sums")
    void scorePillar_ExcludesAbsent() {
        Map<String, ScoreResult> metricScores = scores(
                "security.hashprice", 80,
                "security.fee_share", 60,
                "security.difficulty_momentum", 90,
                "security.stale_incidence", ScoreResult.absent(AbsenceReason.NO_DISTRIBUTION, "test"));

        ScoreResult result = engine.scorePillar("security", metricScores);

        assertEquals((80 * 0.25 + 60 * 0.25 + 90 * 0.25) / 0.75, result.getValue(), 1e-9);
        assertEquals(76.67, result.getValue(), 0.01);
    }

    @Test
    @DisplayName("scorePillar: unset metric weight counts as 1.0")
    void scorePillar_DefaultWeight() {
        ScoreResult result = engine.scorePillar("adoption", scores(
                "adoption.rbf_activity", 100,
                "adoption.segwit_usage", 50));

        assertEquals((100 * 0.35 + 50 * 1.0) / 1.35, result.getValue(), 1e-9);
    }

    @Test
    @DisplayName("scorePillar: no present metrics is ZERO_WEIGHT, unknown pillar is MISSING_DEFINITION")
    void scorePillar_Absences() {
        assertEquals(AbsenceReason.ZERO_WEIGHT, engine.scorePillar("security", Map.of()).getReason());
        assertEquals(AbsenceReason.ZERO_WEIGHT, engine.scorePillar("lightning", Map.of()).getReason());
        assertEquals(AbsenceReason.MISSING_DEFINITION, engine.scorePillar("unknown", Map.of()).getReason());
    }

    @Test
    @DisplayName("scoreOverall: normalises by the weight of pillars that scored")
    void scoreOverall() {
        ScoreResult result = engine.scoreOverall(scores("security", 75, "adoption", 85));

        assertEquals((75 * 0.30 + 85 * 0.15) / 0.45, result.getValue(), 1e-9);
        assertEquals(78.33, result.getValue(), 0.01);
    }

    @Test
    @DisplayName("scoreOverall: nothing present is ZERO_WEIGHT")
    void scoreOverall_NothingPresent() {
        ScoreResult result = engine.scoreOverall(scores(
                "security", ScoreResult.absent(AbsenceReason.ZERO_WEIGHT, "test")));

        assertEquals(AbsenceReason.ZERO_WEIGHT, result.getReason());
    }

    @Test
    @DisplayName("trend: percentage change against the nearest prior score")
    void trend_NearestPrior() {
        store.upsertScore(new ScoreRecord(ScoreKind.PILLAR, "security", NOW.minus(Duration.ofDays(10)), 40, null, null));
        store.upsertScore(new ScoreRecord(ScoreKind.PILLAR, "security", NOW.minus(Duration.ofDays(8)), 50, null, null));
        store.upsertScore(new ScoreRecord(ScoreKind.PILLAR, "security", NOW.minus(Duration.ofDays(1)), 55, null, null));

        OptionalDouble trend = engine.trend(ScoreKind.PILLAR, "security", 60, 7, NOW);

        assertEquals(20.0, trend.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("trend: a score exactly at the cutoff counts")
    void trend_AtCutoff() {
        store.upsertScore(new ScoreRecord(ScoreKind.OVERALL, "overall", NOW.minus(Duration.ofDays(7)), 80, null, null));

        assertEquals(-25.0, engine.trend(ScoreKind.OVERALL, "overall", 60, 7, NOW).getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("trend: absent without history before the cutoff or with a zero historical score")
    void trend_Absent() {
        store.upsertScore(new ScoreRecord(ScoreKind.METRIC, "m1", NOW.minus(Duration.ofDays(3)), 50, null, null));
        store.upsertScore(new ScoreRecord(ScoreKind.METRIC, "m2", NOW.minus(Duration.ofDays(9)), 0, null, null));

        assertTrue(engine.trend(ScoreKind.METRIC, "m1", 60, 7, NOW).isEmpty());
        assertTrue(engine.trend(ScoreKind.METRIC, "m2", 60, 7, NOW).isEmpty());
        assertTrue(engine.trend(ScoreKind.METRIC, "m3", 60, 7, NOW).isEmpty());
    }

    @Test
    @DisplayName("trend: public form compares the latest persisted score")
    void trend_LatestPersisted() {
        store.upsertScore(new ScoreRecord(ScoreKind.METRIC, "m1", NOW.minus(Duration.ofDays(31)), 50, null, null));
        store.upsertScore(new ScoreRecord(ScoreKind.METRIC, "m1", NOW.minusSeconds(10), 75, null, null));

        assertEquals(50.0, engine.trend(ScoreKind.METRIC, "m1", 30, NOW).getAsDouble(), 1e-9);
        assertEquals(50.0, engine.trend(ScoreKind.METRIC, "m1", 7, NOW).getAsDouble(), 1e-9);
        assertTrue(engine.trend(ScoreKind.METRIC, "unknown", 7, NOW).isEmpty());
    }

    @Test
    @DisplayName("non-finite values are absent, never scored")
    void nonFiniteValue() {
        evenDistribution(hashprice.getMetricId());

        ScoreResult nan = engine.scoreMetric(hashprice, Double.NaN);
        ScoreResult infinite = engine.scoreMetric(rbfActivity, Double.POSITIVE_INFINITY);

        assertFalse(nan.isPresent());
        assertEquals(AbsenceReason.NO_MEASUREMENT, nan.getReason());
        assertEquals(AbsenceReason.NO_MEASUREMENT, infinite.getReason());
        assertEquals(AbsenceReason.ZERO_WEIGHT,
                engine.scorePillar("security", Map.of("security.hashprice", nan)).getReason());
    }

    @Test
    @DisplayName("scoreMetric as of a time skips later readings")
    void scoreMetricAsOf() {
        store.upsertMeasurement(Measurement.of("adoption.rbf_activity", NOW.minusSeconds(60), 8.5));
        store.upsertMeasurement(Measurement.of("adoption.rbf_activity", NOW.plusSeconds(60), 20));

        assertEquals(100.0, engine.scoreMetric("adoption.rbf_activity", NOW).getValue(), 1e-9);
        assertEquals(AbsenceReason.NO_MEASUREMENT,
                engine.scoreMetric("adoption.rbf_activity", NOW.minusSeconds(120)).getReason());
        assertEquals(AbsenceReason.MISSING_DEFINITION, engine.scoreMetric("nope", NOW).getReason());
    }
}
