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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.chainscore.catalog.DefinitionCatalog;
import de.makibytes.chainscore.model.AbsenceReason;
import de.makibytes.chainscore.model.Direction;
import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.model.MetricDefinition;
import de.makibytes.chainscore.model.PillarDefinition;
import de.makibytes.chainscore.model.ScoreKind;
import de.makibytes.chainscore.model.ScoreRecord;
import de.makibytes.chainscore.model.ScoreResult;
import de.makibytes.chainscore.model.TargetBand;
import de.makibytes.chainscore.model.TrendHorizon;
import de.makibytes.chainscore.store.MeasurementStore;
import de.makibytes.chainscore.store.ScoreStore;

/**
 * Turns the latest measurements into metric scores, aggregates them into pillar scores
 * and one overall score, attaches 7d/30d trends and persists the result.
 *
 * <p>Aggregation always consumes the results computed earlier in the same pass, never
 * previously persisted scores. Store failures propagate; every other failure only omits
 * the affected score.</p>
 */
@Service
public class ScoreEngine {
    private static final Logger logger = LoggerFactory.getLogger(ScoreEngine.class);

    public static final String OVERALL_ID = "overall";
    private static final long SECONDS_PER_DAY = 86_400L;

    private final DefinitionCatalog catalog;
    private final Normalizer normalizer;
    private final MeasurementStore measurementStore;
    private final ScoreStore scoreStore;

    public ScoreEngine(DefinitionCatalog catalog,
                       Normalizer normalizer,
                       MeasurementStore measurementStore,
                       ScoreStore scoreStore) {
        this.catalog = catalog;
        this.normalizer = normalizer;
        this.measurementStore = measurementStore;
        this.scoreStore = scoreStore;
    }

    /**
     * Scores the latest measurement of a catalog metric.
     */
    public ScoreResult scoreMetric(String metricId) {
        return scoreLatest(metricId, measurementStore.latestMeasurement(metricId));
    }

    /**
     * Scores the newest measurement of a catalog metric taken at or before {@code asOf}.
     */
    public ScoreResult scoreMetric(String metricId, Instant asOf) {
        return scoreLatest(metricId, measurementStore.latestMeasurementAtOrBefore(metricId, asOf));
    }

    private ScoreResult scoreLatest(String metricId, Optional<Measurement> latest) {
        Optional<MetricDefinition> definition = catalog.metric(metricId);
        if (definition.isEmpty()) {
            return ScoreResult.absent(AbsenceReason.MISSING_DEFINITION, "metric " + metricId + " not in catalog");
        }
        if (latest.isEmpty()) {
            return ScoreResult.absent(AbsenceReason.NO_MEASUREMENT, "no data for metric " + metricId);
        }
        return scoreMetric(definition.get(), latest.get().value());
    }

    public ScoreResult scoreMetric(MetricDefinition definition, double latestValue) {
        if (!Double.isFinite(latestValue)) {
            return ScoreResult.absent(AbsenceReason.NO_MEASUREMENT,
                    "latest value " + latestValue + " of " + definition.getMetricId() + " is not finite");
        }
        if (definition.getDirection() == Direction.TARGET_BAND) {
            return definition.getTargetBand()
                    .map(band -> ScoreResult.present(targetBandScore(band, latestValue)))
                    .orElseGet(() -> ScoreResult.absent(AbsenceReason.MISSING_DEFINITION,
                            "no target band defined for " + definition.getMetricId()));
        }
        double rank;
        try {
            rank = normalizer.rank(definition.getMetricId(), latestValue);
        } catch (NoDistributionException ex) {
            return ScoreResult.absent(AbsenceReason.NO_DISTRIBUTION, ex.getMessage());
        }
        double score = switch (definition.getDirection()) {
            case HIGHER_BETTER -> rank * 100;
            case LOWER_BETTER -> (1 - rank) * 100;
            case TARGET_BAND -> throw new IllegalStateException("target band scored without rank");
        };
        return ScoreResult.present(score);
    }

    /**
     * In-band values score 0..100 by distance from the center; values outside the band
     * score at most 50, floored at 0.
     */
    public static double targetBandScore(TargetBand band, double value) {
        if (band.contains(value)) {
            double distanceFromCenter = Math.abs(value - band.center());
            return 100 * (1 - distanceFromCenter / band.halfRange());
        }
        if (value < band.min()) {
            double distance = band.min() - value;
            return Math.max(0, 50 * (1 - distance / band.min()));
        }
        double distance = value - band.max();
        return Math.max(0, 50 * (1 - distance / band.max()));
    }

    /**
     * Weighted mean over the pillar's metrics that have a present score. Absent metrics
     * are left out of both the weighted sum and the total weight.
     */
    public ScoreResult scorePillar(String pillarId, Map<String, ScoreResult> metricScores) {
        if (catalog.pillar(pillarId).isEmpty()) {
            return ScoreResult.absent(AbsenceReason.MISSING_DEFINITION, "pillar " + pillarId + " not in catalog");
        }
        List<MetricDefinition> pillarMetrics = catalog.metricsForPillar(pillarId);
        double weightedSum = 0;
        double totalWeight = 0;
        for (MetricDefinition metric : pillarMetrics) {
            ScoreResult result = metricScores.get(metric.getMetricId());
            if (result == null || !result.isPresent()) {
                logger.debug("No score for metric {} in pillar {}", metric.getMetricId(), pillarId);
                continue;
            }
            weightedSum += result.getValue() * metric.getWeight();
            totalWeight += metric.getWeight();
        }
        if (totalWeight == 0) {
            return ScoreResult.absent(AbsenceReason.ZERO_WEIGHT,
                    "no weighted metric scores for pillar " + pillarId + " (" + pillarMetrics.size() + " defined)");
        }
        return ScoreResult.present(weightedSum / totalWeight);
    }

    /**
     * Weighted mean over the pillars with a present score, normalised by the weight of
     * those pillars only.
     */
    public ScoreResult scoreOverall(Map<String, ScoreResult> pillarScores) {
        double weightedSum = 0;
        double totalWeight = 0;
        for (PillarDefinition pillar : catalog.pillars()) {
            ScoreResult result = pillarScores.get(pillar.pillarId());
            if (result == null || !result.isPresent()) {
                logger.warn("No score for pillar {}", pillar.pillarId());
                continue;
            }
            weightedSum += result.getValue() * pillar.weight();
            totalWeight += pillar.weight();
        }
        if (totalWeight == 0) {
            return ScoreResult.absent(AbsenceReason.ZERO_WEIGHT, "no weighted pillar scores");
        }
        return ScoreResult.present(weightedSum / totalWeight);
    }

    /**
     * Percentage change of the latest persisted score against the nearest score at or
     * before {@code now - days}.
     */
    public OptionalDouble trend(ScoreKind kind, String id, int days, Instant now) {
        Optional<ScoreRecord> current = scoreStore.latestScore(kind, id);
        if (current.isEmpty()) {
            return OptionalDouble.empty();
        }
        return trend(kind, id, current.get().score(), days, now);
    }

    /**
     * Percentage change of {@code currentScore} against the nearest persisted score at or
     * before {@code now - days}. Empty when there is no such score or it is zero.
     */
    public OptionalDouble trend(ScoreKind kind, String id, double currentScore, int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofSeconds(days * SECONDS_PER_DAY));
        Optional<ScoreRecord> historical = scoreStore.scoreAtOrBefore(kind, id, cutoff);
        if (historical.isEmpty()) {
            return OptionalDouble.empty();
        }
        double historicalScore = historical.get().score();
        if (historicalScore == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((currentScore - historicalScore) / historicalScore * 100);
    }

    public ScoringPass computeAll() {
        return computeAll(Instant.now());
    }

    /**
     * One recompute pass: metrics, then pillars from this pass's metric results, then the
     * overall score from this pass's pillar results, then trends, then persistence.
     */
    public ScoringPass computeAll(Instant now) {
        Instant timestamp = now.truncatedTo(ChronoUnit.SECONDS);

        Map<String, ScoreResult> metricScores = new LinkedHashMap<>();
        for (MetricDefinition definition : catalog.metrics()) {
            ScoreResult result = scoreMetric(definition.getMetricId(), now);
            metricScores.put(definition.getMetricId(), result);
            if (result.isPresent()) {
                logger.debug("Metric {}: {}/100", definition.getMetricId(), format(result.getValue()));
            } else {
                logger.warn("Skipping metric {}: {} ({})", definition.getMetricId(), result.getReason(), result.getDetail());
            }
        }

        Map<String, ScoreResult> pillarScores = new LinkedHashMap<>();
        for (PillarDefinition pillar : catalog.pillars()) {
            ScoreResult result = scorePillar(pillar.pillarId(), metricScores);
            pillarScores.put(pillar.pillarId(), result);
            if (result.isPresent()) {
                logger.info("Pillar {}: {}/100", pillar.pillarId(), format(result.getValue()));
            } else {
                logger.warn("Skipping pillar {}: {} ({})", pillar.pillarId(), result.getReason(), result.getDetail());
            }
        }

        ScoreResult overall = scoreOverall(pillarScores);
        if (overall.isPresent()) {
            logger.info("Overall score: {}/100", format(overall.getValue()));
        } else {
            logger.warn("Skipping overall score: {} ({})", overall.getReason(), overall.getDetail());
        }

        List<ScoreRecord> records = new ArrayList<>();
        metricScores.forEach((id, result) -> addRecord(records, ScoreKind.METRIC, id, result, timestamp));
        pillarScores.forEach((id, result) -> addRecord(records, ScoreKind.PILLAR, id, result, timestamp));
        addRecord(records, ScoreKind.OVERALL, OVERALL_ID, overall, timestamp);

        for (ScoreRecord record : records) {
            scoreStore.upsertScore(record);
        }
        logger.info("Completed score calculations: {} records persisted", records.size());

        return new ScoringPass(timestamp,
                Collections.unmodifiableMap(metricScores),
                Collections.unmodifiableMap(pillarScores),
                overall,
                List.copyOf(records));
    }

    private void addRecord(List<ScoreRecord> records, ScoreKind kind, String id, ScoreResult result, Instant timestamp) {
        if (!result.isPresent()) {
            return;
        }
        double score = result.getValue();
        records.add(new ScoreRecord(kind, id, timestamp, score,
                boxed(trend(kind, id, score, TrendHorizon.DAYS_7.getDays(), timestamp)),
                boxed(trend(kind, id, score, TrendHorizon.DAYS_30.getDays(), timestamp))));
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
