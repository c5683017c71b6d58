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
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import de.makibytes.chainscore.config.ChainScoreProperties;
import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.model.PercentileSnapshot;
import de.makibytes.chainscore.store.MeasurementStore;
import de.makibytes.chainscore.store.PercentileStore;

/**
 * Estimates each metric's historical distribution on a rolling window and maps fresh
 * readings to a percentile rank in [0, 1].
 */
@Service
public class Normalizer {
    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    private static final double[] BREAKPOINT_RANKS = { 0.0, 0.10, 0.25, 0.50, 0.75, 0.90, 1.0 };

    private final MeasurementStore measurementStore;
    private final PercentileStore percentileStore;
    private final int primaryWindowDays;
    private final int fallbackWindowDays;
    private final int minPointsPrimary;
    private final int minPointsFallback;

    @Autowired
    public Normalizer(MeasurementStore measurementStore, PercentileStore percentileStore, ChainScoreProperties properties) {
        this(measurementStore, percentileStore,
                properties.getNormalization().getPrimaryWindowDays(),
                properties.getNormalization().getFallbackWindowDays(),
                properties.getNormalization().getMinPointsPrimary(),
                properties.getNormalization().getMinPointsFallback());
    }

    public Normalizer(MeasurementStore measurementStore,
                      PercentileStore percentileStore,
                      int primaryWindowDays,
                      int fallbackWindowDays,
                      int minPointsPrimary,
                      int minPointsFallback) {
        this.measurementStore = measurementStore;
        this.percentileStore = percentileStore;
        this.primaryWindowDays = primaryWindowDays;
        this.fallbackWindowDays = fallbackWindowDays;
        this.minPointsPrimary = minPointsPrimary;
        this.minPointsFallback = minPointsFallback;
    }

    /**
     * Refreshes the snapshot of every metric that has measurements.
     *
     * @return number of snapshots written
     */
    public int normalizeAll(Instant asOf) {
        int refreshed = 0;
        for (String metricId : measurementStore.metricIds()) {
            if (computePercentiles(metricId, asOf).isPresent()) {
                refreshed++;
            }
        }
        logger.info("Completed normalization: {} snapshots refreshed", refreshed);
        return refreshed;
    }

    /**
     * Computes and stores the distribution snapshot of a metric. Falls back to the shorter
     * window when the primary one holds fewer than the required points; gives up, without
     * failing, when even the fallback window is too sparse.
     */
    public Optional<PercentileSnapshot> computePercentiles(String metricId, Instant asOf) {
        double[] values = valuesInWindow(metricId, asOf, primaryWindowDays);
        int windowUsed = primaryWindowDays;
        if (values.length < minPointsPrimary) {
            values = valuesInWindow(metricId, asOf, fallbackWindowDays);
            windowUsed = fallbackWindowDays;
            if (values.length < minPointsFallback) {
                logger.warn("Insufficient data for {}: only {} points in {}d", metricId, values.length, fallbackWindowDays);
                return Optional.empty();
            }
        }

        double[] sorted = PercentileCalculator.sortedCopy(values);
        PercentileSnapshot snapshot = new PercentileSnapshot(
                metricId,
                windowUsed,
                asOf,
                PercentileCalculator.percentile(sorted, 10),
                PercentileCalculator.percentile(sorted, 25),
                PercentileCalculator.percentile(sorted, 50),
                PercentileCalculator.percentile(sorted, 75),
                PercentileCalculator.percentile(sorted, 90),
                sorted[0],
                sorted[sorted.length - 1]);
        percentileStore.upsertSnapshot(snapshot);
        logger.debug("Calculated percentiles for {} using {}d window: p50={}, range=[{}, {}]",
                metricId, windowUsed, snapshot.p50(), snapshot.min(), snapshot.max());
        return Optional.of(snapshot);
    }

    public double rank(String metricId, double value) {
        return rank(metricId, value, primaryWindowDays);
    }

    /**
     * Percentile rank of {@code value} against the latest snapshot for {@code windowDays},
     * or the fallback window's snapshot when that is missing.
     *
     * @throws NoDistributionException if neither window has a snapshot
     */
    public double rank(String metricId, double value, int windowDays) {
        Optional<PercentileSnapshot> snapshot = percentileStore.latestSnapshot(metricId, windowDays);
        if (snapshot.isEmpty()) {
            snapshot = percentileStore.latestSnapshot(metricId, fallbackWindowDays);
        }
        return interpolateRank(snapshot.orElseThrow(
                () -> new NoDistributionException(metricId, windowDays, fallbackWindowDays)), value);
    }

    /**
     * Piecewise-linear rank across the seven snapshot breakpoints. A segment whose bounds
     * are equal yields its lower rank.
     */
    public static double interpolateRank(PercentileSnapshot snapshot, double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Cannot rank NaN for " + snapshot.metricId());
        }
        double[] breakpoints = snapshot.breakpoints();
        if (value <= breakpoints[0]) {
            return 0.0;
        }
        if (value >= breakpoints[breakpoints.length - 1]) {
            return 1.0;
        }
        for (int i = 1; i < breakpoints.length; i++) {
            if (value <= breakpoints[i]) {
                double low = breakpoints[i - 1];
                double high = breakpoints[i];
                double lowRank = BREAKPOINT_RANKS[i - 1];
                if (high <= low) {
                    return lowRank;
                }
                double fraction = (value - low) / (high - low);
                return lowRank + fraction * (BREAKPOINT_RANKS[i] - lowRank);
            }
        }
        return 1.0;
    }

    private double[] valuesInWindow(String metricId, Instant asOf, int windowDays) {
        List<Measurement> history = measurementStore.measurementsSince(metricId, asOf.minus(Duration.ofDays(windowDays)));
        return history.stream()
                .filter(measurement -> !measurement.timestamp().isAfter(asOf))
                .mapToDouble(Measurement::value)
                .filter(Double::isFinite)
                .toArray();
    }
}
