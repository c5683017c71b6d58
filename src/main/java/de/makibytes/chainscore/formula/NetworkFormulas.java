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
package de.makibytes.chainscore.formula;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import de.makibytes.chainscore.model.Measurement;

/**
 * Closed-form derived metrics of the mining economy, the fee market and the Lightning
 * network.
 */
public final class NetworkFormulas {

    public static final int BLOCKS_PER_DAY = 144;
    private static final double HASHES_PER_DIFFICULTY = 4_294_967_296.0;
    private static final double TARGET_BLOCK_SECONDS = 600.0;
    private static final double HASHES_PER_TERAHASH = 1e12;
    public static final int MIN_CORRELATION_PAIRS = 10;

    private NetworkFormulas() {
    }

    /**
     * Miner revenue in USD per terahash per day.
     */
    public static double hashprice(double difficulty, double avgFeesPerBlockBtc, double subsidyBtc, double priceUsd) {
        double hashesPerSecond = difficulty * HASHES_PER_DIFFICULTY / TARGET_BLOCK_SECONDS;
        double dailyHashes = hashesPerSecond * 86_400;
        double dailyRevenueUsd = BLOCKS_PER_DAY * (avgFeesPerBlockBtc + subsidyBtc) * priceUsd;
        return dailyRevenueUsd / dailyHashes * HASHES_PER_TERAHASH;
    }

    /**
     * Fraction of miner revenue paid as fees. Empty when there was no revenue.
     */
    public static OptionalDouble feeShare(double feesBtc, double subsidyBtc) {
        double revenue = feesBtc + subsidyBtc;
        if (revenue <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(feesBtc / revenue);
    }

    /**
     * Step score of the magnitude of the estimated next difficulty adjustment, in percent.
     */
    public static double difficultyMomentum(double estimatedChangePercent) {
        double change = Math.abs(estimatedChangePercent);
        if (change < 5) {
            return 1.0;
        } else if (change < 10) {
            return 0.75;
        } else if (change < 20) {
            return 0.5;
        } else if (change < 40) {
            return 0.25;
        }
        return 0.0;
    }

    public static OptionalDouble growth(double current, double previous) {
        if (previous == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((current - previous) / previous);
    }

    public static OptionalDouble ratio(double part, double total) {
        if (total <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(part / total);
    }

    /**
     * Pearson correlation coefficient. Empty for mismatched or too-short samples and for a
     * constant series.
     */
    public static OptionalDouble pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length <= MIN_CORRELATION_PAIRS) {
            return OptionalDouble.empty();
        }
        int n = x.length;
        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double covariance = 0;
        double varianceX = 0;
        double varianceY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }
        if (varianceX == 0 || varianceY == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(covariance / Math.sqrt(varianceX * varianceY));
    }

    /**
     * Pairs each sample of {@code left} with the nearest-in-time sample of {@code right},
     * dropping pairs further apart than {@code maxGap}.
     *
     * @return two aligned arrays: index 0 from {@code left}, index 1 from {@code right}
     */
    public static double[][] pairNearest(List<Measurement> left, List<Measurement> right, Duration maxGap) {
        List<double[]> pairs = new ArrayList<>();
        if (!right.isEmpty()) {
            for (Measurement sample : left) {
                Measurement closest = null;
                long closestGap = Long.MAX_VALUE;
                for (Measurement candidate : right) {
                    long gap = Math.abs(Duration.between(sample.timestamp(), candidate.timestamp()).toSeconds());
                    if (gap < closestGap) {
                        closestGap = gap;
                        closest = candidate;
                    }
                }
                if (closest != null && closestGap < maxGap.toSeconds()) {
                    pairs.add(new double[] { sample.value(), closest.value() });
                }
            }
        }
        double[][] aligned = new double[2][pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            aligned[0][i] = pairs.get(i)[0];
            aligned[1][i] = pairs.get(i)[1];
        }
        return aligned;
    }
}
