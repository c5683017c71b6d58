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

import java.util.Arrays;

/**
 * Order statistics with linear interpolation: the p-th percentile of a sorted sample of
 * size n sits at fractional rank {@code (n - 1) * p / 100}.
 */
public final class PercentileCalculator {

    private PercentileCalculator() {
    }

    public static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    /**
     * @param sorted ascending sample, not empty
     * @param p percentile in [0, 100]
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of an empty sample");
        }
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("Percentile out of range: " + p);
        }
        double rank = (sorted.length - 1) * p / 100.0;
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
