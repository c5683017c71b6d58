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

import java.util.Collection;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Concentration and diversity indices over participation shares. Shares are normalised
 * to fractions of their total before use, so percentages and raw counts both work.
 */
public final class ConcentrationMetrics {

    private ConcentrationMetrics() {
    }

    /**
     * Herfindahl-Hirschman index: sum of squared fractional shares, in (0, 1].
     * Empty when the shares total zero.
     */
    public static OptionalDouble hhi(Collection<? extends Number> shares) {
        double total = total(shares);
        if (total <= 0) {
            return OptionalDouble.empty();
        }
        double hhi = 0;
        for (Number share : shares) {
            double fraction = share.doubleValue() / total;
            hhi += fraction * fraction;
        }
        return OptionalDouble.of(hhi);
    }

    /**
     * Combined fractional share of the {@code n} largest participants.
     */
    public static OptionalDouble topShare(Collection<? extends Number> shares, int n) {
        double total = total(shares);
        if (total <= 0) {
            return OptionalDouble.empty();
        }
        double top = shares.stream()
                .mapToDouble(Number::doubleValue)
                .boxed()
                .sorted((a, b) -> Double.compare(b, a))
                .limit(n)
                .mapToDouble(Double::doubleValue)
                .sum();
        return OptionalDouble.of(top / total);
    }

    /**
     * Shannon entropy divided by its maximum {@code ln(k)}, in [0, 1]. A single category
     * has entropy 0.
     */
    public static OptionalDouble normalizedEntropy(Collection<? extends Number> counts) {
        double total = total(counts);
        if (total <= 0) {
            return OptionalDouble.empty();
        }
        List<Double> positive = counts.stream()
                .map(Number::doubleValue)
                .filter(count -> count > 0)
                .toList();
        if (positive.size() < 2) {
            return OptionalDouble.of(0.0);
        }
        double entropy = 0;
        for (double count : positive) {
            double p = count / total;
            entropy -= p * Math.log(p);
        }
        return OptionalDouble.of(entropy / Math.log(positive.size()));
    }

    private static double total(Collection<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return 0;
        }
        double total = 0;
        for (Number value : values) {
            total += value.doubleValue();
        }
        return total;
    }
}
