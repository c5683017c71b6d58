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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.store.InMemoryChainScoreStore;

@DisplayName("DerivedMetricCalculator Tests")
class DerivedMetricCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private InMemoryChainScoreStore store;
    private DerivedMetricCalculator calculator;

    @BeforeEach
    void setUp() {
        store = new InMemoryChainScoreStore();
        calculator = new DerivedMetricCalculator(store);
    }

    private double latest(String metricId) {
        return store.latestMeasurement(metricId).orElseThrow().value();
    }

    @Test
    @DisplayName("pool concentration ingests HHI and top-3 share")
    void poolConcentration() {
        List<PoolShare> pools = List.of(
                new PoolShare("Foundry", 30), new PoolShare("AntPool", 25), new PoolShare("ViaBTC", 20),
                new PoolShare("F2Pool", 15), new PoolShare("Other", 10));

        assertEquals(0.225, calculator.recordPoolConcentration(NOW, pools).getAsDouble(), 1e-9);
        assertEquals(0.225, latest(DerivedMetricCalculator.POOL_HHI), 1e-9);
        assertEquals(0.75, latest(DerivedMetricCalculator.POOL_TOP3), 1e-9);
    }

    @Test
    @DisplayName("pool concentration without shares ingests nothing")
    void poolConcentration_Empty() {
        assertTrue(calculator.recordPoolConcentration(NOW, List.of()).isEmpty());
        assertTrue(store.metricIds().isEmpty());
    }

    @Test
    @DisplayName("node and client diversity")
    void nodeAndClientDiversity() {
        calculator.recordNodeAsnConcentration(NOW, List.of(50, 50));
        calculator.recordClientEntropy(NOW, List.of(10, 10, 10));

        assertEquals(0.5, latest(DerivedMetricCalculator.NODE_ASN_HHI), 1e-9);
        assertEquals(1.0, latest(DerivedMetricCalculator.CLIENT_ENTROPY), 1e-9);
    }

    @Test
    @DisplayName("hashprice is stored with its unit and skipped without difficulty")
    void hashprice() {
        assertTrue(calculator.recordHashprice(NOW, 0, 0.1, 3.125, 60_000).isEmpty());
        assertTrue(store.latestMeasurement(DerivedMetricCalculator.HASHPRICE).isEmpty());

        calculator.recordHashprice(NOW, 1e14, 0.1, 3.125, 60_000);

        Measurement stored = store.latestMeasurement(DerivedMetricCalculator.HASHPRICE).orElseThrow();
        assertEquals("USD/TH/day", stored.unit());
        assertEquals(NetworkFormulas.hashprice(1e14, 0.1, 3.125, 60_000), stored.value(), 1e-12);
    }

    @Test
    @DisplayName("fee share, difficulty momentum, capacity growth and segwit usage")
    void simpleRatios() {
        calculator.recordFeeShare(NOW, 0.5, 3.125);
        calculator.recordDifficultyMomentum(NOW, -7.5);
        calculator.recordCapacityGrowth(NOW, 5200, 5000);
        calculator.recordSegwitUsage(NOW, 850, 1000);

        assertEquals(0.5 / 3.625, latest(DerivedMetricCalculator.FEE_SHARE), 1e-9);
        assertEquals(0.75, latest(DerivedMetricCalculator.DIFFICULTY_MOMENTUM), 1e-9);
        assertEquals(0.04, latest(DerivedMetricCalculator.CAPACITY_GROWTH), 1e-9);
        assertEquals(0.85, latest(DerivedMetricCalculator.SEGWIT_USAGE), 1e-9);
    }

    @Test
    @DisplayName("zero denominators ingest nothing")
    void zeroDenominators() {
        assertTrue(calculator.recordCapacityGrowth(NOW, 5200, 0).isEmpty());
        assertTrue(calculator.recordSegwitUsage(NOW, 0, 0).isEmpty());
        assertTrue(store.metricIds().isEmpty());
    }

    @Test
    @DisplayName("fee elasticity correlates mempool size with fee rates sampled nearby")
    void feeElasticity() {
        List<Measurement> mempool = new ArrayList<>();
        List<Measurement> fees = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            Instant ts = NOW.minus(Duration.ofHours(12 - i));
            mempool.add(Measurement.of("throughput.mempool_size", ts, 1000.0 * i));
            fees.add(Measurement.of("throughput.fee_rate", ts.plus(Duration.ofMinutes(10)), 2.0 * i + 1));
        }

        assertEquals(1.0, calculator.recordFeeElasticity(NOW, mempool, fees).getAsDouble(), 1e-9);
        assertEquals(1.0, latest(DerivedMetricCalculator.FEE_ELASTICITY), 1e-9);
    }

    @Test
    @DisplayName("fee elasticity needs enough paired samples")
    void feeElasticity_TooFewPairs() {
        List<Measurement> mempool = new ArrayList<>();
        List<Measurement> fees = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Instant ts = NOW.minus(Duration.ofHours(12 - i));
            mempool.add(Measurement.of("throughput.mempool_size", ts, 1000.0 * i));
            fees.add(Measurement.of("throughput.fee_rate", ts.plus(Duration.ofMinutes(10)), 2.0 * i + 1));
        }

        assertTrue(calculator.recordFeeElasticity(NOW, mempool, fees).isEmpty());
    }

    @Test
    @DisplayName("non-finite results ingest nothing")
    void nonFiniteInputs() {
        assertTrue(calculator.recordHashprice(NOW, 1e14, 0.1, 3.125, Double.NaN).isEmpty());
        assertTrue(calculator.recordFeeShare(NOW, Double.POSITIVE_INFINITY, 3.125).isEmpty());
        assertTrue(calculator.recordPoolConcentration(NOW, List.of(
                new PoolShare("Foundry", Double.NaN), new PoolShare("AntPool", 25))).isEmpty());

        assertTrue(store.metricIds().isEmpty());
    }
}
