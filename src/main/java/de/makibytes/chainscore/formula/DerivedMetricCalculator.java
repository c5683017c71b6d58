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
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.store.MeasurementStore;

/**
 * Computes derived network metrics from collector inputs and ingests them into the
 * measurement store under their catalog ids. Inputs that cannot produce a value write
 * nothing and return an empty result.
 */
@Service
public class DerivedMetricCalculator {
    private static final Logger logger = LoggerFactory.getLogger(DerivedMetricCalculator.class);

    public static final String POOL_HHI = "decent.pool_hhi";
    public static final String POOL_TOP3 = "decent.pool_top3";
    public static final String NODE_ASN_HHI = "decent.node_asn_hhi";
    public static final String CLIENT_ENTROPY = "decent.client_entropy";
    public static final String FEE_SHARE = "security.fee_share";
    public static final String HASHPRICE = "security.hashprice";
    public static final String DIFFICULTY_MOMENTUM = "security.difficulty_momentum";
    public static final String FEE_ELASTICITY = "throughput.fee_elasticity";
    public static final String CAPACITY_GROWTH = "lightning.capacity_growth";
    public static final String SEGWIT_USAGE = "adoption.segwit_usage";

    private static final Duration FEE_PAIRING_GAP = Duration.ofHours(1);

    private final MeasurementStore measurementStore;

    public DerivedMetricCalculator(MeasurementStore measurementStore) {
        this.measurementStore = measurementStore;
    }

    /**
     * Pool HHI and top-3 share from the latest pool share snapshot.
     */
    public OptionalDouble recordPoolConcentration(Instant timestamp, List<PoolShare> pools) {
        List<Double> shares = pools.stream().map(PoolShare::share).toList();
        OptionalDouble hhi = ConcentrationMetrics.hhi(shares);
        if (hhi.isEmpty() || !Double.isFinite(hhi.getAsDouble())) {
            logger.warn("No usable pool share data for concentration metrics");
            return OptionalDouble.empty();
        }
        OptionalDouble top3 = ConcentrationMetrics.topShare(shares, 3);
        ingest(POOL_HHI, timestamp, hhi.getAsDouble(), null);
        top3.ifPresent(value -> ingest(POOL_TOP3, timestamp, value, null));
        logger.info("Calculated pool HHI: {}, top-3: {}", fmt(hhi.getAsDouble()), fmt(top3.orElse(Double.NaN)));
        return hhi;
    }

    public OptionalDouble recordNodeAsnConcentration(Instant timestamp, Collection<? extends Number> nodesPerAsn) {
        return record(NODE_ASN_HHI, timestamp, ConcentrationMetrics.hhi(nodesPerAsn), null);
    }

    public OptionalDouble recordClientEntropy(Instant timestamp, Collection<? extends Number> nodesPerClient) {
        return record(CLIENT_ENTROPY, timestamp, ConcentrationMetrics.normalizedEntropy(nodesPerClient), null);
    }

    public OptionalDouble recordFeeShare(Instant timestamp, double feesBtc, double subsidyBtc) {
        return record(FEE_SHARE, timestamp, NetworkFormulas.feeShare(feesBtc, subsidyBtc), null);
    }

    public OptionalDouble recordHashprice(Instant timestamp,
                                          double difficulty,
                                          double avgFeesPerBlockBtc,
                                          double subsidyBtc,
                                          double priceUsd) {
        if (difficulty <= 0) {
            logger.warn("No difficulty available for hashprice calculation");
            return OptionalDouble.empty();
        }
        double hashprice = NetworkFormulas.hashprice(difficulty, avgFeesPerBlockBtc, subsidyBtc, priceUsd);
        return record(HASHPRICE, timestamp, OptionalDouble.of(hashprice), "USD/TH/day");
    }

    public OptionalDouble recordDifficultyMomentum(Instant timestamp, double estimatedChangePercent) {
        return record(DIFFICULTY_MOMENTUM, timestamp,
                OptionalDouble.of(NetworkFormulas.difficultyMomentum(estimatedChangePercent)), null);
    }

    /**
     * Correlation between mempool size and fee rate, pairing samples at most an hour apart.
     */
    public OptionalDouble recordFeeElasticity(Instant timestamp, List<Measurement> mempoolSizes, List<Measurement> feeRates) {
        double[][] pairs = NetworkFormulas.pairNearest(mempoolSizes, feeRates, FEE_PAIRING_GAP);
        return record(FEE_ELASTICITY, timestamp, NetworkFormulas.pearson(pairs[0], pairs[1]), null);
    }

    public OptionalDouble recordCapacityGrowth(Instant timestamp, double currentCapacity, double previousCapacity) {
        return record(CAPACITY_GROWTH, timestamp, NetworkFormulas.growth(currentCapacity, previousCapacity), null);
    }

    public OptionalDouble recordSegwitUsage(Instant timestamp, long segwitTransactions, long totalTransactions) {
        return record(SEGWIT_USAGE, timestamp, NetworkFormulas.ratio(segwitTransactions, totalTransactions), null);
    }

    private OptionalDouble record(String metricId, Instant timestamp, OptionalDouble value, String unit) {
        if (value.isEmpty()) {
            logger.warn("Not enough input to calculate {}", metricId);
            return value;
        }
        if (!Double.isFinite(value.getAsDouble())) {
            logger.warn("Calculated {} is not finite, skipping", metricId);
            return OptionalDouble.empty();
        }
        ingest(metricId, timestamp, value.getAsDouble(), unit);
        logger.info("Calculated {}: {}", metricId, fmt(value.getAsDouble()));
        return value;
    }

    private void ingest(String metricId, Instant timestamp, double value, String unit) {
        measurementStore.upsertMeasurement(metricId, timestamp, value, unit);
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
