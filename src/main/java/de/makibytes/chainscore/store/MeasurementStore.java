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
package de.makibytes.chainscore.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import de.makibytes.chainscore.model.Measurement;

/**
 * Raw readings per metric. Timestamps are keyed at whole-second resolution.
 *
 * <p>Implementations backed by external storage throw {@link StoreException} when the
 * storage itself fails; that ends the running recompute pass.</p>
 */
public interface MeasurementStore {

    /**
     * Inserts or replaces the measurement keyed by metric id and timestamp truncated to
     * seconds.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     * @throws StoreException if the storage fails
     */
    void upsertMeasurement(Measurement measurement);

    default void upsertMeasurement(String metricId, Instant timestamp, double value, String unit) {
        upsertMeasurement(new Measurement(metricId, timestamp, value, unit));
    }

    /**
     * Measurements at or after {@code since}, oldest first.
     */
    List<Measurement> measurementsSince(String metricId, Instant since);

    Optional<Measurement> latestMeasurement(String metricId);

    /**
     * Newest measurement whose timestamp is not after {@code asOf}.
     */
    Optional<Measurement> latestMeasurementAtOrBefore(String metricId, Instant asOf);

    Set<String> metricIds();
}
