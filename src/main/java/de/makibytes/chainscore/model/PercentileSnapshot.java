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
package de.makibytes.chainscore.model;

import java.time.Instant;

/**
 * Distribution estimate of one metric over a rolling window. {@code windowDays} is the
 * window that actually produced the sample, which is the fallback window when the primary
 * one held too few points.
 */
public record PercentileSnapshot(String metricId,
                                 int windowDays,
                                 Instant timestamp,
                                 double p10,
                                 double p25,
                                 double p50,
                                 double p75,
                                 double p90,
                                 double min,
                                 double max) {

    /**
     * Breakpoint values in ascending rank order: min, p10, p25, p50, p75, p90, max.
     */
    public double[] breakpoints() {
        return new double[] { min, p10, p25, p50, p75, p90, max };
    }
}
