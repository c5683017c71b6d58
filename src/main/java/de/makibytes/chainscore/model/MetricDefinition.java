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

import java.util.Optional;

public class MetricDefinition {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final String metricId;
    private final String pillarId;
    private final String name;
    private final Direction direction;
    private final Double weight;
    private final TargetBand targetBand;
    private final String description;

    public MetricDefinition(String metricId,
                            String pillarId,
                            String name,
                            Direction direction,
                            Double weight,
                            TargetBand targetBand,
                            String description) {
        this.metricId = metricId;
        this.pillarId = pillarId;
        this.name = name;
        this.direction = direction;
        this.weight = weight;
        this.targetBand = targetBand;
        this.description = description;
    }

    public static MetricDefinition ranked(String metricId, String pillarId, Direction direction, Double weight) {
        return new MetricDefinition(metricId, pillarId, metricId, direction, weight, null, null);
    }

    public static MetricDefinition band(String metricId, String pillarId, double min, double max, Double weight) {
        return new MetricDefinition(metricId, pillarId, metricId, Direction.TARGET_BAND, weight,
                new TargetBand(min, max), null);
    }

    public String getMetricId() {
        return metricId;
    }

    public String getPillarId() {
        return pillarId;
    }

    public String getName() {
        return name;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Weight within the pillar; an unset weight counts as {@value #DEFAULT_WEIGHT}.
     */
    public double getWeight() {
        return weight == null ? DEFAULT_WEIGHT : weight;
    }

    public boolean isWeightSet() {
        return weight != null;
    }

    public Optional<TargetBand> getTargetBand() {
        return Optional.ofNullable(targetBand);
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "MetricDefinition{" + metricId + ", pillar=" + pillarId + ", " + direction.getKey() + "}";
    }
}
