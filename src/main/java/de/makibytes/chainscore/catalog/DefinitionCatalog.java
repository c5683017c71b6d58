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
package de.makibytes.chainscore.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import de.makibytes.chainscore.model.MetricDefinition;
import de.makibytes.chainscore.model.PillarDefinition;

/**
 * Immutable set of metric and pillar definitions. Built once and handed to the normalizer
 * and score engine; iteration follows declaration order.
 */
public final class DefinitionCatalog {

    private final Map<String, PillarDefinition> pillars;
    private final Map<String, MetricDefinition> metrics;
    private final Map<String, List<MetricDefinition>> metricsByPillar;

    private DefinitionCatalog(Map<String, PillarDefinition> pillars, Map<String, MetricDefinition> metrics) {
        this.pillars = Collections.unmodifiableMap(pillars);
        this.metrics = Collections.unmodifiableMap(metrics);
        Map<String, List<MetricDefinition>> grouped = new LinkedHashMap<>();
        for (MetricDefinition metric : metrics.values()) {
            grouped.computeIfAbsent(metric.getPillarId(), key -> new ArrayList<>()).add(metric);
        }
        grouped.replaceAll((pillarId, list) -> List.copyOf(list));
        this.metricsByPillar = Collections.unmodifiableMap(grouped);
    }

    /**
     * Builds a catalog without running loader validation. Duplicate ids keep the last entry.
     */
    public static DefinitionCatalog of(Collection<PillarDefinition> pillars, Collection<MetricDefinition> metrics) {
        Map<String, PillarDefinition> pillarMap = new LinkedHashMap<>();
        pillars.forEach(pillar -> pillarMap.put(pillar.pillarId(), pillar));
        Map<String, MetricDefinition> metricMap = new LinkedHashMap<>();
        metrics.forEach(metric -> metricMap.put(metric.getMetricId(), metric));
        return new DefinitionCatalog(pillarMap, metricMap);
    }

    public Optional<MetricDefinition> metric(String metricId) {
        return Optional.ofNullable(metrics.get(metricId));
    }

    public Optional<PillarDefinition> pillar(String pillarId) {
        return Optional.ofNullable(pillars.get(pillarId));
    }

    public Collection<MetricDefinition> metrics() {
        return metrics.values();
    }

    public Collection<PillarDefinition> pillars() {
        return pillars.values();
    }

    public List<MetricDefinition> metricsForPillar(String pillarId) {
        return metricsByPillar.getOrDefault(pillarId, List.of());
    }

    @Override
    public String toString() {
        return "DefinitionCatalog{pillars=" + pillars.size() + ", metrics=" + metrics.size() + "}";
    }
}
