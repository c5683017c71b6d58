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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.chainscore.model.Direction;
import de.makibytes.chainscore.model.MetricDefinition;
import de.makibytes.chainscore.model.PillarDefinition;
import de.makibytes.chainscore.model.TargetBand;

/**
 * Reads the JSON definition catalog and validates it. All violations are collected and
 * reported in a single {@link CatalogException}.
 */
@Component
public class DefinitionCatalogLoader {
    private static final Logger logger = LoggerFactory.getLogger(DefinitionCatalogLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public DefinitionCatalogLoader() {
        this(new DefaultResourceLoader());
    }

    @Autowired
    public DefinitionCatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    public DefinitionCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogException("Definition catalog not found: " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            DefinitionCatalog catalog = read(in);
            logger.info("Loaded definition catalog from {}: {} pillars, {} metrics",
                    location, catalog.pillars().size(), catalog.metrics().size());
            return catalog;
        } catch (IOException ex) {
            throw new CatalogException("Failed to read definition catalog " + location + ": " + ex.getMessage(), ex);
        }
    }

    public DefinitionCatalog read(InputStream in) throws IOException {
        CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
        return toCatalog(document);
    }

    private DefinitionCatalog toCatalog(CatalogDocument document) {
        List<String> violations = new ArrayList<>();
        List<PillarDefinition> pillars = new ArrayList<>();
        List<MetricDefinition> metrics = new ArrayList<>();
        Set<String> pillarIds = new HashSet<>();
        Set<String> metricIds = new HashSet<>();

        List<PillarEntry> pillarEntries = document.pillars() == null ? List.of() : document.pillars();
        for (PillarEntry entry : pillarEntries) {
            if (isBlank(entry.pillarId())) {
                violations.add("pillar without pillarId");
                continue;
            }
            if (!pillarIds.add(entry.pillarId())) {
                violations.add("duplicate pillar " + entry.pillarId());
                continue;
            }
            double weight;
            if (entry.weight() == null) {
                logger.warn("Pillar {} has no weight; it will not contribute to the overall score", entry.pillarId());
                weight = 0.0;
            } else {
                weight = entry.weight();
            }
            if (weight < 0) {
                violations.add("pillar " + entry.pillarId() + " has negative weight " + weight);
            }
            String name = isBlank(entry.name()) ? entry.pillarId() : entry.name();
            pillars.add(new PillarDefinition(entry.pillarId(), name, weight, entry.description()));
        }

        List<MetricEntry> metricEntries = document.metrics() == null ? List.of() : document.metrics();
        for (MetricEntry entry : metricEntries) {
            if (isBlank(entry.metricId())) {
                violations.add("metric without metricId");
                continue;
            }
            String id = entry.metricId();
            if (!metricIds.add(id)) {
                violations.add("duplicate metric " + id);
                continue;
            }
            if (isBlank(entry.pillarId()) || !pillarIds.contains(entry.pillarId())) {
                violations.add("metric " + id + " references unknown pillar " + entry.pillarId());
            }
            Direction direction = null;
            try {
                direction = Direction.fromKey(entry.direction());
            } catch (IllegalArgumentException ex) {
                violations.add("metric " + id + ": " + ex.getMessage());
            }
            if (direction == null) {
                if (entry.direction() == null) {
                    violations.add("metric " + id + " has no direction");
                }
                continue;
            }
            if (entry.weight() != null && entry.weight() < 0) {
                violations.add("metric " + id + " has negative weight " + entry.weight());
            }
            TargetBand band = null;
            if (direction == Direction.TARGET_BAND) {
                if (entry.targetMin() == null || entry.targetMax() == null) {
                    violations.add("target_band metric " + id + " requires targetMin and targetMax");
                } else if (entry.targetMin() >= entry.targetMax()) {
                    violations.add("target_band metric " + id + " requires targetMin < targetMax");
                } else {
                    band = new TargetBand(entry.targetMin(), entry.targetMax());
                }
            } else if (entry.targetMin() != null || entry.targetMax() != null) {
                logger.warn("Ignoring target bounds on {} metric {}", direction.getKey(), id);
            }
            String name = isBlank(entry.name()) ? id : entry.name();
            metrics.add(new MetricDefinition(id, entry.pillarId(), name, direction, entry.weight(), band,
                    entry.description()));
        }

        if (!violations.isEmpty()) {
            throw new CatalogException(violations);
        }
        return DefinitionCatalog.of(pillars, metrics);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CatalogDocument(List<PillarEntry> pillars, List<MetricEntry> metrics) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PillarEntry(String pillarId, String name, Double weight, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MetricEntry(String metricId,
                               String pillarId,
                               String name,
                               String direction,
                               Double targetMin,
                               Double targetMax,
                               Double weight,
                               String description) {
    }
}
