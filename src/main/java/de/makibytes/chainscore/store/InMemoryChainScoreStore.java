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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.chainscore.config.ChainScoreProperties;
import de.makibytes.chainscore.model.Measurement;
import de.makibytes.chainscore.model.PercentileSnapshot;
import de.makibytes.chainscore.model.ScoreKind;
import de.makibytes.chainscore.model.ScoreRecord;

/**
 * Measurement, percentile and score series kept in sorted concurrent maps, optionally
 * mirrored to a JSON file. Every percentile snapshot is retained; lookups return the
 * most recent one per metric and window.
 */
@Component
public class InMemoryChainScoreStore implements MeasurementStore, PercentileStore, ScoreStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryChainScoreStore.class);

    private final Map<String, NavigableMap<Instant, Measurement>> measurementsByMetric = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Instant, PercentileSnapshot>> snapshotsByWindow = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Instant, ScoreRecord>> scoresBySeries = new ConcurrentHashMap<>();
    private final boolean persistenceEnabled;
    private final Path persistenceFile;
    private final Duration flushInterval;
    private final ObjectMapper objectMapper;
    private volatile Instant lastFlush = Instant.EPOCH;

    public InMemoryChainScoreStore() {
        this(defaultProperties());
    }

    @Autowired
    public InMemoryChainScoreStore(ChainScoreProperties properties) {
        ChainScoreProperties.Persistence persistence = properties.getPersistence();
        this.persistenceEnabled = persistence.isEnabled();
        this.persistenceFile = Path.of(persistence.getFile());
        this.flushInterval = Duration.ofSeconds(Math.max(5, persistence.getFlushIntervalSeconds()));
        this.objectMapper = new ObjectMapper().findAndRegisterModules();
        if (persistenceEnabled) {
            loadSnapshot();
        }
    }

    private static ChainScoreProperties defaultProperties() {
        ChainScoreProperties props = new ChainScoreProperties();
        props.getPersistence().setEnabled(false);
        return props;
    }

    @Override
    public void upsertMeasurement(Measurement measurement) {
        if (!Double.isFinite(measurement.value())) {
            throw new IllegalArgumentException("Non-finite value " + measurement.value()
                    + " for metric " + measurement.metricId() + " at " + measurement.timestamp());
        }
        Instant timestamp = measurement.timestamp().truncatedTo(ChronoUnit.SECONDS);
        Measurement keyed = timestamp.equals(measurement.timestamp())
                ? measurement
                : new Measurement(measurement.metricId(), timestamp, measurement.value(), measurement.unit());
        measurementsByMetric
                .computeIfAbsent(keyed.metricId(), key -> new ConcurrentSkipListMap<>())
                .put(timestamp, keyed);
    }

    @Override
    public List<Measurement> measurementsSince(String metricId, Instant since) {
        NavigableMap<Instant, Measurement> series = measurementsByMetric.get(metricId);
        if (series == null || series.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(series.tailMap(since, true).values());
    }

    @Override
    public Optional<Measurement> latestMeasurement(String metricId) {
        return lastValue(measurementsByMetric.get(metricId));
    }

    @Override
    public Optional<Measurement> latestMeasurementAtOrBefore(String metricId, Instant asOf) {
        NavigableMap<Instant, Measurement> series = measurementsByMetric.get(metricId);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, Measurement> entry = series.floorEntry(asOf);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public Set<String> metricIds() {
        Set<String> ids = new TreeSet<>();
        measurementsByMetric.forEach((id, series) -> {
            if (!series.isEmpty()) {
                ids.add(id);
            }
        });
        return ids;
    }

    @Override
    public void upsertSnapshot(PercentileSnapshot snapshot) {
        snapshotsByWindow
                .computeIfAbsent(windowKey(snapshot.metricId(), snapshot.windowDays()), key -> new ConcurrentSkipListMap<>())
                .put(snapshot.timestamp(), snapshot);
    }

    @Override
    public Optional<PercentileSnapshot> latestSnapshot(String metricId, int windowDays) {
        return lastValue(snapshotsByWindow.get(windowKey(metricId, windowDays)));
    }

    @Override
    public void upsertScore(ScoreRecord record) {
        scoresBySeries
                .computeIfAbsent(seriesKey(record.kind(), record.id()), key -> new ConcurrentSkipListMap<>())
                .put(record.timestamp(), record);
    }

    @Override
    public Optional<ScoreRecord> latestScore(ScoreKind kind, String id) {
        return lastValue(scoresBySeries.get(seriesKey(kind, id)));
    }

    @Override
    public List<ScoreRecord> scoresSince(ScoreKind kind, String id, Instant since) {
        NavigableMap<Instant, ScoreRecord> series = scoresBySeries.get(seriesKey(kind, id));
        if (series == null || series.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(series.tailMap(since, true).values());
    }

    @Override
    public Optional<ScoreRecord> scoreAtOrBefore(ScoreKind kind, String id, Instant cutoff) {
        NavigableMap<Instant, ScoreRecord> series = scoresBySeries.get(seriesKey(kind, id));
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, ScoreRecord> entry = series.floorEntry(cutoff);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Scheduled(fixedDelay = 5000)
    public void flushIfNeeded() {
        if (!persistenceEnabled) {
            return;
        }
        Instant now = Instant.now();
        if (lastFlush.plus(flushInterval).isAfter(now)) {
            return;
        }
        writeSnapshot();
        lastFlush = now;
    }

    private void loadSnapshot() {
        try {
            if (!Files.exists(persistenceFile)) {
                return;
            }
            byte[] data = Files.readAllBytes(persistenceFile);
            Snapshot snapshot = objectMapper.readValue(data, Snapshot.class);
            if (snapshot.measurements() != null) {
                snapshot.measurements().forEach(this::upsertMeasurement);
            }
            if (snapshot.percentiles() != null) {
                snapshot.percentiles().forEach(this::upsertSnapshot);
            }
            if (snapshot.scores() != null) {
                snapshot.scores().forEach(this::upsertScore);
            }
            logger.info("Loaded persistence snapshot {}: {} metrics, {} score series",
                    persistenceFile, measurementsByMetric.size(), scoresBySeries.size());
        } catch (IOException ex) {
            logger.warn("Failed to load persistence snapshot: {}", ex.getMessage());
        }
    }

    void writeSnapshot() {
        try {
            Snapshot snapshot = new Snapshot(
                    flatten(measurementsByMetric),
                    flatten(snapshotsByWindow),
                    flatten(scoresBySeries));
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
            if (persistenceFile.getParent() != null) {
                Files.createDirectories(persistenceFile.getParent());
            }
            Files.writeString(persistenceFile, new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            logger.warn("Failed to write persistence snapshot: {}", ex.getMessage());
        }
    }

    private static <T> List<T> flatten(Map<String, NavigableMap<Instant, T>> source) {
        List<T> copy = new ArrayList<>();
        source.values().forEach(series -> copy.addAll(series.values()));
        return copy;
    }

    private static <T> Optional<T> lastValue(NavigableMap<Instant, T> series) {
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<Instant, T> entry = series.lastEntry();
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    private static String windowKey(String metricId, int windowDays) {
        return metricId + "@" + windowDays;
    }

    private static String seriesKey(ScoreKind kind, String id) {
        return kind.getKey() + ":" + id;
    }

    private record Snapshot(List<Measurement> measurements,
                            List<PercentileSnapshot> percentiles,
                            List<ScoreRecord> scores) {
    }
}
