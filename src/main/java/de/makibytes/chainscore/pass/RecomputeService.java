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
package de.makibytes.chainscore.pass;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.chainscore.compute.Normalizer;
import de.makibytes.chainscore.compute.ScoreEngine;
import de.makibytes.chainscore.compute.ScoringPass;

/**
 * Runs one recompute pass: refresh percentile snapshots, then score everything. Callers
 * must not run passes concurrently; {@link RecomputeScheduler} enforces that.
 */
@Service
public class RecomputeService {
    private static final Logger logger = LoggerFactory.getLogger(RecomputeService.class);

    private final Normalizer normalizer;
    private final ScoreEngine scoreEngine;
    private volatile PassSummary lastSummary;

    public RecomputeService(Normalizer normalizer, ScoreEngine scoreEngine) {
        this.normalizer = normalizer;
        this.scoreEngine = scoreEngine;
    }

    /**
     * @throws de.makibytes.chainscore.store.StoreException if the persistence layer fails
     */
    public PassSummary runPass(Instant now) {
        long startNanos = System.nanoTime();
        int refreshed = normalizer.normalizeAll(now);
        ScoringPass pass = scoreEngine.computeAll(now);
        PassSummary summary = new PassSummary(
                pass.timestamp(),
                refreshed,
                pass.presentMetricCount(),
                pass.presentPillarCount(),
                pass.overallScore().isPresent() ? pass.overallScore().getValue() : null,
                pass.omitted(),
                Duration.ofNanos(System.nanoTime() - startNanos));
        lastSummary = summary;
        logger.info("Recompute pass at {} finished in {} ms: {} snapshots, {} metric scores, {} pillar scores, {} omitted",
                summary.timestamp(), summary.elapsed().toMillis(), refreshed, summary.metricScores(),
                summary.pillarScores(), summary.omitted().size());
        return summary;
    }

    public Optional<PassSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }
}
