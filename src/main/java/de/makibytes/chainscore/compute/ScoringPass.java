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
package de.makibytes.chainscore.compute;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import de.makibytes.chainscore.model.AbsenceReason;
import de.makibytes.chainscore.model.ScoreRecord;
import de.makibytes.chainscore.model.ScoreResult;

/**
 * Everything one {@code computeAll} pass produced: the per-level results, including the
 * absent ones, and the records that were persisted.
 */
public record ScoringPass(Instant timestamp,
                          Map<String, ScoreResult> metricScores,
                          Map<String, ScoreResult> pillarScores,
                          ScoreResult overallScore,
                          List<ScoreRecord> records) {

    public long presentMetricCount() {
        return metricScores.values().stream().filter(ScoreResult::isPresent).count();
    }

    public long presentPillarCount() {
        return pillarScores.values().stream().filter(ScoreResult::isPresent).count();
    }

    /**
     * Ids that produced no score, prefixed with their level, mapped to the reason.
     */
    public Map<String, AbsenceReason> omitted() {
        Map<String, AbsenceReason> omitted = new LinkedHashMap<>();
        metricScores.forEach((id, result) -> {
            if (!result.isPresent()) {
                omitted.put("metric:" + id, result.getReason());
            }
        });
        pillarScores.forEach((id, result) -> {
            if (!result.isPresent()) {
                omitted.put("pillar:" + id, result.getReason());
            }
        });
        if (!overallScore.isPresent()) {
            omitted.put("overall:" + ScoreEngine.OVERALL_ID, overallScore.getReason());
        }
        return omitted;
    }
}
