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
import java.util.Map;

import de.makibytes.chainscore.model.AbsenceReason;

/**
 * Outcome of one normalization plus scoring pass. {@code overallScore} is null when the
 * overall score could not be computed.
 */
public record PassSummary(Instant timestamp,
                          int snapshotsRefreshed,
                          long metricScores,
                          long pillarScores,
                          Double overallScore,
                          Map<String, AbsenceReason> omitted,
                          Duration elapsed) {
}
