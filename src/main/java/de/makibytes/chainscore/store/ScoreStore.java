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

import de.makibytes.chainscore.model.ScoreKind;
import de.makibytes.chainscore.model.ScoreRecord;

/**
 * Append-only score time series. Storage failures surface as {@link StoreException} and
 * end the running recompute pass.
 */
public interface ScoreStore {

    /**
     * Inserts or replaces the record keyed by kind, id and timestamp.
     *
     * @throws StoreException if the storage fails
     */
    void upsertScore(ScoreRecord record);

    Optional<ScoreRecord> latestScore(ScoreKind kind, String id);

    /**
     * Records at or after {@code since}, oldest first.
     */
    List<ScoreRecord> scoresSince(ScoreKind kind, String id, Instant since);

    /**
     * Nearest record at or before {@code cutoff}.
     */
    Optional<ScoreRecord> scoreAtOrBefore(ScoreKind kind, String id, Instant cutoff);
}
