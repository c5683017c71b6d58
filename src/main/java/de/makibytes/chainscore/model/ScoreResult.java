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

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Outcome of scoring one metric, pillar or the overall index: either a value or the
 * reason it could not be computed. Absent results are excluded from aggregation, never
 * replaced by a default.
 */
public final class ScoreResult {

    private final Double value;
    private final AbsenceReason reason;
    private final String detail;

    private ScoreResult(Double value, AbsenceReason reason, String detail) {
        this.value = value;
        this.reason = reason;
        this.detail = detail;
    }

    public static ScoreResult present(double value) {
        return new ScoreResult(value, null, null);
    }

    public static ScoreResult absent(AbsenceReason reason, String detail) {
        return new ScoreResult(null, Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isPresent() {
        return value != null;
    }

    public double getValue() {
        if (value == null) {
            throw new NoSuchElementException("Score absent: " + reason + " (" + detail + ")");
        }
        return value;
    }

    public AbsenceReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreResult other)) {
            return false;
        }
        return Objects.equals(value, other.value) && reason == other.reason && Objects.equals(detail, other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason, detail);
    }

    @Override
    public String toString() {
        return isPresent() ? "Present(" + value + ")" : "Absent(" + reason + ": " + detail + ")";
    }
}
