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

public enum AbsenceReason {
    /** No measurement has been ingested for the metric. */
    NO_MEASUREMENT,
    /** Too few historical points to estimate a distribution. */
    INSUFFICIENT_DATA,
    /** Rank requested but no percentile snapshot exists at any window. */
    NO_DISTRIBUTION,
    /** Score requested for an id that the catalog does not define. */
    MISSING_DEFINITION,
    /** Every input of a weighted aggregate was absent or weightless. */
    ZERO_WEIGHT
}
