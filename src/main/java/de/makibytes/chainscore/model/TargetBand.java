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

/**
 * Acceptable value range of a target-band metric, {@code min < max}.
 */
public record TargetBand(double min, double max) {

    public TargetBand {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min >= max) {
            throw new IllegalArgumentException("Target band requires finite min < max, got [" + min + ", " + max + "]");
        }
    }

    public double center() {
        return (min + max) / 2;
    }

    public double halfRange() {
        return (max - min) / 2;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
