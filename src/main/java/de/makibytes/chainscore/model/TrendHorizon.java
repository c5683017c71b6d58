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

import java.time.Duration;
import java.util.Locale;

public enum TrendHorizon {
    DAYS_7("7d", 7),
    DAYS_30("30d", 30);

    private final String key;
    private final int days;

    TrendHorizon(String key, int days) {
        this.key = key;
        this.days = days;
    }

    public String getKey() {
        return key;
    }

    public int getDays() {
        return days;
    }

    public Duration getDuration() {
        return Duration.ofDays(days);
    }

    public static TrendHorizon fromKey(String key) {
        if (key == null) {
            return DAYS_7;
        }
        String normalized = key.toLowerCase(Locale.ROOT).trim();
        for (TrendHorizon horizon : values()) {
            if (horizon.key.equals(normalized)) {
                return horizon;
            }
        }
        return DAYS_7;
    }
}
