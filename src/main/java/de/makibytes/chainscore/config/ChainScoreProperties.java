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
package de.makibytes.chainscore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chainscore")
public class ChainScoreProperties {

    private Normalization normalization = new Normalization();
    private Catalog catalog = new Catalog();
    private Persistence persistence = new Persistence();
    private Schedule schedule = new Schedule();

    public Normalization getNormalization() {
        return normalization;
    }

    public void setNormalization(Normalization normalization) {
        this.normalization = normalization;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public static class Normalization {
        private int primaryWindowDays = 365;
        private int fallbackWindowDays = 90;
        private int minPointsPrimary = 30;
        private int minPointsFallback = 10;

        public int getPrimaryWindowDays() {
            return primaryWindowDays;
        }

        public void setPrimaryWindowDays(int primaryWindowDays) {
            this.primaryWindowDays = primaryWindowDays;
        }

        public int getFallbackWindowDays() {
            return fallbackWindowDays;
        }

        public void setFallbackWindowDays(int fallbackWindowDays) {
            this.fallbackWindowDays = fallbackWindowDays;
        }

        public int getMinPointsPrimary() {
            return minPointsPrimary;
        }

        public void setMinPointsPrimary(int minPointsPrimary) {
            this.minPointsPrimary = minPointsPrimary;
        }

        public int getMinPointsFallback() {
            return minPointsFallback;
        }

        public void setMinPointsFallback(int minPointsFallback) {
            this.minPointsFallback = minPointsFallback;
        }
    }

    public static class Catalog {
        private String location = "classpath:definitions.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Persistence {
        private boolean enabled = false;
        private String file = "./chainscore-snapshot.json";
        private long flushIntervalSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public long getFlushIntervalSeconds() {
            return flushIntervalSeconds;
        }

        public void setFlushIntervalSeconds(long flushIntervalSeconds) {
            this.flushIntervalSeconds = flushIntervalSeconds;
        }
    }

    public static class Schedule {
        private boolean enabled = true;
        private long intervalMs = 3_600_000;
        private long initialDelayMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
    }
}
