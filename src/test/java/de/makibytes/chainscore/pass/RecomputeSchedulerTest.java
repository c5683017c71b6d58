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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.chainscore.store.StoreException;

@DisplayName("RecomputeScheduler Tests")
class RecomputeSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static PassSummary emptySummary(Instant now) {
        return new PassSummary(now, 0, 0, 0, null, Map.of(), Duration.ZERO);
    }

    @Test
    @DisplayName("triggerPass runs the pass and reports success")
    void triggerPass_Success() {
        AtomicInteger runs = new AtomicInteger();
        RecomputeScheduler scheduler = new RecomputeScheduler(new RecomputeService(null, null) {
            @Override
            public PassSummary runPass(Instant now) {
                runs.incrementAndGet();
                return emptySummary(now);
            }
        });

        assertTrue(scheduler.triggerPass(NOW));
        assertTrue(scheduler.triggerPass(NOW.plusSeconds(3600)));
        assertEquals(2, runs.get());
        assertFalse(scheduler.isPassRunning());
    }

    @Test
    @DisplayName("store failure aborts the pass and releases the lock")
    void triggerPass_StoreFailure() {
        AtomicInteger runs = new AtomicInteger();
        RecomputeScheduler scheduler = new RecomputeScheduler(new RecomputeService(null, null) {
            @Override
            public PassSummary runPass(Instant now) {
                if (runs.incrementAndGet() == 1) {
                    throw new StoreException("disk full");
                }
                return emptySummary(now);
            }
        });

        assertFalse(scheduler.triggerPass(NOW));
        assertFalse(scheduler.isPassRunning());
        assertTrue(scheduler.triggerPass(NOW.plusSeconds(3600)));
    }

    @Test
    @DisplayName("other failures propagate and still release the lock")
    void triggerPass_UnexpectedFailure() {
        RecomputeScheduler scheduler = new RecomputeScheduler(new RecomputeService(null, null) {
            @Override
            public PassSummary runPass(Instant now) {
                throw new IllegalStateException("boom");
            }
        });

        assertThrows(IllegalStateException.class, () -> scheduler.triggerPass(NOW));
        assertFalse(scheduler.isPassRunning());
    }

    @Test
    @DisplayName("a trigger while a pass is running is skipped")
    void triggerPass_SkipsWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        RecomputeScheduler scheduler = new RecomputeScheduler(new RecomputeService(null, null) {
            @Override
            public PassSummary runPass(Instant now) {
                runs.incrementAndGet();
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return emptySummary(now);
            }
        });

        Future<Boolean> first = executor.submit(() -> scheduler.triggerPass(NOW));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.isPassRunning());
        assertFalse(scheduler.triggerPass(NOW.plusSeconds(1)));

        release.countDown();
        assertTrue(first.get(5, TimeUnit.SECONDS));
        assertEquals(1, runs.get());
        assertFalse(scheduler.isPassRunning());
    }
}
