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

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.chainscore.store.StoreException;

/**
 * Triggers recompute passes on a fixed delay, at most one in flight. A store failure ends
 * the pass; the next tick retries.
 */
@Component
@ConditionalOnProperty(prefix = "chainscore.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecomputeScheduler {
    private static final Logger logger = LoggerFactory.getLogger(RecomputeScheduler.class);

    private final RecomputeService recomputeService;
    private final ReentrantLock passLock = new ReentrantLock();

    public RecomputeScheduler(RecomputeService recomputeService) {
        this.recomputeService = recomputeService;
    }

    @Scheduled(fixedDelayString = "${chainscore.schedule.interval-ms:3600000}",
            initialDelayString = "${chainscore.schedule.initial-delay-ms:60000}")
    public void scheduledPass() {
        triggerPass(Instant.now());
    }

    /**
     * @return true if a pass ran to completion
     */
    public boolean triggerPass(Instant now) {
        if (!passLock.tryLock()) {
            logger.info("Recompute pass already running, skipping trigger at {}", now);
            return false;
        }
        try {
            recomputeService.runPass(now);
            return true;
        } catch (StoreException ex) {
            logger.error("Recompute pass aborted by store failure: {}", ex.getMessage(), ex);
            return false;
        } finally {
            passLock.unlock();
        }
    }

    boolean isPassRunning() {
        return passLock.isLocked();
    }
}
