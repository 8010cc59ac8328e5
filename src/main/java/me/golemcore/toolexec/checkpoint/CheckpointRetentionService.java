package me.golemcore.toolexec.checkpoint;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic checkpoint retention, off the invocation path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointRetentionService {

    private final CheckpointManager checkpointManager;
    private final ToolExecProperties properties;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void start() {
        long intervalMs = properties.getCheckpoint().getRetentionSweepInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "checkpoint-retention");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Checkpoint] Retention sweep every {} ms", intervalMs);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    void sweep() {
        try {
            checkpointManager.purgeExpired();
        } catch (RuntimeException e) {
            log.warn("[Checkpoint] Retention sweep failed: {}", e.getMessage());
        }
    }
}
