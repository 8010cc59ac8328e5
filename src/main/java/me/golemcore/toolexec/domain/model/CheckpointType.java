package me.golemcore.toolexec.domain.model;

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

/**
 * Checkpoint tiers, in increasing durability.
 */
public enum CheckpointType {

    /** Periodic, best-effort, short retention. */
    MICRO(false),
    /** Milestone, durable, archived after the retention window. */
    MACRO(true),
    /** Tool-requested with a label, durable, retained indefinitely. */
    NAMED(true);

    private final boolean durable;

    CheckpointType(boolean durable) {
        this.durable = durable;
    }

    public boolean isDurable() {
        return durable;
    }
}
