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
 * Change notification from the bridge peer's side. Write-type changes
 * invalidate cached reads of the same key.
 */
public record BridgeChangeEvent(String key, ChangeType type) {

    public enum ChangeType {
        CREATED, UPDATED, DELETED, READ
    }

    public boolean isWrite() {
        return type != ChangeType.READ;
    }
}
