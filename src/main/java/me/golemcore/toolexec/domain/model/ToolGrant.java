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
 * One entry of a capability credential's grant list: a tool and the version
 * range the holder may invoke.
 */
public record ToolGrant(String toolId, String versionRange) {

    public boolean covers(String candidateToolId, String version) {
        if (toolId == null || !toolId.equals(candidateToolId)) {
            return false;
        }
        String range = versionRange == null || versionRange.isBlank() ? "*" : versionRange;
        try {
            return VersionRange.parse(range).matches(version);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
