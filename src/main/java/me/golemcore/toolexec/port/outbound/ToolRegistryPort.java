package me.golemcore.toolexec.port.outbound;

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

import me.golemcore.toolexec.domain.model.ToolManifest;

import java.util.List;
import java.util.Optional;

/**
 * Read access to published tool manifests.
 */
public interface ToolRegistryPort {

    /**
     * Exact manifest lookup.
     */
    Optional<ToolManifest> getVersion(String toolId, String version);

    /**
     * Highest published version of {@code toolId} matching {@code versionRange}.
     * Pre-release versions are considered only when the range names one. A
     * null or blank range matches every version.
     *
     * @throws IllegalArgumentException
     *             if the range is malformed
     */
    Optional<String> resolveRange(String toolId, String versionRange);

    /**
     * Latest version of every tool, for listing.
     */
    List<ToolManifest> listLatest();

    /**
     * Publish a new manifest version.
     *
     * @throws IllegalStateException
     *             if this tool version already exists
     */
    void publish(ToolManifest manifest);
}
