package me.golemcore.toolexec.domain.component;

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

import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;

/**
 * Runs a tool reached through one protocol family. The orchestrator picks the
 * handler by the manifest's binding.
 *
 * <p>
 * {@link #execute} runs on a worker thread and may block; it must return
 * promptly when the thread is interrupted or
 * {@link ToolExecutionContext#isCancelled()} turns true.
 */
public interface ToolHandler {

    ProtocolKind getProtocol();

    /**
     * @return the tool's output or a failure it chose to report; a thrown
     *         exception is treated as a tool crash
     */
    ToolResult execute(ToolManifest manifest, ToolExecutionContext context) throws Exception;
}
