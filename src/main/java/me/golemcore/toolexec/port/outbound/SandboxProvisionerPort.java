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

import me.golemcore.toolexec.domain.model.Sandbox;
import me.golemcore.toolexec.domain.model.SandboxSpec;

/**
 * Creates isolated execution contexts nested inside a caller's boundary.
 */
public interface SandboxProvisionerPort {

    /**
     * @throws me.golemcore.toolexec.domain.exception.ToolExecutionException
     *             with {@code sandbox_provisioning_failed}
     */
    Sandbox provision(SandboxSpec spec);

    void teardown(Sandbox sandbox);
}
