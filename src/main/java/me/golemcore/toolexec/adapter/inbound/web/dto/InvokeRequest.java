package me.golemcore.toolexec.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.toolexec.domain.model.CheckpointConfig;
import me.golemcore.toolexec.domain.model.ExecutionOptions;
import me.golemcore.toolexec.domain.model.ResourceLimits;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvokeRequest {
    private String invocationId;
    private String toolId;
    private String toolVersion;
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private ResourceLimits resourceLimits;
    private CheckpointConfig checkpointConfig;
    private ExecutionOptions executionOptions;
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
}
