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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Protocol-specific part of a manifest. The common validated core (id,
 * version, permissions, schemas, limits) lives on {@link ToolManifest}; each
 * binding only carries what its protocol needs to reach the tool.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProtocolBinding.NativeBinding.class, name = "native"),
        @JsonSubTypes.Type(value = ProtocolBinding.McpBinding.class, name = "mcp"),
        @JsonSubTypes.Type(value = ProtocolBinding.OpenApiBinding.class, name = "openapi")
})
public sealed interface ProtocolBinding
        permits ProtocolBinding.NativeBinding, ProtocolBinding.McpBinding, ProtocolBinding.OpenApiBinding {

    ProtocolKind protocol();

    /**
     * In-process handler registered under {@code handler}.
     */
    record NativeBinding(String handler) implements ProtocolBinding {
        @Override
        public ProtocolKind protocol() {
            return ProtocolKind.NATIVE;
        }
    }

    /**
     * MCP server started with {@code command}; {@code remoteTool} is the name the
     * server exposes through {@code tools/list}.
     */
    record McpBinding(String command, String remoteTool, Map<String, String> env,
            int startupTimeoutSeconds) implements ProtocolBinding {
        @Override
        public ProtocolKind protocol() {
            return ProtocolKind.MCP;
        }
    }

    /**
     * Single HTTP operation described by an OpenAPI document.
     */
    record OpenApiBinding(String baseUrl, String method, String path,
            Map<String, String> headers) implements ProtocolBinding {
        @Override
        public ProtocolKind protocol() {
            return ProtocolKind.OPENAPI;
        }
    }
}
