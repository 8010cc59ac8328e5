package me.golemcore.toolexec.adapter.outbound.bridge;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.BridgeDirectReadPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Degraded read straight from the bridge peer's durable document store, a
 * directory of JSON files laid out as {@code <id>.json} or
 * {@code <id>@<version>.json}.
 */
@Component
@Slf4j
public class FileSystemDirectReadAdapter implements BridgeDirectReadPort {

    private static final Set<String> SUPPORTED = Set.of("document.get");

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileSystemDirectReadAdapter(ToolExecProperties properties, ObjectMapper objectMapper) {
        String configured = properties.getBridge().getDirectReadPath();
        this.root = configured != null && !configured.isBlank() ? Paths.get(configured).toAbsolutePath() : null;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean supports(String method) {
        return root != null && SUPPORTED.contains(method);
    }

    @Override
    public Optional<JsonNode> read(String method, Map<String, Object> params) {
        if (!supports(method) || params == null || params.get("id") == null) {
            return Optional.empty();
        }
        String fileName = String.valueOf(params.get("id"));
        Object version = params.get("version");
        if (version != null) {
            fileName = fileName + "@" + version;
        }
        Path file = root.resolve(fileName + ".json").normalize();
        if (!file.startsWith(root)) {
            log.warn("[Bridge] Direct read outside store rejected: {}", fileName);
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("Direct read of " + fileName + " failed: " + e.getMessage(), e);
        }
    }
}
