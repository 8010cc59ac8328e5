package me.golemcore.toolexec.adapter.outbound.registry;

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
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.SemanticVersion;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.VersionRange;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.ToolRegistryPort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Tool registry held in memory and seeded from JSON manifest files on the
 * classpath ({@code toolexec.registry.manifest-location}). Each file holds a
 * single manifest or an array of them.
 */
@Component
@Slf4j
public class InMemoryToolRegistryAdapter implements ToolRegistryPort {

    private final ToolExecProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, NavigableMap<SemanticVersion, ToolManifest>> tools = new ConcurrentHashMap<>();

    public InMemoryToolRegistryAdapter(ToolExecProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadManifests() {
        String location = properties.getRegistry().getManifestLocation();
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            log.warn("[Registry] Failed to scan {}: {}", location, e.getMessage());
            return;
        }
        for (Resource resource : resources) {
            try (InputStream is = resource.getInputStream()) {
                JsonNode root = objectMapper.readTree(is);
                List<JsonNode> nodes = new ArrayList<>();
                if (root.isArray()) {
                    root.forEach(nodes::add);
                } else {
                    nodes.add(root);
                }
                for (JsonNode node : nodes) {
                    publish(objectMapper.treeToValue(node, ToolManifest.class));
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[Registry] Failed to load manifests from {}: {}", resource.getFilename(), e.getMessage());
            }
        }
        log.info("[Registry] Loaded {} tools", tools.size());
    }

    @Override
    public Optional<ToolManifest> getVersion(String toolId, String version) {
        if (toolId == null || version == null || !SemanticVersion.isValid(version)) {
            return Optional.empty();
        }
        NavigableMap<SemanticVersion, ToolManifest> versions = tools.get(toolId);
        if (versions == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(versions.get(SemanticVersion.parse(version)));
    }

    @Override
    public Optional<String> resolveRange(String toolId, String versionRange) {
        NavigableMap<SemanticVersion, ToolManifest> versions = tools.get(toolId);
        if (versions == null) {
            return Optional.empty();
        }
        boolean anyVersion = versionRange == null || versionRange.isBlank();
        VersionRange range = VersionRange.parse(anyVersion ? "*" : versionRange);
        boolean allowPreRelease = !anyVersion && versionRange.contains("-");
        for (Map.Entry<SemanticVersion, ToolManifest> entry : versions.descendingMap().entrySet()) {
            SemanticVersion candidate = entry.getKey();
            if (candidate.isPreRelease() && !allowPreRelease) {
                continue;
            }
            if (entry.getValue().getLifecycleState().isInvocable() && range.matches(candidate)) {
                return Optional.of(entry.getValue().getVersion());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<ToolManifest> listLatest() {
        return tools.values().stream()
                .filter(versions -> !versions.isEmpty())
                .map(versions -> versions.lastEntry().getValue())
                .sorted(Comparator.comparing(ToolManifest::getToolId))
                .toList();
    }

    @Override
    public void publish(ToolManifest manifest) {
        if (manifest.getToolId() == null || manifest.getToolId().isBlank()) {
            throw new IllegalArgumentException("Manifest has no toolId");
        }
        SemanticVersion version = SemanticVersion.parse(manifest.getVersion());
        NavigableMap<SemanticVersion, ToolManifest> versions = tools.computeIfAbsent(manifest.getToolId(),
                id -> new ConcurrentSkipListMap<>());
        if (versions.putIfAbsent(version, manifest) != null) {
            throw new IllegalStateException("Tool " + manifest.coordinates() + " is already published");
        }
        log.debug("[Registry] Published {}", manifest.coordinates());
    }
}
