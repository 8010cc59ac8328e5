package me.golemcore.toolexec.adapter.outbound.sandbox;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.Sandbox;
import me.golemcore.toolexec.domain.model.SandboxSpec;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.SandboxProvisionerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Provisions a working directory per invocation under
 * {@code <storage>/sandboxes}, nested inside the parent sandbox's directory
 * when the caller runs in one. Isolation beyond the file tree is left to the
 * host.
 */
@Component
@Slf4j
public class WorkspaceSandboxProvisioner implements SandboxProvisionerPort {

    static final String DIRECTORY = "sandboxes";

    private final Path root;

    public WorkspaceSandboxProvisioner(ToolExecProperties properties) {
        String basePath = properties.getStorage().getBasePath();
        this.root = Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize().resolve(DIRECTORY);
    }

    @Override
    public Sandbox provision(SandboxSpec spec) {
        String sandboxId = "sbx-" + UUID.randomUUID();
        Path parent = root;
        if (spec.getParentSandboxId() != null) {
            Path candidate = root.resolve(spec.getParentSandboxId()).normalize();
            if (!candidate.startsWith(root)) {
                throw new ToolExecutionException(ErrorCode.SANDBOX_PROVISIONING_FAILED,
                        "Invalid parent sandbox " + spec.getParentSandboxId());
            }
            parent = candidate;
        }
        Path workingDirectory = parent.resolve(sandboxId);
        try {
            Files.createDirectories(workingDirectory);
        } catch (IOException e) {
            throw new ToolExecutionException(ErrorCode.SANDBOX_PROVISIONING_FAILED,
                    "Failed to create sandbox for " + spec.getInvocationId() + ": " + e.getMessage(), e);
        }
        log.debug("Provisioned sandbox {} for {} at {}", sandboxId, spec.getInvocationId(), workingDirectory);
        return Sandbox.builder()
                .sandboxId(sandboxId)
                .parentSandboxId(spec.getParentSandboxId())
                .workingDirectory(workingDirectory)
                .limits(spec.getLimits())
                .build();
    }

    @Override
    public void teardown(Sandbox sandbox) {
        Path directory = sandbox.getWorkingDirectory();
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            log.debug("Tore down sandbox {}", sandbox.getSandboxId());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to tear down sandbox {}: {}", sandbox.getSandboxId(), e.getMessage());
        }
    }
}
