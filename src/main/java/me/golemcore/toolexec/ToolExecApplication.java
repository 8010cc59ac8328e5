package me.golemcore.toolexec;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore tool execution layer.
 *
 * <p>
 * The control plane sits between agents and the tools they call. It resolves
 * versioned tool manifests, checks capability credentials against an
 * authorization oracle, validates and sanitizes parameters and results, runs
 * tools in per-invocation sandboxes on a worker pool, guards outbound calls
 * with rate limiters and circuit breakers, and checkpoints long-running tools
 * so they can be resumed after a failure.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → InvocationController (WebFlux)
 * Domain Layer       → InvocationGateway, ExecutionOrchestrator, Services
 * Infrastructure     → Registry/Storage/Bridge/MCP/OpenAPI Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code toolexec.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolExecApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolExecApplication.class, args);
    }

}
