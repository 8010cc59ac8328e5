package me.golemcore.toolexec.infrastructure.config;

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

import lombok.Data;
import me.golemcore.toolexec.domain.model.CircuitBreakerSettings;
import me.golemcore.toolexec.domain.model.ResourceLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the tool execution service, bound
 * from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code toolexec.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local workspace for persisted state</li>
 * <li>{@link CircuitBreakerProperties} - default breaker thresholds</li>
 * <li>{@link RateLimitProperties} - token bucket sizing and granularity</li>
 * <li>{@link SecurityProperties} - capability tokens, oracle, decision
 * cache</li>
 * <li>{@link CheckpointProperties} - checkpoint encoding and retention</li>
 * <li>{@link BridgeProperties} - bridge peer process and caches</li>
 * <li>{@link ExecutionProperties} - worker pool, timeouts, leases</li>
 * <li>{@link ApprovalProperties} - escalation hierarchy</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "toolexec")
@Data
public class ToolExecProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private RegistryProperties registry = new RegistryProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private SecurityProperties security = new SecurityProperties();
    private CheckpointProperties checkpoint = new CheckpointProperties();
    private BridgeProperties bridge = new BridgeProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private AuditProperties audit = new AuditProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/toolexec";
        /** How long finished invocations stay in memory; older ones are read back from disk. */
        private Duration terminalRetention = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        private long readTimeout = 30_000;
        private long writeTimeout = 30_000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }

    @Data
    public static class RegistryProperties {
        private String manifestLocation = "classpath*:manifests/*.json";
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private Duration timeoutDuration = Duration.ofSeconds(60);
        private int halfOpenMaxCalls = 3;
        private CircuitBreakerSettings.WindowType windowType = CircuitBreakerSettings.WindowType.TIME;
        private Duration windowDuration = Duration.ofSeconds(60);
        private int windowSize = 20;

        public CircuitBreakerSettings toSettings() {
            return CircuitBreakerSettings.builder()
                    .failureThreshold(failureThreshold)
                    .successThreshold(successThreshold)
                    .timeoutDuration(timeoutDuration)
                    .halfOpenMaxCalls(halfOpenMaxCalls)
                    .windowType(windowType)
                    .windowDuration(windowDuration)
                    .windowSize(windowSize)
                    .build();
        }
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private Granularity granularity = Granularity.SERVICE;
        private long capacity = 20;
        private double refillPerSecond = 10.0;
        private Map<String, BucketProperties> overrides = new HashMap<>();

        public enum Granularity {
            SERVICE, TOOL_TENANT
        }
    }

    @Data
    public static class BucketProperties {
        private long capacity;
        private double refillPerSecond;
    }

    @Data
    public static class SecurityProperties {
        private String capabilitySecret;
        private String issuer = "golemcore";
        private Duration decisionCacheMaxTtl = Duration.ofMinutes(5);
        private int decisionCacheMaxEntries = 10_000;
        private boolean injectionGuardEnabled = true;
        private OracleProperties oracle = new OracleProperties();
    }

    @Data
    public static class OracleProperties {
        /** {@code local} evaluates the deny lists; {@code http} calls {@link #url}. */
        private String mode = "local";
        private String url;
        private Duration timeout = Duration.ofMillis(300);
        private Duration defaultTtl = Duration.ofMinutes(1);
        private List<String> deniedSubjects = new ArrayList<>();
        private Map<String, List<String>> deniedTools = new HashMap<>();
    }

    @Data
    public static class CheckpointProperties {
        private int compressionThreshold = 10 * 1024;
        private int deltaMinStateSize = 100 * 1024;
        private double deltaMaxRatio = 0.5;
        private int maxDeltaChain = 10;
        private int externalPayloadThreshold = 1024 * 1024;
        private Duration microRetention = Duration.ofHours(1);
        private Duration macroRetention = Duration.ofDays(30);
        private Duration retentionSweepInterval = Duration.ofMinutes(10);
        /** {@code local} or {@code bridge}. */
        private String durableStore = "local";
    }

    @Data
    public static class BridgeProperties {
        private boolean enabled = false;
        private String command;
        private Map<String, String> env = new HashMap<>();
        private int startupTimeoutSeconds = 10;
        private Duration callTimeout = Duration.ofMillis(500);
        private Duration sharedCacheTtl = Duration.ofMinutes(5);
        /** Expired shared-cache entries are served stale for this long, then dropped. */
        private Duration sharedCacheStaleRetention = Duration.ofHours(1);
        private Duration sharedCacheCleanupInterval = Duration.ofMinutes(5);
        private int localCacheMaxEntries = 1_000;
        private String directReadPath;
    }

    @Data
    public static class ExecutionProperties {
        private int workerThreads = 8;
        private int maxConcurrentPerAgent = 4;
        private Duration cancelGracePeriod = Duration.ofSeconds(5);
        private Duration supervisionTick = Duration.ofMillis(200);
        private Duration heartbeatInterval = Duration.ofSeconds(5);
        private Duration orphanAfter = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofSeconds(1);
        private LimitsProperties toolDefaults = new LimitsProperties(500, 1024, 30);
        private LimitsProperties agentDefaults = new LimitsProperties(4000, 8192, 3600);
    }

    @Data
    public static class LimitsProperties {
        private Integer cpuMillicores;
        private Integer memoryMb;
        private Integer timeoutSeconds;

        public LimitsProperties() {
        }

        public LimitsProperties(Integer cpuMillicores, Integer memoryMb, Integer timeoutSeconds) {
            this.cpuMillicores = cpuMillicores;
            this.memoryMb = memoryMb;
            this.timeoutSeconds = timeoutSeconds;
        }

        public ResourceLimits toLimits() {
            return ResourceLimits.builder()
                    .cpuMillicores(cpuMillicores)
                    .memoryMb(memoryMb)
                    .timeoutSeconds(timeoutSeconds)
                    .build();
        }
    }

    @Data
    public static class ApprovalProperties {
        private List<TierProperties> tiers = new ArrayList<>(List.of(
                new TierProperties("primary", Duration.ofMinutes(15)),
                new TierProperties("manager", Duration.ofMinutes(30)),
                new TierProperties("admin", Duration.ofHours(1))));
        private Duration sweepInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class TierProperties {
        private String name;
        private Duration timeout;

        public TierProperties() {
        }

        public TierProperties(String name, Duration timeout) {
            this.name = name;
            this.timeout = timeout;
        }
    }

    @Data
    public static class CredentialsProperties {
        /** Credential name to secret value, for the properties-backed store. */
        private Map<String, String> secrets = new HashMap<>();
        private Duration maxTtl = Duration.ofMinutes(15);
    }

    @Data
    public static class AuditProperties {
        private boolean enabled = true;
        private String directory = "audit";
    }
}
