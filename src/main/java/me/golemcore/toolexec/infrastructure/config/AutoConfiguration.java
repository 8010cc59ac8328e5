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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.port.outbound.ToolRegistryPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the control plane and the startup summary.
 *
 * <p>
 * The tool worker pool is fixed-size and backed by a priority queue, so
 * queued invocations with a higher priority start first once all workers are
 * busy. Tasks must be submitted with {@code execute}, not {@code submit}:
 * only the orchestrator's own task type is comparable.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ToolExecProperties properties;
    private final ToolRegistryPort toolRegistry;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "toolWorkerPool", destroyMethod = "shutdownNow")
    public ThreadPoolExecutor toolWorkerPool() {
        int threads = Math.max(1, properties.getExecution().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS, new PriorityBlockingQueue<>(),
                r -> {
                    Thread thread = new Thread(r, "tool-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Tool Execution v{} starting...", version);
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Published tools: {}", toolRegistry.listLatest().size());
        log.info("Worker threads: {}, per-agent limit: {}", properties.getExecution().getWorkerThreads(),
                properties.getExecution().getMaxConcurrentPerAgent());
        log.info("Bridge: {}", properties.getBridge().isEnabled() ? properties.getBridge().getCommand() : "disabled");
    }
}
