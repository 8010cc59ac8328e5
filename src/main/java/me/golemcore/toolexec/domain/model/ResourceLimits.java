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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * CPU, memory and wall-clock limits. A {@code null} dimension is unbounded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceLimits {

    private Integer cpuMillicores;
    private Integer memoryMb;
    private Integer timeoutSeconds;

    /**
     * Lists every dimension in which this allocation exceeds {@code parent}.
     * Empty when this allocation fits inside the parent.
     */
    public List<String> violationsAgainst(ResourceLimits parent) {
        List<String> violations = new ArrayList<>();
        if (parent == null) {
            return violations;
        }
        exceeds("cpu_millicores", cpuMillicores, parent.getCpuMillicores(), violations);
        exceeds("memory_mb", memoryMb, parent.getMemoryMb(), violations);
        exceeds("timeout_seconds", timeoutSeconds, parent.getTimeoutSeconds(), violations);
        return violations;
    }

    /**
     * Lists every bounded dimension that is zero or negative.
     */
    public List<String> nonPositiveDimensions() {
        List<String> invalid = new ArrayList<>();
        positive("cpu_millicores", cpuMillicores, invalid);
        positive("memory_mb", memoryMb, invalid);
        positive("timeout_seconds", timeoutSeconds, invalid);
        return invalid;
    }

    private static void positive(String name, Integer value, List<String> invalid) {
        if (value != null && value <= 0) {
            invalid.add(name + " " + value + " <= 0");
        }
    }

    private static void exceeds(String name, Integer child, Integer parent, List<String> violations) {
        if (parent == null) {
            return;
        }
        if (child == null || child > parent) {
            violations.add(name + " " + (child == null ? "unbounded" : child) + " > " + parent);
        }
    }
}
