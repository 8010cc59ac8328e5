package me.golemcore.toolexec.adapter.outbound.store;

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

import me.golemcore.toolexec.domain.model.CircuitState;
import me.golemcore.toolexec.port.outbound.CircuitStateStorePort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide circuit state. Version checks make every write a
 * compare-and-swap.
 */
@Component
public class InMemoryCircuitStateStore implements CircuitStateStorePort {

    private final Map<String, CircuitState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<CircuitState> load(String serviceId) {
        return Optional.ofNullable(states.get(serviceId));
    }

    @Override
    public boolean compareAndSet(String serviceId, long expectedVersion, CircuitState next) {
        if (expectedVersion == 0) {
            return states.putIfAbsent(serviceId, next) == null;
        }
        boolean[] swapped = new boolean[1];
        states.computeIfPresent(serviceId, (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            swapped[0] = true;
            return next;
        });
        return swapped[0];
    }
}
