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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a single invocation.
 *
 * <p>
 * Allowed edges:
 *
 * <pre>
 * PENDING          → RUNNING, PENDING_APPROVAL, PERMISSION_DENIED, ERROR, CANCELLED
 * PENDING_APPROVAL → PENDING, RUNNING, CANCELLED, ERROR
 * RUNNING          → SUCCESS, ERROR, TIMEOUT, CANCELLED
 * </pre>
 *
 * Terminal statuses have no outgoing edges.
 */
public enum InvocationStatus {

    PENDING, RUNNING, SUCCESS, ERROR, TIMEOUT, CANCELLED, PERMISSION_DENIED, PENDING_APPROVAL;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == TIMEOUT || this == CANCELLED
                || this == PERMISSION_DENIED;
    }

    public boolean canTransitionTo(InvocationStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return allowedTargets().contains(next);
    }

    private Set<InvocationStatus> allowedTargets() {
        return switch (this) {
        case PENDING -> EnumSet.of(RUNNING, PENDING_APPROVAL, PERMISSION_DENIED, ERROR, CANCELLED);
        case PENDING_APPROVAL -> EnumSet.of(PENDING, RUNNING, CANCELLED, ERROR);
        case RUNNING -> EnumSet.of(SUCCESS, ERROR, TIMEOUT, CANCELLED);
        default -> EnumSet.noneOf(InvocationStatus.class);
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InvocationStatus fromWire(String value) {
        return InvocationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
