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

/**
 * Caller-supplied execution options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOptions {

    /** Return immediately with pending/running status instead of blocking. */
    private boolean asyncMode;

    /** 1..10, higher runs first when workers are saturated. */
    @Builder.Default
    private int priority = 5;

    /** Repeated requests with the same key and tenant return the same invocation. */
    private String idempotencyKey;

    /** {@code true} requests approval even when the manifest does not require it. */
    private Boolean requireApproval;
}
