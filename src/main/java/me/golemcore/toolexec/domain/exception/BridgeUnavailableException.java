package me.golemcore.toolexec.domain.exception;

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

import me.golemcore.toolexec.domain.model.ErrorCode;

import java.util.List;
import java.util.Map;

/**
 * Every bridge fallback tier failed for a request.
 */
public class BridgeUnavailableException extends ToolExecutionException {

    private static final long serialVersionUID = 1L;

    public BridgeUnavailableException(String method, List<String> tierFailures) {
        super(ErrorCode.BRIDGE_UNAVAILABLE, "Bridge unavailable for " + method,
                Map.of("method", method, "tiers", List.copyOf(tierFailures)), null);
    }
}
