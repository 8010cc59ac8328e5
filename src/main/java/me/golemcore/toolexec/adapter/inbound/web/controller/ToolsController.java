package me.golemcore.toolexec.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ToolFilter;
import me.golemcore.toolexec.domain.model.ToolPage;
import me.golemcore.toolexec.domain.service.InvocationGateway;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Tool catalogue. Listing never fails; a backing failure yields an empty page.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final InvocationGateway gateway;

    @GetMapping
    public Mono<ResponseEntity<ToolPage>> listTools(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CallerHeaders.AGENT_ID, required = false) String agentId,
            @RequestHeader(value = CallerHeaders.TENANT_ID, required = false) String tenantId,
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String protocol,
            @RequestParam(defaultValue = "false") boolean includeDeprecated,
            @RequestParam(defaultValue = "false") boolean grantedOnly,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "50") int limit) {
        CallerIdentity caller = CallerHeaders.toIdentity(authorization, agentId, tenantId, null, null);
        ToolFilter filter = ToolFilter.builder()
                .query(query)
                .protocol(protocol != null ? ProtocolKind.fromWire(protocol) : null)
                .includeDeprecated(includeDeprecated)
                .grantedOnly(grantedOnly)
                .offset(offset)
                .limit(limit)
                .build();
        return Mono.fromCallable(() -> gateway.list(caller, filter))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
