package me.golemcore.toolexec.adapter.outbound.approval;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.ApprovalRequest;
import me.golemcore.toolexec.domain.model.ApprovalWithdrawnEvent;
import me.golemcore.toolexec.infrastructure.event.SpringEventBus;
import me.golemcore.toolexec.port.outbound.ApprovalPort;
import org.springframework.stereotype.Component;

/**
 * Hands approval requests to whoever listens on the event bus (a notifier, a
 * console, a test). Decisions come back through the approval endpoint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventApprovalAdapter implements ApprovalPort {

    private final SpringEventBus eventBus;

    @Override
    public void requestApproval(ApprovalRequest request) {
        log.info("[Approval] Requesting {} approval (level {}) for {} on {}@{}, deadline {}", request.tier(),
                request.escalationLevel(), request.invocationId(), request.toolId(), request.toolVersion(),
                request.deadline());
        eventBus.publish(request);
    }

    @Override
    public void withdraw(String invocationId) {
        log.debug("[Approval] Withdrawing approval request for {}", invocationId);
        eventBus.publish(new ApprovalWithdrawnEvent(invocationId));
    }
}
