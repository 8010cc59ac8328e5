package me.golemcore.toolexec.port.outbound;

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

import me.golemcore.toolexec.domain.model.ApprovalRequest;

/**
 * Delivers approval requests to a human approver. The decision comes back
 * later through the approval callback, possibly to another process.
 */
public interface ApprovalPort {

    void requestApproval(ApprovalRequest request);

    /**
     * The request was decided or timed out and should be withdrawn.
     */
    void withdraw(String invocationId);
}
