package me.golemcore.toolexec.adapter.outbound.credentials;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.SecretLease;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.CredentialStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Credential store backed by {@code toolexec.credentials.secrets}. Leases are
 * capped at {@code toolexec.credentials.max-ttl}.
 */
@Component
@Slf4j
public class PropertiesCredentialStoreAdapter implements CredentialStorePort {

    private final ToolExecProperties.CredentialsProperties settings;
    private final Clock clock;

    public PropertiesCredentialStoreAdapter(ToolExecProperties properties, Clock clock) {
        this.settings = properties.getCredentials();
        this.clock = clock;
    }

    @Override
    public CompletableFuture<SecretLease> getEphemeral(String toolId, String credentialName, Duration ttl) {
        String secret = settings.getSecrets().get(credentialName);
        if (secret == null) {
            return CompletableFuture.failedFuture(new ToolExecutionException(ErrorCode.EXECUTION_FAILED,
                    "Credential " + credentialName + " is not configured"));
        }
        Duration lifetime = ttl == null || ttl.compareTo(settings.getMaxTtl()) > 0 ? settings.getMaxTtl() : ttl;
        log.debug("Leasing credential {} to {} for {}s", credentialName, toolId, lifetime.toSeconds());
        return CompletableFuture.completedFuture(
                new SecretLease(credentialName, secret, Instant.now(clock).plus(lifetime)));
    }
}
