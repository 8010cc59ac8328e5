package me.golemcore.toolexec.security;

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

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.CapabilityCredential;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ToolGrant;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Issues and verifies HMAC-signed capability tokens.
 *
 * <p>
 * Claims: {@code sub} (agent), {@code tenant}, {@code jti}, {@code iat},
 * {@code exp} (mandatory), {@code grants} as a list of
 * {@code {"tool": id, "versions": range}} and {@code permissions} as a list of
 * strings.
 */
@Component
@Slf4j
public class CapabilityTokenVerifier {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String CLAIM_TENANT = "tenant";
    private static final String CLAIM_GRANTS = "grants";
    private static final String CLAIM_PERMISSIONS = "permissions";

    private final ToolExecProperties properties;
    private final Clock clock;
    private SecretKey signingKey;

    public CapabilityTokenVerifier(ToolExecProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        String secret = properties.getSecurity().getCapabilitySecret();
        if (secret == null || secret.isBlank()) {
            byte[] randomBytes = new byte[64];
            new SecureRandom().nextBytes(randomBytes);
            secret = Base64.getEncoder().encodeToString(randomBytes);
            log.warn("[Permission] No capability secret configured, generated an ephemeral one");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            byte[] padded = new byte[MIN_SECRET_BYTES];
            System.arraycopy(keyBytes, 0, padded, 0, keyBytes.length);
            keyBytes = padded;
        }
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
    }

    /**
     * Issue a token. Used by operators and tests; agents receive tokens from
     * their control plane.
     */
    public String issue(String subject, String tenantId, List<ToolGrant> grants, Collection<String> permissions,
            Duration ttl) {
        Instant now = Instant.now(clock);
        List<Map<String, Object>> grantClaims = new ArrayList<>();
        for (ToolGrant grant : grants) {
            Map<String, Object> claim = new LinkedHashMap<>();
            claim.put("tool", grant.toolId());
            claim.put("versions", grant.versionRange() != null ? grant.versionRange() : "*");
            grantClaims.add(claim);
        }
        return Jwts.builder()
                .subject(subject)
                .issuer(properties.getSecurity().getIssuer())
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_TENANT, tenantId)
                .claim(CLAIM_GRANTS, grantClaims)
                .claim(CLAIM_PERMISSIONS, new ArrayList<>(permissions))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey)
                .compact();
    }

    /**
     * Verify signature and expiry and extract the grants.
     *
     * @throws ToolExecutionException
     *             with {@code invalid_credential} on any verification error
     */
    public CapabilityCredential verify(String token) {
        if (token == null || token.isBlank()) {
            throw new ToolExecutionException(ErrorCode.INVALID_CREDENTIAL, "Capability credential missing");
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(Instant.now(clock)))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[Permission] Invalid capability token: {}", e.getMessage());
            throw new ToolExecutionException(ErrorCode.INVALID_CREDENTIAL, "Capability credential rejected", e);
        }
        if (claims.getExpiration() == null) {
            throw new ToolExecutionException(ErrorCode.INVALID_CREDENTIAL, "Capability credential has no expiry");
        }
        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new ToolExecutionException(ErrorCode.INVALID_CREDENTIAL, "Capability credential has no subject");
        }

        CapabilityCredential.CapabilityCredentialBuilder builder = CapabilityCredential.builder()
                .subject(claims.getSubject())
                .tenantId(claims.get(CLAIM_TENANT, String.class))
                .tokenId(claims.getId())
                .issuedAt(claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null)
                .expiresAt(claims.getExpiration().toInstant());

        Object grants = claims.get(CLAIM_GRANTS);
        if (grants instanceof List<?> list) {
            for (Object entry : list) {
                if (entry instanceof Map<?, ?> map && map.get("tool") != null) {
                    Object versions = map.get("versions");
                    builder.grant(new ToolGrant(String.valueOf(map.get("tool")),
                            versions != null ? String.valueOf(versions) : "*"));
                }
            }
        }
        Object permissions = claims.get(CLAIM_PERMISSIONS);
        if (permissions instanceof List<?> list) {
            for (Object permission : list) {
                if (permission != null) {
                    builder.permission(String.valueOf(permission));
                }
            }
        }
        return builder.build();
    }
}
