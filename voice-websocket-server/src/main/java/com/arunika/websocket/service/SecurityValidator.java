package com.arunika.websocket.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * Validates device JWTs presented at the WebSocket handshake.
 *
 * The device id comes from the {@code device_id} claim, falling back to the
 * subject.
 */
@Service
@Slf4j
public class SecurityValidator {

    static final String DEVICE_ID_CLAIM = "device_id";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final boolean enabled;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:86400000}") long tokenExpirationMs,
            @Value("${security.device-auth.enabled:false}") boolean enabled,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.enabled = enabled;
        this.metricsService = metricsService;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the authenticated device id, or empty if the token is missing,
     *     malformed, badly signed or expired
     */
    public Optional<String> validateDeviceToken(String token) {
        if (token == null || token.isBlank()) {
            log.warn("Empty device token");
            metricsService.recordAuthenticationAttempt(false);
            return Optional.empty();
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String deviceId = claims.get(DEVICE_ID_CLAIM, String.class);
            if (deviceId == null || deviceId.isBlank()) {
                deviceId = claims.getSubject();
            }
            if (deviceId == null || deviceId.isBlank()) {
                log.warn("Device token carries no device id");
                metricsService.recordAuthenticationAttempt(false);
                return Optional.empty();
            }

            metricsService.recordAuthenticationAttempt(true);
            return Optional.of(deviceId);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid device token: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            return Optional.empty();
        }
    }

    /**
     * Issues a device token (for provisioning tools and tests).
     */
    public String generateDeviceToken(String deviceId) {
        return Jwts.builder()
                .subject(deviceId)
                .claim(DEVICE_ID_CLAIM, deviceId)
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
                .signWith(secretKey)
                .compact();
    }
}
