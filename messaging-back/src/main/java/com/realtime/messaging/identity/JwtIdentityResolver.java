package com.realtime.messaging.identity;

import com.realtime.messaging.security.JwtProvider;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class JwtIdentityResolver implements IdentityResolver {

    private static final String BEARER = "Bearer ";

    private final JwtProvider jwtProvider;

    @Override
    public Optional<Identity> resolve(String credential) {
        if (credential == null || credential.isBlank()) return Optional.empty();

        String token = credential.startsWith(BEARER) ? credential.substring(BEARER.length()) : credential;
        try {
            Claims claims = jwtProvider.parseAccessClaims(token.trim());
            String subject = claims.getSubject();
            if (subject == null) {
                log.warn("WS credential rejected: missing subject");
                return Optional.empty();
            }
            // subject = 사용자 UUID 문자열
            UUID userId = UUID.fromString(subject);
            String name = claims.get("name", String.class);
            return Optional.of(Identity.of(userId, name));
        } catch (SecurityException | IllegalArgumentException e) {
            log.warn("WS credential rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
