package com.realtime.messaging.identity;

import com.realtime.messaging.security.JwtProviderImpl;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JwtIdentityResolver")
class JwtIdentityResolverTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123";

    private final JwtIdentityResolver resolver = new JwtIdentityResolver(new JwtProviderImpl(SECRET, false));

    private static String token(String secret, String subject, String name, Instant expiresAt) {
        var builder = Jwts.builder()
                .subject(subject)
                .issuedAt(new Date())
                .expiration(Date.from(expiresAt))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)));
        if (name != null) builder.claim("name", name);
        return builder.compact();
    }

    @Nested
    @DisplayName("accepts")
    class Accepts {

        @Test
        @DisplayName("a signed token with a UUID subject")
        void validToken() {
            UUID id = UUID.randomUUID();

            Optional<Identity> identity = resolver.resolve(token(SECRET, id.toString(), "Alice", Instant.now().plusSeconds(60)));

            assertTrue(identity.isPresent());
            assertEquals(id, identity.get().userId());
            assertEquals("Alice", identity.get().label());
            assertTrue(identity.get().authenticated());
        }

        @Test
        @DisplayName("the Bearer prefix and falls back to the id as label")
        void bearerPrefix() {
            UUID id = UUID.randomUUID();

            Optional<Identity> identity = resolver.resolve("Bearer " + token(SECRET, id.toString(), null, Instant.now().plusSeconds(60)));

            assertEquals(id.toString(), identity.orElseThrow().label());
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("an expired token")
        void expired() {
            String t = token(SECRET, UUID.randomUUID().toString(), "A", Instant.now().minusSeconds(60));
            assertTrue(resolver.resolve(t).isEmpty());
        }

        @Test
        @DisplayName("a token signed with another key")
        void wrongKey() {
            String t = token("another-secret-another-secret-another-01", UUID.randomUUID().toString(), "A",
                    Instant.now().plusSeconds(60));
            assertTrue(resolver.resolve(t).isEmpty());
        }

        @Test
        @DisplayName("a subject that is not a UUID")
        void badSubject() {
            String t = token(SECRET, "alice", "A", Instant.now().plusSeconds(60));
            assertTrue(resolver.resolve(t).isEmpty());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "not.a.jwt", "Bearer "})
        @DisplayName("missing or malformed credentials")
        void malformed(String credential) {
            assertTrue(resolver.resolve(credential).isEmpty());
        }
    }

    @Test
    @DisplayName("short secrets are refused at startup")
    void shortSecret() {
        assertThrows(IllegalArgumentException.class, () -> new JwtProviderImpl("too-short", false));
    }
}
