package com.realtime.messaging.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 토큰 발급은 외부 인증 서비스 담당. 여기서는 같은 비밀키로 검증만 한다.
 */
@Component
public class JwtProviderImpl implements JwtProvider {

    private static final String HMAC_ALG = "HmacSHA256"; // HS256 기준
    private final SecretKey accessKey;

    public JwtProviderImpl(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.secret-base64:false}") boolean accessBase64
    ) {
        byte[] aBytes = accessBase64
                ? Base64.getDecoder().decode(accessSecret)
                : accessSecret.getBytes(StandardCharsets.UTF_8);

        if (aBytes.length < 32) {
            throw new IllegalArgumentException("JWT secret length must be >= 32 bytes (256 bits).");
        }
        this.accessKey = new SecretKeySpec(aBytes, HMAC_ALG);
    }

    @Override
    public Claims parseAccessClaims(String accessToken) {
        try {
            return Jwts.parser()
                    .verifyWith(accessKey)   // 0.12.x
                    .build()
                    .parseSignedClaims(accessToken)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SecurityException("Invalid access token", e);
        }
    }
}
