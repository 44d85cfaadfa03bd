package com.realtime.messaging.security;

import io.jsonwebtoken.Claims;

public interface JwtProvider {

    /** 액세스 토큰의 클레임 파싱(서명+만료 검증 포함). 실패 시 SecurityException */
    Claims parseAccessClaims(String accessToken);
}
