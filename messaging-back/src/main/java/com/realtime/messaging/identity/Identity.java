package com.realtime.messaging.identity;

import java.util.UUID;

/** 외부 인증 서비스가 검증한 사용자. */
public record Identity(UUID userId, String displayName, boolean authenticated) {

    public static Identity of(UUID userId, String displayName) {
        return new Identity(userId, displayName, true);
    }

    /** 표시명이 없으면 UUID 문자열로 폴백 */
    public String label() {
        return (displayName != null && !displayName.isBlank()) ? displayName : userId.toString();
    }
}
