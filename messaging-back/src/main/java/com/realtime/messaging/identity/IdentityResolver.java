package com.realtime.messaging.identity;

import java.util.Optional;

/**
 * 핸드셰이크에서 꺼낸 bearer credential을 검증된 사용자로 바꾼다.
 * 무효/만료 토큰이면 empty.
 */
public interface IdentityResolver {

    Optional<Identity> resolve(String credential);
}
