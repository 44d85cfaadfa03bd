package com.realtime.messaging.common;

import org.springframework.http.HttpStatus;

/**
 * 게이트웨이 에러 프레임의 code 값과, 바깥 CRUD 레이어가 매핑할 HTTP 상태.
 */
public enum ChatErrorCode {
    UNAUTHENTICATED("unauthenticated", HttpStatus.UNAUTHORIZED),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    INVALID_FRAME("invalid_frame", HttpStatus.BAD_REQUEST),
    BAD_REQUEST("bad_request", HttpStatus.BAD_REQUEST),
    PERSISTENCE_UNAVAILABLE("persistence_unavailable", HttpStatus.SERVICE_UNAVAILABLE);

    private final String wireCode;
    private final HttpStatus status;

    ChatErrorCode(String wireCode, HttpStatus status) {
        this.wireCode = wireCode;
        this.status = status;
    }

    public String wireCode() {
        return wireCode;
    }

    public HttpStatus status() {
        return status;
    }
}
