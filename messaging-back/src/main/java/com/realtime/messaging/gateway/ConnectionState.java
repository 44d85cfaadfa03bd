package com.realtime.messaging.gateway;

/**
 * CONNECTING → AUTHENTICATED → JOINED → (RECEIVING ⇄ IDLE) → DISCONNECTED.
 * DISCONNECTED는 어느 상태에서든 갈 수 있고 되돌릴 수 없다.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    JOINED,
    RECEIVING,
    IDLE,
    DISCONNECTED;

    public boolean canMoveTo(ConnectionState next) {
        if (next == DISCONNECTED) return this != DISCONNECTED;
        return switch (this) {
            case CONNECTING -> next == AUTHENTICATED;
            case AUTHENTICATED -> next == JOINED;
            case JOINED, IDLE -> next == RECEIVING;
            case RECEIVING -> next == IDLE;
            case DISCONNECTED -> false;
        };
    }
}
