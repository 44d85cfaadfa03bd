package com.realtime.messaging.gateway;

import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.identity.Identity;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 커넥션 하나의 런타임 상태. 저장하지 않으며 disconnect와 함께 사라진다.
 */
public class GatewaySession {

    @Getter
    private final ClientConnection connection;
    @Getter
    private volatile Identity identity;
    @Getter
    private volatile GroupRef group;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    public GatewaySession(ClientConnection connection) {
        this.connection = connection;
    }

    public ConnectionState state() {
        return state.get();
    }

    public void authenticated(Identity identity) {
        this.identity = identity;
        require(ConnectionState.AUTHENTICATED);
    }

    public void joined(GroupRef group) {
        this.group = group;
        require(ConnectionState.JOINED);
    }

    /** JOINED/IDLE → RECEIVING. 이미 끊긴 세션이면 false */
    public boolean beginReceive() {
        return moveTo(ConnectionState.RECEIVING);
    }

    public boolean endReceive() {
        return moveTo(ConnectionState.IDLE);
    }

    /** @return 처음 끊긴 경우에만 true */
    public boolean disconnected() {
        return moveTo(ConnectionState.DISCONNECTED);
    }

    public boolean isDisconnected() {
        return state.get() == ConnectionState.DISCONNECTED;
    }

    public String connectionId() {
        return connection.id();
    }

    private boolean moveTo(ConnectionState next) {
        while (true) {
            ConnectionState cur = state.get();
            if (!cur.canMoveTo(next)) return false;
            if (state.compareAndSet(cur, next)) return true;
        }
    }

    private void require(ConnectionState next) {
        if (!moveTo(next)) {
            throw new IllegalStateException("illegal transition " + state.get() + " -> " + next);
        }
    }
}
