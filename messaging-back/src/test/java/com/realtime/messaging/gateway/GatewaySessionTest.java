package com.realtime.messaging.gateway;

import com.realtime.messaging.common.GroupRef;
import com.realtime.messaging.identity.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GatewaySession state machine")
class GatewaySessionTest {

    private final GatewaySession session = new GatewaySession(new RecordingConnection("c1"));

    @Test
    @DisplayName("follows connecting → authenticated → joined → receiving ⇄ idle")
    void happyPath() {
        assertEquals(ConnectionState.CONNECTING, session.state());
        session.authenticated(Identity.of(UUID.randomUUID(), "alice"));
        session.joined(GroupRef.room("r1"));
        assertEquals(ConnectionState.JOINED, session.state());

        assertTrue(session.beginReceive());
        assertTrue(session.endReceive());
        assertEquals(ConnectionState.IDLE, session.state());
        assertTrue(session.beginReceive());
        assertEquals(ConnectionState.RECEIVING, session.state());
    }

    @Test
    @DisplayName("joining without authenticating is illegal")
    void cannotSkipAuthenticated() {
        assertThrows(IllegalStateException.class, () -> session.joined(GroupRef.room("r1")));
    }

    @Test
    @DisplayName("disconnected is reachable from any state exactly once")
    void disconnectIsTerminal() {
        assertTrue(session.disconnected());
        assertFalse(session.disconnected());
        assertFalse(session.beginReceive());
        assertTrue(session.isDisconnected());
    }

    @Test
    @DisplayName("transition table")
    void transitionTable() {
        assertTrue(ConnectionState.CONNECTING.canMoveTo(ConnectionState.DISCONNECTED));
        assertFalse(ConnectionState.CONNECTING.canMoveTo(ConnectionState.JOINED));
        assertFalse(ConnectionState.AUTHENTICATED.canMoveTo(ConnectionState.RECEIVING));
        assertFalse(ConnectionState.RECEIVING.canMoveTo(ConnectionState.RECEIVING));
        assertFalse(ConnectionState.DISCONNECTED.canMoveTo(ConnectionState.CONNECTING));
    }
}
