package com.bit.sigmos.p2p.session;

import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PeerSessionTest {

    private static PeerSession established(PeerRole role, String peerNodeId) {
        PeerSession session = new PeerSession(new EmbeddedChannel(), role);
        session.transition(PeerState.CONNECTING);
        session.transition(PeerState.HANDSHAKING);
        session.setPeerNodeId(peerNodeId);
        session.transition(PeerState.SYNCED);
        return session;
    }

    @Test
    void testLifecycle() {
        PeerSession session = new PeerSession(new EmbeddedChannel(), PeerRole.INITIATOR);
        assertEquals(PeerState.DISCONNECTED, session.getState());
        session.transition(PeerState.CONNECTING);
        session.transition(PeerState.HANDSHAKING);
        assertFalse(session.getHandshakeFuture().isDone());
        session.transition(PeerState.SYNCED);
        assertTrue(session.getHandshakeFuture().isDone());
        assertTrue(session.isEstablished());

        assertTrue(session.transitionIf(PeerState.SYNCED, PeerState.RELAYING));
        assertFalse(session.transitionIf(PeerState.SYNCED, PeerState.RELAYING));
        assertTrue(session.isEstablished());
        assertTrue(session.transitionIf(PeerState.RELAYING, PeerState.SYNCED));

        session.disconnect("test");
        session.disconnect("again");
        assertEquals(PeerState.DISCONNECTED, session.getState());
        assertFalse(session.getChannel().isOpen());
    }

    @Test
    void testIllegalTransitionsRejected() {
        PeerSession session = new PeerSession(new EmbeddedChannel(), PeerRole.ACCEPTOR);
        assertThrows(ProtocolViolationException.class, () -> session.transition(PeerState.SYNCED));
        session.transition(PeerState.CONNECTING);
        assertThrows(ProtocolViolationException.class, () -> session.transition(PeerState.RELAYING));
        assertFalse(PeerState.DISCONNECTED.canTransitionTo(PeerState.DISCONNECTED));
        assertFalse(PeerState.HANDSHAKING.isEstablished());
    }

    @Test
    void testDisconnectBeforeHandshakeFailsFuture() {
        PeerSession session = new PeerSession(new EmbeddedChannel(), PeerRole.INITIATOR);
        session.transition(PeerState.CONNECTING);
        session.transition(PeerState.HANDSHAKING);
        session.disconnect("timeout");
        assertTrue(session.getHandshakeFuture().isCompletedExceptionally());
    }

    @Test
    void testPeerTipOnlyMovesForward() {
        PeerSession session = established(PeerRole.INITIATOR, "b");
        session.updatePeerTip(5, null);
        session.updatePeerTip(3, null);
        assertEquals(5, session.getPeerHeight());
    }

    @Test
    void testDuplicateConnectionKeepsSmallerInitiator() {
        SystemConfig config = new SystemConfig();
        config.setNodeId("node-a");
        PeerSessionManager manager = new PeerSessionManager(config, new P2pConfig());

        // 本地发起：发起方为 node-a；对端发起：发起方为 node-b
        PeerSession outbound = established(PeerRole.INITIATOR, "node-b");
        PeerSession inbound = established(PeerRole.ACCEPTOR, "node-b");
        manager.register(outbound);
        manager.register(inbound);

        assertTrue(manager.bindNodeId(inbound));
        assertTrue(manager.bindNodeId(outbound));
        assertSame(outbound, manager.byNodeId("node-b").orElseThrow());
        assertEquals(PeerState.DISCONNECTED, inbound.getState());
    }

    @Test
    void testBroadcastSkipsSource() {
        PeerSessionManager manager = new PeerSessionManager(new SystemConfig(), new P2pConfig());
        PeerSession source = established(PeerRole.ACCEPTOR, "src");
        PeerSession other = established(PeerRole.INITIATOR, "other");
        manager.register(source);
        manager.register(other);

        IdentityRecord record = IdentityRecord.create("X");
        assertEquals(1, manager.broadcastIdentity(record, source));
        EmbeddedChannel channel = (EmbeddedChannel) other.getChannel();
        P2PMessage sent = channel.readOutbound();
        assertEquals(ProtocolEnum.IDENTITY_ANNOUNCE, sent.protocol());
        assertNull(((EmbeddedChannel) source.getChannel()).readOutbound());
    }
}
