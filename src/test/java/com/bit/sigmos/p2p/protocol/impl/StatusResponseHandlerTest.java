package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.p2p.ChainSynchronizer;
import com.bit.sigmos.p2p.protocol.ChainStatus;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.session.PeerRole;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerState;
import com.bit.sigmos.p2p.session.ProtocolViolationException;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class StatusResponseHandlerTest {

    private Ledger ledger;
    private ChainSynchronizer synchronizer;
    private StatusResponseHandler handler;
    private PeerSession session;

    @BeforeEach
    void setUp() {
        ledger = mock(Ledger.class);
        synchronizer = mock(ChainSynchronizer.class);
        handler = new StatusResponseHandler(ledger, synchronizer);
        session = new PeerSession(new EmbeddedChannel(), PeerRole.INITIATOR);
        session.transition(PeerState.CONNECTING);
        session.transition(PeerState.HANDSHAKING);
        session.setPeerNodeId("peer");
        session.transition(PeerState.SYNCED);
    }

    private static P2PMessage status(long height, byte[] tip) {
        return P2PMessage.of(ProtocolEnum.STATUS_RESPONSE, new ChainStatus(height, tip).serialize());
    }

    private static byte[] tip(int fill) {
        byte[] hash = new byte[BlockHash.HASH_LENGTH];
        Arrays.fill(hash, (byte) fill);
        return hash;
    }

    @Test
    void testHigherPeerTriggersSync() throws Exception {
        when(ledger.height()).thenReturn(2L);
        handler.handle(session, status(5, tip(7)));

        assertEquals(5, session.getPeerHeight());
        assertEquals(BlockHash.fromBytes(tip(7)), session.getPeerTipHash());
        verify(synchronizer).requestSync(session);
    }

    @Test
    void testEqualHeightOnlyUpdatesTip() throws Exception {
        when(ledger.height()).thenReturn(3L);
        handler.handle(session, status(3, tip(1)));

        assertEquals(3, session.getPeerHeight());
        verifyNoInteractions(synchronizer);
    }

    @Test
    void testMalformedTipRejected() {
        assertThrows(ProtocolViolationException.class, () -> handler.handle(session, status(1, new byte[5])));
        assertEquals(-1, session.getPeerHeight());
        verifyNoInteractions(synchronizer);
    }
}
