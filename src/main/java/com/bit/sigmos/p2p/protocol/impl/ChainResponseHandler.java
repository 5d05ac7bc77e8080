package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.p2p.ChainSynchronizer;
import com.bit.sigmos.p2p.protocol.ChainResponse;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import org.springframework.stereotype.Component;

@Component
public class ChainResponseHandler implements ProtocolHandler {

    private final ChainSynchronizer synchronizer;

    public ChainResponseHandler(ChainSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.CHAIN_RESPONSE;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        synchronizer.onChainResponse(session, ChainResponse.deserialize(message.getData()));
    }
}
