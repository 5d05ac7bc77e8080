package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.p2p.ChainSynchronizer;
import com.bit.sigmos.p2p.protocol.ChainStatus;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.ProtocolViolationException;
import org.springframework.stereotype.Component;

@Component
public class StatusResponseHandler implements ProtocolHandler {

    private final Ledger ledger;
    private final ChainSynchronizer synchronizer;

    public StatusResponseHandler(Ledger ledger, ChainSynchronizer synchronizer) {
        this.ledger = ledger;
        this.synchronizer = synchronizer;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.STATUS_RESPONSE;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        ChainStatus status = ChainStatus.deserialize(message.getData());
        if (status.getTipHash().length != BlockHash.HASH_LENGTH) {
            throw new ProtocolViolationException("状态响应tip哈希长度错误");
        }
        session.updatePeerTip(status.getChainHeight(), BlockHash.fromBytes(status.getTipHash()));
        if (status.getChainHeight() > ledger.height()) {
            synchronizer.requestSync(session);
        }
    }
}
