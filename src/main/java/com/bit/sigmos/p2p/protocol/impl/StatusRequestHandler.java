package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.p2p.protocol.ChainStatus;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.structure.block.Block;
import org.springframework.stereotype.Component;

/**
 * 保活查询，回复本地高度和tip
 */
@Component
public class StatusRequestHandler implements ProtocolHandler {

    private final Ledger ledger;

    public StatusRequestHandler(Ledger ledger) {
        this.ledger = ledger;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.STATUS_REQUEST;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) {
        Block tip = ledger.tip();
        session.send(ProtocolEnum.STATUS_RESPONSE, new ChainStatus(tip.getIndex(), tip.getHash().toBytes()).serialize());
    }
}
