package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.txpool.TransferPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 待打包知识转移的广播：校验后入池并转发一次
 */
@Slf4j
@Component
public class TransferAnnounceHandler implements ProtocolHandler {

    private final Ledger ledger;
    private final TransferPool transferPool;
    private final PeerSessionManager sessionManager;

    public TransferAnnounceHandler(Ledger ledger, TransferPool transferPool, PeerSessionManager sessionManager) {
        this.ledger = ledger;
        this.transferPool = transferPool;
        this.sessionManager = sessionManager;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.TRANSFER_ANNOUNCE;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        KnowledgeTransfer transfer = KnowledgeTransfer.deserialize(message.getData());
        session.markKnownTransfer(transfer.contentId());
        if (!sessionManager.markSeenTransfer(transfer.contentId())) {
            return;
        }
        ValidationResult result = ledger.validateTransfer(transfer);
        if (!result.isOk()) {
            log.debug("丢弃来自 {} 的知识转移: {}", session.getPeerNodeId(), result);
            return;
        }
        if (transferPool.add(transfer)) {
            sessionManager.broadcastTransfer(transfer, session);
        }
    }
}
