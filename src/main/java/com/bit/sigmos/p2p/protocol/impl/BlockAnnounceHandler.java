package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.p2p.ChainSynchronizer;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.structure.block.Block;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 新区块广播
 * 高度正好为本地+1：追加成功后转发一次；更高：发起同步；更低或相同：忽略
 */
@Slf4j
@Component
public class BlockAnnounceHandler implements ProtocolHandler {

    private final Ledger ledger;
    private final PeerSessionManager sessionManager;
    private final ChainSynchronizer synchronizer;

    public BlockAnnounceHandler(Ledger ledger, PeerSessionManager sessionManager, ChainSynchronizer synchronizer) {
        this.ledger = ledger;
        this.sessionManager = sessionManager;
        this.synchronizer = synchronizer;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.BLOCK_ANNOUNCE;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        Block block = Block.deserialize(message.getData());
        session.markKnownBlock(block.getHash());
        session.updatePeerTip(block.getIndex(), block.getHash());
        if (sessionManager.hasSeenBlock(block.getHash())) {
            return;
        }

        long height = ledger.height();
        if (block.getIndex() <= height) {
            log.debug("忽略不高于本地的区块 {} (本地高度 {})", block.getIndex(), height);
            return;
        }
        if (block.getIndex() > height + 1) {
            log.info("收到高度 {} 的区块，本地高度 {}，发起同步", block.getIndex(), height);
            synchronizer.requestSync(session);
            return;
        }

        ValidationResult result = ledger.append(block);
        if (result.isOk()) {
            sessionManager.broadcastBlock(block, session);
            return;
        }
        switch (result.getReason()) {
            case HASH_MISMATCH:
            case STALE_INDEX:
                // 父块不同（对端在分叉上）或本地高度已变化，交给同步和分叉选择
                log.debug("区块 {} 无法直接追加: {}，发起同步", block.getIndex(), result);
                synchronizer.requestSync(session);
                break;
            default:
                sessionManager.markSeenBlock(block.getHash());
                log.warn("拒绝来自 {} 的区块 {}: {}", session.getPeerNodeId(), block.getIndex(), result);
        }
    }
}
