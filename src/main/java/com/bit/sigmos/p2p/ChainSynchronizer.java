package com.bit.sigmos.p2p;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.p2p.protocol.ChainRequest;
import com.bit.sigmos.p2p.protocol.ChainResponse;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.p2p.session.PeerState;
import com.bit.sigmos.structure.block.Block;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 链同步：向高度更高的对端请求区块，拼出候选链后交给账本做分叉选择
 * 每个会话同时只有一次同步在进行
 */
@Slf4j
@Component
public class ChainSynchronizer {

    private final Ledger ledger;
    private final PeerSessionManager sessionManager;
    private final P2pConfig p2pConfig;

    public ChainSynchronizer(Ledger ledger, PeerSessionManager sessionManager, P2pConfig p2pConfig) {
        this.ledger = ledger;
        this.sessionManager = sessionManager;
        this.p2pConfig = p2pConfig;
    }

    /**
     * 从本地高度往回 syncLookback 个区块开始请求，覆盖短分叉
     */
    public void requestSync(PeerSession session) {
        if (!session.isEstablished() || !session.beginSync()) {
            return;
        }
        if (!session.transitionIf(PeerState.SYNCED, PeerState.RELAYING)) {
            session.endSync();
            return;
        }
        long fromIndex = Math.max(1, ledger.height() + 1 - p2pConfig.getSyncLookback());
        sendRequest(session, fromIndex);
    }

    private void sendRequest(PeerSession session, long fromIndex) {
        session.getSyncBuffer().clear();
        session.setSyncFromIndex(fromIndex);
        log.debug("向 {} 请求区块，起始高度 {}", session.getPeerNodeId(), fromIndex);
        session.send(ProtocolEnum.CHAIN_REQUEST, new ChainRequest(fromIndex).serialize());
    }

    public void onChainResponse(PeerSession session, ChainResponse response) {
        if (!session.isSyncInFlight()) {
            log.debug("未在同步中，忽略来自 {} 的区块响应", session.getPeerNodeId());
            return;
        }
        List<Block> buffer = session.getSyncBuffer();
        long expectedIndex = session.getSyncFromIndex() + buffer.size();
        for (Block block : response.getBlocks()) {
            if (block.getIndex() != expectedIndex) {
                log.warn("来自 {} 的区块不连续: 期望 {} 实际 {}", session.getPeerNodeId(), expectedIndex, block.getIndex());
                finish(session, false);
                return;
            }
            buffer.add(block);
            expectedIndex++;
        }
        if (!buffer.isEmpty()) {
            Block last = buffer.get(buffer.size() - 1);
            session.updatePeerTip(last.getIndex(), last.getHash());
        }
        if (buffer.size() > p2pConfig.getMaxSyncBlocks()) {
            log.warn("同步区块数超过上限 {}，放弃本次同步", p2pConfig.getMaxSyncBlocks());
            finish(session, false);
            return;
        }
        // 对端还有更多区块，继续请求
        if (!response.getBlocks().isEmpty() && expectedIndex <= response.getChainHeight()) {
            session.send(ProtocolEnum.CHAIN_REQUEST, new ChainRequest(expectedIndex).serialize());
            return;
        }
        assemble(session, new ArrayList<>(buffer));
    }

    private void assemble(PeerSession session, List<Block> suffix) {
        if (suffix.isEmpty()) {
            finish(session, false);
            return;
        }
        long start = suffix.get(0).getIndex();
        List<Block> prefix = ledger.blocksFrom(0, (int) start);
        boolean attaches = prefix.size() == start
                && suffix.get(0).getPreviousHash().equals(prefix.get(prefix.size() - 1).getHash());
        if (!attaches) {
            if (start > 1) {
                log.info("来自 {} 的区块无法接到本地前缀，改为请求完整链", session.getPeerNodeId());
                sendRequest(session, 1);
            } else {
                log.warn("来自 {} 的链与本地创世区块不连续", session.getPeerNodeId());
                finish(session, false);
            }
            return;
        }
        List<Block> candidate = new ArrayList<>(prefix.size() + suffix.size());
        candidate.addAll(prefix);
        candidate.addAll(suffix);
        boolean replaced = ledger.replaceIfBetter(candidate);
        if (replaced) {
            Block tip = candidate.get(candidate.size() - 1);
            for (Block block : suffix) {
                session.markKnownBlock(block.getHash());
            }
            sessionManager.broadcastBlock(tip, session);
            log.info("从 {} 同步到高度 {}，tip {}", session.getPeerNodeId(), tip.getIndex(), tip.getHash());
        } else {
            log.debug("来自 {} 的候选链未被采纳", session.getPeerNodeId());
        }
        finish(session, replaced);
    }

    private void finish(PeerSession session, boolean replaced) {
        session.endSync();
        session.transitionIf(PeerState.RELAYING, PeerState.SYNCED);
        // 同步期间对端可能继续出块
        if (replaced && session.getPeerHeight() > ledger.height()) {
            requestSync(session);
        }
    }
}
