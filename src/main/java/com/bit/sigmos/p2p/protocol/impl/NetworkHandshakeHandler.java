package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.p2p.ChainSynchronizer;
import com.bit.sigmos.p2p.protocol.NetworkHandshake;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.p2p.session.PeerState;
import com.bit.sigmos.p2p.session.ProtocolViolationException;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 握手：校验网络魔法值、协议版本、节点ID
 * 双方HELLO交换完成后进入SYNCED，推送本地身份，对端更高则发起同步
 */
@Slf4j
@Component
public class NetworkHandshakeHandler implements ProtocolHandler {

    private final Ledger ledger;
    private final PeerSessionManager sessionManager;
    private final ChainSynchronizer synchronizer;
    private final IdentityRegistry identityRegistry;

    public NetworkHandshakeHandler(Ledger ledger, PeerSessionManager sessionManager, ChainSynchronizer synchronizer,
                                   IdentityRegistry identityRegistry) {
        this.ledger = ledger;
        this.sessionManager = sessionManager;
        this.synchronizer = synchronizer;
        this.identityRegistry = identityRegistry;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.HELLO;
    }

    /**
     * 本节点的HELLO，连接建立时发送
     */
    public NetworkHandshake localHello() {
        Block tip = ledger.tip();
        NetworkHandshake hello = new NetworkHandshake();
        hello.setNetworkMagic(ledger.genesis().getHash().toBytes());
        hello.setProtocolVersion(P2PMessage.CURRENT_VERSION);
        hello.setChainHeight(tip.getIndex());
        hello.setTipHash(tip.getHash().toBytes());
        hello.setNodeId(sessionManager.localNodeId());
        return hello;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        if (session.getState() != PeerState.HANDSHAKING) {
            throw new ProtocolViolationException("重复握手或状态错误: " + session.getState());
        }
        NetworkHandshake hello = NetworkHandshake.deserialize(message.getData());

        if (!Arrays.equals(hello.getNetworkMagic(), ledger.genesis().getHash().toBytes())) {
            throw new ProtocolViolationException("网络魔法值不一致，对端不在同一网络");
        }
        if (!P2PMessage.isCompatible(hello.getProtocolVersion())) {
            throw new ProtocolViolationException("不兼容的协议版本: " + hello.getProtocolVersion());
        }
        if (hello.getNodeId().isEmpty()) {
            throw new ProtocolViolationException("对端节点ID为空");
        }
        if (hello.getNodeId().equals(sessionManager.localNodeId())) {
            session.disconnect("连接到自身");
            return;
        }
        if (hello.getTipHash().length != BlockHash.HASH_LENGTH || hello.getChainHeight() < 0) {
            throw new ProtocolViolationException("握手携带的链状态非法");
        }

        session.setPeerNodeId(hello.getNodeId());
        session.setNegotiatedVersion(Math.min(hello.getProtocolVersion(), P2PMessage.CURRENT_VERSION));
        session.updatePeerTip(hello.getChainHeight(), BlockHash.fromBytes(hello.getTipHash()));
        if (!sessionManager.bindNodeId(session)) {
            session.disconnect("与节点 " + hello.getNodeId() + " 已存在连接");
            return;
        }
        session.transition(PeerState.SYNCED);
        log.info("握手完成 {} 对端高度 {}", session, hello.getChainHeight());

        // 先推送身份，对端校验后续区块的矿工分数和知识转移时身份已知
        for (IdentityRecord record : identityRegistry.all()) {
            session.send(ProtocolEnum.IDENTITY_ANNOUNCE, record.serialize());
        }
        if (hello.getChainHeight() > ledger.height()) {
            synchronizer.requestSync(session);
        }
    }
}
