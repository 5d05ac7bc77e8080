package com.bit.sigmos.config;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.mining.MiningService;
import com.bit.sigmos.p2p.PeerService;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.transfer.KnowledgeStore;
import com.bit.sigmos.txpool.TransferPool;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 节点启动顺序：身份 → 知识 → 账本 → 监听器 → P2P → 引导节点 → 自动挖矿
 * 监听器在这里集中注册，组件之间不互相持有
 */
@Slf4j
@Component
public class NodeBootstrap {

    private final SystemConfig systemConfig;
    private final IdentityRegistry identityRegistry;
    private final KnowledgeStore knowledgeStore;
    private final Ledger ledger;
    private final TransferPool transferPool;
    private final MiningService miningService;
    private final PeerService peerService;

    public NodeBootstrap(SystemConfig systemConfig, IdentityRegistry identityRegistry, KnowledgeStore knowledgeStore,
                         Ledger ledger, TransferPool transferPool, MiningService miningService,
                         PeerService peerService) {
        this.systemConfig = systemConfig;
        this.identityRegistry = identityRegistry;
        this.knowledgeStore = knowledgeStore;
        this.ledger = ledger;
        this.transferPool = transferPool;
        this.miningService = miningService;
        this.peerService = peerService;
    }

    @PostConstruct
    public void init() throws InterruptedException {
        identityRegistry.load();
        knowledgeStore.load();
        ledger.load();
        knowledgeStore.replay(ledger.blocksFrom(0, Integer.MAX_VALUE));

        ledger.addListener(transferPool);
        ledger.addListener(knowledgeStore);
        ledger.addListener(miningService);

        peerService.start();
        for (String peer : systemConfig.getBootstrapPeers()) {
            connectBootstrapPeer(peer);
        }

        String autoMine = systemConfig.getAutoMineIdentity();
        if (autoMine != null && !autoMine.isBlank()) {
            if (identityRegistry.contains(autoMine)) {
                miningService.mine(autoMine, systemConfig.isAutoMineContinuous());
            } else {
                log.warn("自动挖矿身份不存在: {}", autoMine);
            }
        }
        log.info("节点 {} 启动完成，高度 {}，端口 {}", systemConfig.getNodeId(), ledger.height(), peerService.getPort());
    }

    private void connectBootstrapPeer(String peer) {
        int split = peer.lastIndexOf(':');
        if (split <= 0 || split == peer.length() - 1) {
            log.warn("引导节点地址格式错误(host:port): {}", peer);
            return;
        }
        String host = peer.substring(0, split);
        int port;
        try {
            port = Integer.parseInt(peer.substring(split + 1));
        } catch (NumberFormatException e) {
            log.warn("引导节点端口非法: {}", peer);
            return;
        }
        peerService.connect(host, port).whenComplete((session, e) -> {
            if (e != null) {
                log.warn("引导节点 {} 连接失败: {}", peer, e.getMessage());
            } else {
                log.info("引导节点 {} 已连接: {}", peer, session.getPeerNodeId());
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("节点关闭中...");
        miningService.shutdown();
        peerService.shutdown();
    }
}
