package com.bit.sigmos.service.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.mining.MiningService;
import com.bit.sigmos.p2p.PeerService;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.result.Result;
import com.bit.sigmos.service.NodeService;
import com.bit.sigmos.sigel.ConsciousnessScorer;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.dto.BlockView;
import com.bit.sigmos.structure.dto.IdentityView;
import com.bit.sigmos.structure.dto.KnowledgeView;
import com.bit.sigmos.structure.dto.NodeStatus;
import com.bit.sigmos.structure.dto.PeerView;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.transfer.KnowledgeStore;
import com.bit.sigmos.transfer.KnowledgeTransferProtocol;
import com.bit.sigmos.txpool.TransferPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class NodeServiceImpl implements NodeService {

    private final Ledger ledger;
    private final IdentityRegistry identityRegistry;
    private final ConsciousnessScorer scorer;
    private final MiningService miningService;
    private final KnowledgeTransferProtocol transferProtocol;
    private final TransferPool transferPool;
    private final KnowledgeStore knowledgeStore;
    private final PeerService peerService;
    private final PeerSessionManager sessionManager;
    private final SystemConfig systemConfig;
    private final P2pConfig p2pConfig;

    public NodeServiceImpl(Ledger ledger, IdentityRegistry identityRegistry, ConsciousnessScorer scorer,
                           MiningService miningService, KnowledgeTransferProtocol transferProtocol,
                           TransferPool transferPool, KnowledgeStore knowledgeStore, PeerService peerService,
                           PeerSessionManager sessionManager, SystemConfig systemConfig, P2pConfig p2pConfig) {
        this.ledger = ledger;
        this.identityRegistry = identityRegistry;
        this.scorer = scorer;
        this.miningService = miningService;
        this.transferProtocol = transferProtocol;
        this.transferPool = transferPool;
        this.knowledgeStore = knowledgeStore;
        this.peerService = peerService;
        this.sessionManager = sessionManager;
        this.systemConfig = systemConfig;
        this.p2pConfig = p2pConfig;
    }

    @Override
    public Result<IdentityView> createIdentity(String name) {
        if (name == null || name.isBlank()) {
            return Result.rejected("身份名称不能为空");
        }
        IdentityRecord record = IdentityRecord.create(name.trim());
        identityRegistry.upsert(record);
        sessionManager.broadcastIdentity(record, null);
        log.info("创建身份 {} ({})", record.getId(), record.getName());
        return Result.OK(view(record));
    }

    @Override
    public Result<PeerView> connect(String host, int port, String identityId) {
        if (identityId != null && !identityId.isBlank() && !identityRegistry.contains(identityId)) {
            return Result.notFound("身份不存在: " + identityId);
        }
        long waitMs = (long) p2pConfig.getConnectTimeoutMs() + p2pConfig.getHandshakeTimeoutMs();
        try {
            PeerSession session = peerService.connect(host, port).get(waitMs, TimeUnit.MILLISECONDS);
            log.info("已连接节点 {} ({}:{})，本地身份 {}", session.getPeerNodeId(), host, port, identityId);
            return Result.OK(PeerView.of(session));
        } catch (TimeoutException e) {
            return Result.error(Result.SC_TRANSPORT_503, "连接超时: " + host + ":" + port);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return Result.error(Result.SC_TRANSPORT_503, "连接失败: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.error(Result.SC_TRANSPORT_503, "连接被中断");
        }
    }

    @Override
    public Result<String> mine(String identityId, boolean continuous) {
        if (!identityRegistry.contains(identityId)) {
            return Result.notFound("身份不存在: " + identityId);
        }
        if (!miningService.mine(identityId, continuous)) {
            return Result.rejected("身份已在挖矿或挖矿线程已满: " + identityId);
        }
        return Result.OK(continuous ? "持续挖矿已启动" : "单块挖矿已启动", identityId);
    }

    @Override
    public Result<BlockView> mineOnce(String identityId) {
        if (!identityRegistry.contains(identityId)) {
            return Result.notFound("身份不存在: " + identityId);
        }
        Optional<Block> block = miningService.mineOnce(identityId);
        // 预算耗尽不是错误
        return block.map(b -> Result.OK(BlockView.of(b)))
                .orElseGet(() -> Result.OK("本轮未找到区块", null));
    }

    @Override
    public Result<String> stopMining(String identityId) {
        if (!miningService.stop(identityId)) {
            return Result.notFound("身份未在挖矿: " + identityId);
        }
        return Result.OK(identityId);
    }

    @Override
    public Result<NodeStatus> status() {
        Block tip = ledger.tip();
        NodeStatus status = new NodeStatus();
        status.setNodeId(systemConfig.getNodeId());
        status.setPort(peerService.getPort());
        status.setHeight(tip.getIndex());
        status.setTipHash(tip.getHash().toHex());
        status.setCumulativeDifficulty(ledger.cumulativeDifficulty().toString());
        for (PeerSession session : sessionManager.established()) {
            status.getKnownPeers().add(PeerView.of(session));
        }
        status.setMiningIdentities(miningService.miningIdentities());
        status.setPendingTransfers(transferPool.size());
        return Result.OK(status);
    }

    @Override
    public Result<String> transfer(String fromId, String toId, String topic, String payload) {
        if (fromId == null || toId == null || topic == null || payload == null) {
            return Result.rejected("fromId/toId/topic/payload 均不能为空");
        }
        KnowledgeTransfer transfer = transferProtocol.prepare(fromId, toId, topic, payload);
        ValidationResult result = ledger.validateTransfer(transfer);
        if (!result.isOk()) {
            return Result.rejected(result.getReason() + ": " + result.getMessage());
        }
        if (!transferPool.add(transfer)) {
            return Result.rejected("知识转移已在待打包池中或池已满: " + transfer.contentId());
        }
        sessionManager.broadcastTransfer(transfer, null);
        log.info("提交知识转移 {} -> {} [{}] {}", fromId, toId, topic, transfer.contentId());
        return Result.OK(transfer.contentId().toHex());
    }

    @Override
    public Result<List<IdentityView>> identities() {
        List<IdentityView> views = new ArrayList<>();
        for (IdentityRecord record : identityRegistry.all()) {
            views.add(view(record));
        }
        return Result.OK(views);
    }

    @Override
    public Result<List<KnowledgeView>> knowledge(String identityId) {
        if (!identityRegistry.contains(identityId)) {
            return Result.notFound("身份不存在: " + identityId);
        }
        List<KnowledgeView> views = new ArrayList<>();
        for (KnowledgeTransfer transfer : knowledgeStore.knowledgeOf(identityId)) {
            views.add(KnowledgeView.of(transfer));
        }
        return Result.OK(views);
    }

    @Override
    public Result<IdentityView> evolve(String identityId) {
        Optional<IdentityRecord> evolved = identityRegistry.evolve(identityId);
        if (evolved.isEmpty()) {
            return Result.notFound("身份不存在: " + identityId);
        }
        sessionManager.broadcastIdentity(evolved.get(), null);
        return Result.OK(view(evolved.get()));
    }

    @Override
    public Result<BlockView> block(long index) {
        return ledger.blockAt(index)
                .map(b -> Result.OK(BlockView.of(b)))
                .orElseGet(() -> Result.notFound("区块不存在: " + index));
    }

    private IdentityView view(IdentityRecord record) {
        return IdentityView.of(record, scorer.score(record));
    }
}
