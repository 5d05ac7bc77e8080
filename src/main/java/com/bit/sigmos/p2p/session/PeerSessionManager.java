package com.bit.sigmos.p2p.session;

import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.netty.channel.ChannelId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 会话集合与广播
 * 全局最近已见缓存保证同一区块/转移只转发一次
 */
@Slf4j
@Component
public class PeerSessionManager {

    private final SystemConfig systemConfig;

    private final Map<ChannelId, PeerSession> sessions = new ConcurrentHashMap<>();
    /** 握手完成的会话，按对端节点ID索引 */
    private final Map<String, PeerSession> sessionsByNode = new ConcurrentHashMap<>();

    private final Cache<BlockHash, Boolean> seenBlocks;
    private final Cache<ContentHash, Boolean> seenTransfers;

    public PeerSessionManager(SystemConfig systemConfig, P2pConfig p2pConfig) {
        this.systemConfig = systemConfig;
        this.seenBlocks = Caffeine.newBuilder()
                .maximumSize(p2pConfig.getSeenCacheSize())
                .expireAfterWrite(p2pConfig.getSeenCacheTtlSeconds(), TimeUnit.SECONDS)
                .build();
        this.seenTransfers = Caffeine.newBuilder()
                .maximumSize(p2pConfig.getSeenCacheSize())
                .expireAfterWrite(p2pConfig.getSeenCacheTtlSeconds(), TimeUnit.SECONDS)
                .build();
    }

    public String localNodeId() {
        return systemConfig.getNodeId();
    }

    public void register(PeerSession session) {
        sessions.put(session.getChannel().id(), session);
    }

    public void unregister(PeerSession session) {
        sessions.remove(session.getChannel().id());
        String nodeId = session.getPeerNodeId();
        if (nodeId != null) {
            sessionsByNode.remove(nodeId, session);
        }
    }

    /**
     * 握手完成时按节点ID绑定
     * 同一对端存在两条连接时，保留发起方节点ID较小的那条，两端判断结果一致
     * @return 新会话是否保留
     */
    public boolean bindNodeId(PeerSession session) {
        String nodeId = session.getPeerNodeId();
        PeerSession[] loser = {null};
        PeerSession winner = sessionsByNode.compute(nodeId, (id, existing) -> {
            if (existing == null || !existing.getChannel().isActive()) {
                return session;
            }
            if (initiatorId(session).compareTo(initiatorId(existing)) < 0) {
                loser[0] = existing;
                return session;
            }
            loser[0] = session;
            return existing;
        });
        if (loser[0] != null && loser[0] != session) {
            loser[0].disconnect("与节点 " + nodeId + " 的重复连接");
        }
        return winner == session;
    }

    private String initiatorId(PeerSession session) {
        return session.getRole() == PeerRole.INITIATOR ? localNodeId() : session.getPeerNodeId();
    }

    public Optional<PeerSession> byNodeId(String nodeId) {
        return Optional.ofNullable(sessionsByNode.get(nodeId));
    }

    public List<PeerSession> established() {
        List<PeerSession> list = new ArrayList<>();
        for (PeerSession session : sessions.values()) {
            if (session.isEstablished()) {
                list.add(session);
            }
        }
        return list;
    }

    public List<PeerSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public void closeAll(String reason) {
        for (PeerSession session : all()) {
            session.disconnect(reason);
        }
    }

    // ========================== 去重 ==========================

    /**
     * @return 首次见到返回true
     */
    public boolean markSeenBlock(BlockHash hash) {
        return seenBlocks.asMap().putIfAbsent(hash, Boolean.TRUE) == null;
    }

    public boolean hasSeenBlock(BlockHash hash) {
        return seenBlocks.getIfPresent(hash) != null;
    }

    public boolean markSeenTransfer(ContentHash id) {
        return seenTransfers.asMap().putIfAbsent(id, Boolean.TRUE) == null;
    }

    // ========================== 广播 ==========================

    /**
     * 转发区块给除来源外、未确认已知该区块的所有会话
     * @param source 来源会话，本地出块为null
     * @return 实际发送的会话数
     */
    public int broadcastBlock(Block block, PeerSession source) {
        markSeenBlock(block.getHash());
        byte[] data = block.serialize();
        int sent = 0;
        for (PeerSession session : established()) {
            if (session == source || session.knowsBlock(block.getHash())) {
                continue;
            }
            session.markKnownBlock(block.getHash());
            session.send(ProtocolEnum.BLOCK_ANNOUNCE, data);
            sent++;
        }
        log.debug("广播区块 {} 到 {} 个节点", block.getIndex(), sent);
        return sent;
    }

    public int broadcastTransfer(KnowledgeTransfer transfer, PeerSession source) {
        markSeenTransfer(transfer.contentId());
        byte[] data = transfer.serialize();
        int sent = 0;
        for (PeerSession session : established()) {
            if (session == source || session.knowsTransfer(transfer.contentId())) {
                continue;
            }
            session.markKnownTransfer(transfer.contentId());
            session.send(ProtocolEnum.TRANSFER_ANNOUNCE, data);
            sent++;
        }
        return sent;
    }

    /**
     * 身份快照由注册表按训练次数去重，这里只排除来源
     */
    public int broadcastIdentity(IdentityRecord record, PeerSession source) {
        byte[] data = record.serialize();
        int sent = 0;
        for (PeerSession session : established()) {
            if (session == source) {
                continue;
            }
            session.send(ProtocolEnum.IDENTITY_ANNOUNCE, data);
            sent++;
        }
        return sent;
    }
}
