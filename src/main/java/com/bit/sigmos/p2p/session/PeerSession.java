package com.bit.sigmos.p2p.session;

import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.structure.block.Block;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单个对端的会话，随连接创建、随断开销毁，只由网络层持有
 */
@Slf4j
public class PeerSession {

    private static final int KNOWN_CACHE_SIZE = 4096;

    @Getter
    private final Channel channel;
    @Getter
    private final PeerRole role;
    private final AtomicReference<PeerState> state = new AtomicReference<>(PeerState.DISCONNECTED);
    /** 握手完成（进入SYNCED）或失败时结束 */
    @Getter
    private final CompletableFuture<PeerSession> handshakeFuture = new CompletableFuture<>();

    @Getter @Setter
    private volatile int negotiatedVersion;
    @Getter @Setter
    private volatile String peerNodeId;
    @Getter
    private volatile long peerHeight = -1;
    @Getter
    private volatile BlockHash peerTipHash;
    @Setter
    private volatile ScheduledFuture<?> handshakeTimeout;

    // 对端已知的区块/转移，避免回传
    private final Cache<BlockHash, Boolean> knownBlocks = Caffeine.newBuilder().maximumSize(KNOWN_CACHE_SIZE).build();
    private final Cache<ContentHash, Boolean> knownTransfers = Caffeine.newBuilder().maximumSize(KNOWN_CACHE_SIZE).build();

    // 同步状态，只在该会话的处理线程内读写
    private final AtomicBoolean syncInFlight = new AtomicBoolean(false);
    @Getter
    private final List<Block> syncBuffer = new ArrayList<>();
    @Getter @Setter
    private long syncFromIndex;

    public PeerSession(Channel channel, PeerRole role) {
        this.channel = channel;
        this.role = role;
    }

    public PeerState getState() {
        return state.get();
    }

    /**
     * 状态迁移，非法迁移视为协议违规
     */
    public void transition(PeerState next) {
        while (true) {
            PeerState current = state.get();
            if (!current.canTransitionTo(next)) {
                throw new ProtocolViolationException("非法的会话状态迁移: " + current + " -> " + next + " " + this);
            }
            if (state.compareAndSet(current, next)) {
                log.debug("会话状态 {} -> {} {}", current, next, this);
                if (next == PeerState.SYNCED) {
                    cancelHandshakeTimeout();
                    handshakeFuture.complete(this);
                }
                return;
            }
        }
    }

    /**
     * 条件迁移：仅当当前状态为 expected 时迁移
     */
    public boolean transitionIf(PeerState expected, PeerState next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException("非法的会话状态迁移: " + expected + " -> " + next);
        }
        return state.compareAndSet(expected, next);
    }

    /**
     * 标记断开并关闭连接，可重复调用
     */
    public void disconnect(String reason) {
        PeerState previous = state.getAndSet(PeerState.DISCONNECTED);
        cancelHandshakeTimeout();
        if (!handshakeFuture.isDone()) {
            handshakeFuture.completeExceptionally(new IllegalStateException("握手未完成即断开: " + reason));
        }
        if (previous != PeerState.DISCONNECTED) {
            log.info("断开会话 {}，原因: {}", this, reason);
        }
        if (channel.isOpen()) {
            channel.close();
        }
    }

    public boolean isEstablished() {
        return getState().isEstablished() && channel.isActive();
    }

    public ChannelFuture send(ProtocolEnum protocol, byte[] data) {
        return channel.writeAndFlush(P2PMessage.of(protocol, data));
    }

    public void updatePeerTip(long height, BlockHash tipHash) {
        if (height >= peerHeight) {
            this.peerHeight = height;
            this.peerTipHash = tipHash;
        }
    }

    public boolean knowsBlock(BlockHash hash) {
        return knownBlocks.getIfPresent(hash) != null;
    }

    public void markKnownBlock(BlockHash hash) {
        knownBlocks.put(hash, Boolean.TRUE);
    }

    public boolean knowsTransfer(ContentHash id) {
        return knownTransfers.getIfPresent(id) != null;
    }

    public void markKnownTransfer(ContentHash id) {
        knownTransfers.put(id, Boolean.TRUE);
    }

    public boolean beginSync() {
        return syncInFlight.compareAndSet(false, true);
    }

    public void endSync() {
        syncBuffer.clear();
        syncInFlight.set(false);
    }

    public boolean isSyncInFlight() {
        return syncInFlight.get();
    }

    public SocketAddress getRemoteAddress() {
        return channel.remoteAddress();
    }

    private void cancelHandshakeTimeout() {
        ScheduledFuture<?> timeout = handshakeTimeout;
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PeerSession{" + role + " " + channel.remoteAddress() + " node=" + peerNodeId + " state=" + state.get() + "}";
    }
}
