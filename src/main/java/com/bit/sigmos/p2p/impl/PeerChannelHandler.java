package com.bit.sigmos.p2p.impl;

import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolRegistry;
import com.bit.sigmos.p2p.protocol.impl.NetworkHandshakeHandler;
import com.bit.sigmos.p2p.session.PeerRole;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.p2p.session.PeerState;
import com.bit.sigmos.p2p.session.ProtocolViolationException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 每个连接一个实例，运行在业务线程组上（不占用IO线程）
 * 负责会话生命周期：建立 → 握手 → 分发 → 保活 → 断开
 */
@Slf4j
public class PeerChannelHandler extends SimpleChannelInboundHandler<P2PMessage> {

    private final PeerRole role;
    private final PeerSessionManager sessionManager;
    private final ProtocolRegistry protocolRegistry;
    private final NetworkHandshakeHandler handshakeHandler;
    private final P2pConfig p2pConfig;
    /** 主动连接时由调用方等待握手结果 */
    private final CompletableFuture<PeerSession> connectFuture;

    private PeerSession session;

    public PeerChannelHandler(PeerRole role, PeerSessionManager sessionManager, ProtocolRegistry protocolRegistry,
                              NetworkHandshakeHandler handshakeHandler, P2pConfig p2pConfig,
                              CompletableFuture<PeerSession> connectFuture) {
        this.role = role;
        this.sessionManager = sessionManager;
        this.protocolRegistry = protocolRegistry;
        this.handshakeHandler = handshakeHandler;
        this.p2pConfig = p2pConfig;
        this.connectFuture = connectFuture;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        session = new PeerSession(ctx.channel(), role);
        if (connectFuture != null) {
            session.getHandshakeFuture().whenComplete((s, e) -> {
                if (e != null) {
                    connectFuture.completeExceptionally(e);
                } else {
                    connectFuture.complete(s);
                }
            });
        }
        sessionManager.register(session);
        session.transition(PeerState.CONNECTING);
        session.transition(PeerState.HANDSHAKING);
        session.setHandshakeTimeout(ctx.executor().schedule(() -> {
            if (session.getState() == PeerState.HANDSHAKING) {
                session.disconnect("握手超时");
            }
        }, p2pConfig.getHandshakeTimeoutMs(), TimeUnit.MILLISECONDS));
        session.send(ProtocolEnum.HELLO, handshakeHandler.localHello().serialize());
        log.debug("连接建立 {}", session);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, P2PMessage msg) throws Exception {
        protocolRegistry.dispatch(session, msg);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent idle = (IdleStateEvent) evt;
            switch (idle.state()) {
                case WRITER_IDLE:
                    if (session != null && session.isEstablished()) {
                        session.send(ProtocolEnum.STATUS_REQUEST, new byte[0]);
                    }
                    break;
                case READER_IDLE:
                    if (session != null) {
                        session.disconnect("读空闲超时");
                    } else {
                        ctx.close();
                    }
                    break;
                default:
                    break;
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            session.disconnect("连接关闭");
            sessionManager.unregister(session);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ProtocolViolationException) {
            log.warn("协议违规，断开 {}: {}", session, cause.getMessage());
        } else {
            log.warn("会话异常，断开 {}", session, cause);
        }
        if (session != null) {
            session.disconnect(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } else {
            ctx.close();
        }
    }
}
