package com.bit.sigmos.p2p.impl;

import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.p2p.PeerService;
import com.bit.sigmos.p2p.protocol.P2PMessageCodec;
import com.bit.sigmos.p2p.protocol.ProtocolRegistry;
import com.bit.sigmos.p2p.protocol.impl.NetworkHandshakeHandler;
import com.bit.sigmos.p2p.session.PeerRole;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * TCP 节点服务
 * IO在Netty事件循环，账本相关处理在独立业务线程组，同一连接的消息按序处理
 */
@Slf4j
@Component
public class PeerServiceImpl implements PeerService {

    private static final int LENGTH_FIELD_BYTES = 4;

    private final SystemConfig systemConfig;
    private final P2pConfig p2pConfig;
    private final PeerSessionManager sessionManager;
    private final ProtocolRegistry protocolRegistry;
    private final NetworkHandshakeHandler handshakeHandler;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private EventExecutorGroup businessGroup;
    private Channel serverChannel;
    private Bootstrap bootstrap;
    private volatile int boundPort = -1;

    public PeerServiceImpl(SystemConfig systemConfig, P2pConfig p2pConfig, PeerSessionManager sessionManager,
                           ProtocolRegistry protocolRegistry, NetworkHandshakeHandler handshakeHandler) {
        this.systemConfig = systemConfig;
        this.p2pConfig = p2pConfig;
        this.sessionManager = sessionManager;
        this.protocolRegistry = protocolRegistry;
        this.handshakeHandler = handshakeHandler;
    }

    @Override
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("p2p-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("p2p-io"));
        businessGroup = new DefaultEventExecutorGroup(p2pConfig.getWorkerThreads(), new DefaultThreadFactory("p2p-worker"));

        ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT) // 池化内存分配（减少GC）
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        initPipeline(ch.pipeline(), PeerRole.ACCEPTOR, null);
                    }
                });

        bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, p2pConfig.getConnectTimeoutMs());

        serverChannel = serverBootstrap.bind(systemConfig.getHost(), systemConfig.getPort()).sync().channel();
        boundPort = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("P2P服务已启动，节点 {} 监听 {}:{}", systemConfig.getNodeId(), systemConfig.getHost(), boundPort);
    }

    private void initPipeline(ChannelPipeline pipeline, PeerRole role, CompletableFuture<PeerSession> connectFuture) {
        pipeline.addLast("idle", new IdleStateHandler(p2pConfig.getReadTimeoutMs(), p2pConfig.getKeepAliveMs(),
                0, TimeUnit.MILLISECONDS));
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(p2pConfig.getMaxFrameBytes(),
                0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("framePrepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast("codec", new P2PMessageCodec());
        pipeline.addLast(businessGroup, "peer", new PeerChannelHandler(role, sessionManager, protocolRegistry,
                handshakeHandler, p2pConfig, connectFuture));
    }

    @Override
    public CompletableFuture<PeerSession> connect(String host, int port) {
        CompletableFuture<PeerSession> future = new CompletableFuture<>();
        if (bootstrap == null) {
            future.completeExceptionally(new IllegalStateException("P2P服务未启动"));
            return future;
        }
        Bootstrap client = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                initPipeline(ch.pipeline(), PeerRole.INITIATOR, future);
            }
        });
        log.info("连接节点 {}:{}", host, port);
        client.connect(host, port).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("连接节点 {}:{} 失败: {}", host, port, f.cause().getMessage());
                future.completeExceptionally(f.cause());
            }
        });
        return future;
    }

    @Override
    public int getPort() {
        return boundPort;
    }

    @Override
    public List<PeerSession> sessions() {
        return sessionManager.all();
    }

    /**
     * 关闭服务器
     */
    @Override
    public synchronized void shutdown() {
        sessionManager.closeAll("节点关闭");
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
                log.info("P2P服务端Channel已关闭");
            } catch (InterruptedException e) {
                log.warn("关闭P2P Channel时线程中断", e);
                Thread.currentThread().interrupt();
            } finally {
                serverChannel = null;
            }
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (businessGroup != null) {
            businessGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS)
                    .addListener(future -> log.info("P2P业务线程组已关闭"));
            businessGroup = null;
        }
        bootstrap = null;
        boundPort = -1;
    }
}
