package com.bit.sigmos.p2p;

import com.bit.sigmos.p2p.session.PeerSession;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface PeerService {

    /**
     * 启动监听，端口为0时由系统分配
     */
    void start() throws InterruptedException;

    /**
     * 主动连接对端
     * @return 握手完成后结束；连接失败、握手失败或超时时异常结束
     */
    CompletableFuture<PeerSession> connect(String host, int port);

    /**
     * 实际监听端口，未启动时为 -1
     */
    int getPort();

    List<PeerSession> sessions();

    void shutdown();
}
