package com.bit.sigmos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "p2p")
public class P2pConfig {
    private int connectTimeoutMs = 3000;
    /** 握手必须在该时间内完成，否则断开 */
    private int handshakeTimeoutMs = 5000;
    /** 读空闲超时，超时断开会话 */
    private int readTimeoutMs = 30_000;
    /** 写空闲时发送状态查询保活 */
    private int keepAliveMs = 10_000;
    private int maxFrameBytes = 8 * 1024 * 1024;
    private int maxBlocksPerResponse = 500;
    /** 同步时从本地高度往回多少个区块开始请求，用于定位分叉点 */
    private int syncLookback = 16;
    /** 单次同步累计接收区块上限 */
    private int maxSyncBlocks = 100_000;
    private int seenCacheSize = 10_000;
    private int seenCacheTtlSeconds = 600;
    /** 业务处理线程（账本读写不占用IO线程） */
    private int workerThreads = 4;
}
