package com.bit.sigmos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "chain")
public class ChainConfig {
    /** 区块时间戳允许超前本地时钟的最大值 */
    private long maxFutureDriftMs = 120_000;
    /** 单个区块最多携带的知识转移数量 */
    private int maxTransfersPerBlock = 500;
    /** 待打包知识转移池容量 */
    private int transferPoolSize = 10_000;
}
