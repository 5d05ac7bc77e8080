package com.bit.sigmos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 挖矿与难度调整参数
 * 意识分数的权重常量均可配置，不在代码中写死
 */
@Data
@Component
@ConfigurationProperties(prefix = "mining")
public class MiningConfig {
    /** 创世难度：目标值 = 2^(256 - bits) */
    private int initialDifficultyBits = 16;
    /** 每隔多少个区块调整一次难度 */
    private int retargetInterval = 10;
    /** 期望出块间隔（毫秒） */
    private long targetBlockTimeMs = 10_000;
    /** 单次调整的最大倍数（上下对称） */
    private double maxAdjustmentFactor = 4.0;
    /** 单轮尝试的nonce数量上限，耗尽视为本轮未出块 */
    private long attemptBudget = 1_000_000;
    /** 每隔多少个nonce检查一次取消信号 */
    private int cancelCheckInterval = 1024;
    /** 有效阈值 = target × (1 + scoreWeight × min(score, maxScore)) */
    private double scoreWeight = 1.0;
    private double maxScore = 100.0;
    /** 意识分数公式中 (baseline + mean(traits)) 的基线 */
    private double traitBaseline = 1.0;
    /** 挖矿线程数上限 */
    private int maxMiners = 8;
}
