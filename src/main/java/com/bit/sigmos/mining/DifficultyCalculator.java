package com.bit.sigmos.mining;

import com.bit.sigmos.config.MiningConfig;
import com.bit.sigmos.structure.block.Block;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;

/**
 * 难度目标计算
 * 目标值越小难度越高；意识分数只放宽有效阈值，不改变声明的目标
 */
@Component
public class DifficultyCalculator {

    /** 最大目标值 2^256 - 1 */
    public static final BigInteger MAX_TARGET = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static final MathContext MC = MathContext.DECIMAL128;

    private final MiningConfig miningConfig;

    public DifficultyCalculator(MiningConfig miningConfig) {
        this.miningConfig = miningConfig;
    }

    /**
     * 创世目标 = 2^(256 - bits)
     */
    public BigInteger genesisTarget() {
        int bits = miningConfig.getInitialDifficultyBits();
        if (bits <= 0) {
            return MAX_TARGET;
        }
        if (bits >= 256) {
            return BigInteger.ONE;
        }
        return BigInteger.ONE.shiftLeft(256 - bits);
    }

    /**
     * 计算追加在 prefix 之后的区块应声明的目标
     * prefix 为从创世开始的完整前缀，下一块高度 n = prefix.size()
     * 仅当 n 是调整间隔的整数倍时调整；统计窗口为最近 interval 个出块间隔，不含创世区块
     */
    public BigInteger expectedTarget(List<Block> prefix) {
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("前缀至少包含创世区块");
        }
        Block last = prefix.get(prefix.size() - 1);
        BigInteger previousTarget = last.getDifficultyTarget();
        int interval = miningConfig.getRetargetInterval();
        int n = prefix.size();
        if (interval <= 0 || n % interval != 0 || n - interval - 1 < 1) {
            return previousTarget;
        }
        Block first = prefix.get(n - interval - 1);
        return retarget(previousTarget, last.getTimestamp() - first.getTimestamp(), interval);
    }

    /**
     * new = old × actual / expected，调整系数限制在 [1/maxAdj, maxAdj]，结果限制在 [1, MAX_TARGET]
     */
    public BigInteger retarget(BigInteger previousTarget, long actualSpanMs, int blocks) {
        long actual = Math.max(1, actualSpanMs);
        long expected = Math.max(1, blocks * miningConfig.getTargetBlockTimeMs());
        double maxAdjustment = Math.max(1.0, miningConfig.getMaxAdjustmentFactor());

        BigDecimal factor = BigDecimal.valueOf(actual).divide(BigDecimal.valueOf(expected), MC);
        BigDecimal upper = BigDecimal.valueOf(maxAdjustment);
        BigDecimal lower = BigDecimal.ONE.divide(upper, MC);
        if (factor.compareTo(upper) > 0) {
            factor = upper;
        } else if (factor.compareTo(lower) < 0) {
            factor = lower;
        }

        BigInteger next = new BigDecimal(previousTarget).multiply(factor, MC).toBigInteger();
        if (next.signum() <= 0) {
            return BigInteger.ONE;
        }
        return next.min(MAX_TARGET);
    }

    /**
     * 有效阈值 = target × (1 + scoreWeight × min(score, maxScore))
     */
    public BigInteger effectiveThreshold(BigInteger target, double score) {
        double capped = Math.min(Math.max(score, 0.0), miningConfig.getMaxScore());
        BigDecimal multiplier = BigDecimal.ONE.add(
                BigDecimal.valueOf(miningConfig.getScoreWeight()).multiply(BigDecimal.valueOf(capped), MC));
        return new BigDecimal(target).multiply(multiplier, MC).toBigInteger();
    }

    /**
     * 哈希值严格小于有效阈值即接受，分数越高可接受的哈希集合越大
     */
    public boolean isAccepted(BigInteger hashValue, BigInteger target, double score) {
        return hashValue.compareTo(effectiveThreshold(target, score)) < 0;
    }

    public boolean isDeclaredScoreValid(double score) {
        return Double.isFinite(score) && score >= 0.0 && score <= miningConfig.getMaxScore();
    }
}
