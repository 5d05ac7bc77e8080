package com.bit.sigmos.blockchain;

import com.bit.sigmos.structure.block.Block;

import java.math.BigInteger;
import java.util.List;

/**
 * 累计难度计算：work(t) = 2^256 / (t + 1)
 */
public final class ChainWork {

    private static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(256);

    private ChainWork() {
    }

    public static BigInteger work(BigInteger target) {
        return TWO_256.divide(target.add(BigInteger.ONE));
    }

    public static BigInteger work(Block block) {
        return work(block.getDifficultyTarget());
    }

    public static BigInteger cumulative(List<Block> chain) {
        BigInteger total = BigInteger.ZERO;
        for (Block block : chain) {
            total = total.add(work(block));
        }
        return total;
    }
}
