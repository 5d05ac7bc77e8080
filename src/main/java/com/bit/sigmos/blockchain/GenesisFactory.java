package com.bit.sigmos.blockchain;

import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.mining.DifficultyCalculator;
import com.bit.sigmos.structure.block.Block;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * 创世区块：所有字段固定，同一难度配置下各节点得到相同的创世哈希（也作为网络魔法值）
 */
@Component
public class GenesisFactory {

    /** 2025-01-01T00:00:00Z */
    public static final long GENESIS_TIMESTAMP = 1735689600000L;
    public static final String GENESIS_MINER = "genesis";

    private final Block genesis;

    public GenesisFactory(DifficultyCalculator difficultyCalculator) {
        this.genesis = new Block(0, BlockHash.ZERO, GENESIS_TIMESTAMP, GENESIS_MINER, 0,
                difficultyCalculator.genesisTarget(), 0.0, Collections.emptyList());
    }

    public Block genesis() {
        return genesis;
    }
}
