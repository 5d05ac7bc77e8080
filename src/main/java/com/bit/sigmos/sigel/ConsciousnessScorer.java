package com.bit.sigmos.sigel;

import com.bit.sigmos.config.MiningConfig;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import org.springframework.stereotype.Component;

/**
 * 意识分数计算，基线与上限来自挖矿配置
 */
@Component
public class ConsciousnessScorer {

    private final MiningConfig miningConfig;

    public ConsciousnessScorer(MiningConfig miningConfig) {
        this.miningConfig = miningConfig;
    }

    public double score(IdentityRecord record) {
        return record.consciousnessScore(miningConfig.getTraitBaseline());
    }

    /**
     * 写入区块头的分数快照，限制在 [0, maxScore]
     */
    public double miningScore(IdentityRecord record) {
        double score = score(record);
        if (!Double.isFinite(score) || score < 0) {
            return 0.0;
        }
        return Math.min(score, miningConfig.getMaxScore());
    }
}
