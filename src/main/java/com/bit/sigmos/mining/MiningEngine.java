package com.bit.sigmos.mining;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.config.MiningConfig;
import com.bit.sigmos.sigel.ConsciousnessScorer;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * 单轮挖矿：在预算内搜索nonce，不阻塞任何网络IO
 */
@Slf4j
@Component
public class MiningEngine {

    private final Ledger ledger;
    private final DifficultyCalculator difficultyCalculator;
    private final ConsciousnessScorer scorer;
    private final MiningConfig miningConfig;

    public MiningEngine(Ledger ledger, DifficultyCalculator difficultyCalculator, ConsciousnessScorer scorer,
                        MiningConfig miningConfig) {
        this.ledger = ledger;
        this.difficultyCalculator = difficultyCalculator;
        this.scorer = scorer;
        this.miningConfig = miningConfig;
    }

    public Optional<Block> attempt(Block tip, IdentityRecord miner, List<KnowledgeTransfer> transfers) {
        return attempt(tip, miner, transfers, () -> false);
    }

    /**
     * @param cancelled 每 cancelCheckInterval 个nonce检查一次，为true时放弃本轮
     * @return 预算耗尽、被取消或tip已过期时为空
     */
    public Optional<Block> attempt(Block tip, IdentityRecord miner, List<KnowledgeTransfer> transfers,
                                   BooleanSupplier cancelled) {
        Optional<BigInteger> nextTarget = ledger.nextTarget(tip);
        if (nextTarget.isEmpty()) {
            log.debug("父区块已不在活动链上，放弃本轮: {}", tip.getHash());
            return Optional.empty();
        }
        BigInteger target = nextTarget.get();
        // 本轮只取一次分数快照
        double score = scorer.miningScore(miner);
        BigInteger threshold = difficultyCalculator.effectiveThreshold(target, score);

        long index = tip.getIndex() + 1;
        long timestamp = Math.max(System.currentTimeMillis(), tip.getTimestamp());
        byte[] transactionsRoot = Block.transactionsRoot(transfers);
        long budget = miningConfig.getAttemptBudget();
        int checkInterval = Math.max(1, miningConfig.getCancelCheckInterval());
        long nonce = ThreadLocalRandom.current().nextLong();

        for (long i = 0; i < budget; i++, nonce++) {
            if (i % checkInterval == 0 && cancelled.getAsBoolean()) {
                log.debug("挖矿被取消，已尝试 {} 个nonce", i);
                return Optional.empty();
            }
            byte[] header = Block.headerBytes(index, tip.getHash(), timestamp, miner.getId(), nonce,
                    target, score, transactionsRoot);
            if (Block.computeHash(header).toUnsignedBigInteger().compareTo(threshold) < 0) {
                Block block = new Block(index, tip.getHash(), timestamp, miner.getId(), nonce,
                        target, score, transfers);
                log.debug("找到区块 高度={} nonce={} 尝试次数={}", index, nonce, i + 1);
                return Optional.of(block);
            }
        }
        log.debug("本轮预算耗尽 高度={} 预算={}", index, budget);
        return Optional.empty();
    }
}
