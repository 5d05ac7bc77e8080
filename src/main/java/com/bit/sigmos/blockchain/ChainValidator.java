package com.bit.sigmos.blockchain;

import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.config.ChainConfig;
import com.bit.sigmos.mining.DifficultyCalculator;
import com.bit.sigmos.sigel.ConsciousnessScorer;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.transfer.KnowledgeTransferProtocol;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 区块规则校验，不持有状态，账本在锁内调用
 * 检查顺序：高度 → 哈希链接 → 时间戳 → 难度目标 → 矿工分数 → 工作量 → 知识转移
 */
@Component
public class ChainValidator {

    private final GenesisFactory genesisFactory;
    private final DifficultyCalculator difficultyCalculator;
    private final KnowledgeTransferProtocol transferProtocol;
    private final ChainConfig chainConfig;
    private final IdentityRegistry identityRegistry;
    private final ConsciousnessScorer scorer;

    public ChainValidator(GenesisFactory genesisFactory, DifficultyCalculator difficultyCalculator,
                          KnowledgeTransferProtocol transferProtocol, ChainConfig chainConfig,
                          IdentityRegistry identityRegistry, ConsciousnessScorer scorer) {
        this.genesisFactory = genesisFactory;
        this.difficultyCalculator = difficultyCalculator;
        this.transferProtocol = transferProtocol;
        this.chainConfig = chainConfig;
        this.identityRegistry = identityRegistry;
        this.scorer = scorer;
    }

    /**
     * 校验追加在 prefix 之后的区块
     * @param prefix 从创世开始的链前缀
     * @param committed prefix 中已包含的知识转移内容哈希 → 所在高度
     */
    public ValidationResult validateNext(Block candidate, List<Block> prefix, Map<ContentHash, Long> committed) {
        Block parent = prefix.get(prefix.size() - 1);
        if (candidate.getIndex() != parent.getIndex() + 1) {
            return ValidationResult.reject(RejectReason.STALE_INDEX,
                    "期望高度 " + (parent.getIndex() + 1) + "，实际 " + candidate.getIndex());
        }
        if (!candidate.declaredHashMatches()) {
            return ValidationResult.reject(RejectReason.HASH_MISMATCH,
                    "区块哈希与内容不符: 声明 " + candidate.getDeclaredHash() + "，计算 " + candidate.getHash());
        }
        if (!candidate.getPreviousHash().equals(parent.getHash())) {
            return ValidationResult.reject(RejectReason.HASH_MISMATCH,
                    "父哈希不匹配: " + candidate.getPreviousHash() + " != " + parent.getHash());
        }
        if (candidate.getTimestamp() < parent.getTimestamp()) {
            return ValidationResult.reject(RejectReason.NON_MONOTONIC_TIMESTAMP,
                    "时间戳早于父区块: " + candidate.getTimestamp() + " < " + parent.getTimestamp());
        }
        long maxAllowed = System.currentTimeMillis() + chainConfig.getMaxFutureDriftMs();
        if (candidate.getTimestamp() > maxAllowed) {
            return ValidationResult.reject(RejectReason.NON_MONOTONIC_TIMESTAMP,
                    "时间戳超前本地时钟过多: " + candidate.getTimestamp());
        }

        BigInteger expectedTarget = difficultyCalculator.expectedTarget(prefix);
        if (!candidate.getDifficultyTarget().equals(expectedTarget)) {
            return ValidationResult.reject(RejectReason.DIFFICULTY_NOT_MET,
                    "难度目标不符合调整规则: " + candidate.getDifficultyTarget().toString(16)
                            + " != " + expectedTarget.toString(16));
        }
        if (!difficultyCalculator.isDeclaredScoreValid(candidate.getMinerScore())) {
            return ValidationResult.reject(RejectReason.DIFFICULTY_NOT_MET,
                    "矿工分数超出范围: " + candidate.getMinerScore());
        }
        ValidationResult minerResult = validateMinerScore(candidate);
        if (!minerResult.isOk()) {
            return minerResult;
        }
        if (!difficultyCalculator.isAccepted(candidate.getHash().toUnsignedBigInteger(),
                candidate.getDifficultyTarget(), candidate.getMinerScore())) {
            return ValidationResult.reject(RejectReason.DIFFICULTY_NOT_MET, "区块哈希未达到有效阈值");
        }

        return validateTransfers(candidate, committed);
    }

    /**
     * 声明分数不得超过注册表中该矿工身份推导出的分数
     * 演化只会提高分数，所以按当前快照校验历史区块结果不变
     */
    private ValidationResult validateMinerScore(Block candidate) {
        Optional<IdentityRecord> miner = identityRegistry.get(candidate.getMinerId());
        if (miner.isEmpty()) {
            return ValidationResult.reject(RejectReason.DIFFICULTY_NOT_MET, "未知矿工身份: " + candidate.getMinerId());
        }
        double derived = scorer.miningScore(miner.get());
        if (candidate.getMinerScore() > derived) {
            return ValidationResult.reject(RejectReason.DIFFICULTY_NOT_MET,
                    "声明分数 " + candidate.getMinerScore() + " 高于身份推导分数 " + derived);
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateTransfers(Block candidate, Map<ContentHash, Long> committed) {
        List<KnowledgeTransfer> transfers = candidate.getTransactions();
        if (transfers.size() > chainConfig.getMaxTransfersPerBlock()) {
            return ValidationResult.reject(RejectReason.INVALID_TRANSACTION,
                    "区块知识转移数量超限: " + transfers.size());
        }
        Set<ContentHash> inBlock = new HashSet<>();
        for (KnowledgeTransfer transfer : transfers) {
            ValidationResult content = transferProtocol.validateContent(transfer);
            if (!content.isOk()) {
                return content;
            }
            Long existing = committed.get(transfer.contentId());
            if (existing != null) {
                return KnowledgeTransferProtocol.duplicate(transfer, existing);
            }
            if (!inBlock.add(transfer.contentId())) {
                return KnowledgeTransferProtocol.duplicate(transfer, candidate.getIndex());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * 从创世开始完整校验一条链
     */
    public ValidationResult validateChain(List<Block> chain) {
        if (chain == null || chain.isEmpty()) {
            return ValidationResult.reject(RejectReason.STALE_INDEX, "链为空");
        }
        Block genesis = chain.get(0);
        if (!genesis.declaredHashMatches() || !genesis.equals(genesisFactory.genesis())) {
            return ValidationResult.reject(RejectReason.HASH_MISMATCH, "创世区块不一致: " + genesis.getHash());
        }
        Map<ContentHash, Long> committed = new HashMap<>();
        for (int i = 1; i < chain.size(); i++) {
            Block block = chain.get(i);
            ValidationResult result = validateNext(block, chain.subList(0, i), committed);
            if (!result.isOk()) {
                return ValidationResult.reject(result.getReason(), "高度 " + i + ": " + result.getMessage());
            }
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                committed.put(transfer.contentId(), block.getIndex());
            }
        }
        return ValidationResult.ok();
    }
}
