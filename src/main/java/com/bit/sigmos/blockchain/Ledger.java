package com.bit.sigmos.blockchain;

import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * 账本：本节点认可的活动链
 * 所有读方法返回一致性快照，写方法在持久化成功后才对外可见
 */
public interface Ledger {

    /**
     * 从存储加载链，空库时写入创世区块
     */
    void load();

    /**
     * 追加区块，只接受高度为 height+1 且满足全部链规则的区块
     */
    ValidationResult append(Block candidate);

    /**
     * 候选链从创世开始完整校验，累计难度严格大于当前链时切换
     * @return 是否发生切换；难度相等时保留当前链
     */
    boolean replaceIfBetter(List<Block> candidate);

    Block tip();

    long height();

    Block genesis();

    BigInteger cumulativeDifficulty();

    /**
     * 读取 [fromIndex, fromIndex + limit) 范围内的区块
     */
    List<Block> blocksFrom(long fromIndex, int limit);

    Optional<Block> blockAt(long index);

    ValidationResult validateChain(List<Block> chain);

    /**
     * 校验待打包的知识转移：内容合法且未在活动链上出现
     */
    ValidationResult validateTransfer(KnowledgeTransfer transfer);

    boolean containsTransfer(KnowledgeTransfer transfer);

    /**
     * 以给定区块为父块时下一个区块应声明的难度目标
     * @return 给定区块已不在活动链上时为空
     */
    Optional<BigInteger> nextTarget(Block parent);

    void addListener(ChainListener listener);
}
