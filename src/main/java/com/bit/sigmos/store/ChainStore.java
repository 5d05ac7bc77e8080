package com.bit.sigmos.store;

import com.bit.sigmos.structure.block.Block;

import java.util.List;

/**
 * 活动链的持久化
 * 所有写操作失败时抛出 ChainPersistenceException
 */
public interface ChainStore {

    /**
     * 按高度顺序读取已保存的整条链，空库返回空列表
     */
    List<Block> loadChain();

    void append(Block block);

    /**
     * 原子地把分叉点之后的区块替换为新区块
     * @param forkIndex 第一个不同区块的高度
     * @param added 新链在 forkIndex 及之后的区块
     * @param previousHeight 替换前的链高度
     */
    void replace(long forkIndex, List<Block> added, long previousHeight);
}
