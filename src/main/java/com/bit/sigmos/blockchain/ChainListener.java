package com.bit.sigmos.blockchain;

import com.bit.sigmos.structure.block.Block;

import java.util.List;

/**
 * 账本变更通知，在账本写锁内、状态更新之后按注册顺序回调
 * 实现可以读取账本，但不能持有自己的锁去等待账本写锁
 */
public interface ChainListener {

    void onBlockAppended(Block block);

    /**
     * 链切换
     * @param removed 被替换掉的旧链区块（分叉点之后，按高度升序）
     * @param added 新链上分叉点之后的区块（按高度升序）
     */
    void onChainReplaced(List<Block> removed, List<Block> added);
}
