package com.bit.sigmos.txpool;

import com.bit.sigmos.blockchain.ChainListener;
import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.config.ChainConfig;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 待打包知识转移池，按到达顺序出池，按内容去重
 */
@Slf4j
@Component
public class TransferPool implements ChainListener {

    private final Ledger ledger;
    private final ChainConfig chainConfig;
    private final Map<ContentHash, KnowledgeTransfer> pending = new LinkedHashMap<>();

    public TransferPool(Ledger ledger, ChainConfig chainConfig) {
        this.ledger = ledger;
        this.chainConfig = chainConfig;
    }

    /**
     * 先入池再查账本：查询之后才上链的区块会经由监听回调把它移除
     * 持有池锁时不访问账本，账本回调在写锁内获取池锁
     * @return 新加入返回true；重复、已上链或池满返回false
     */
    public boolean add(KnowledgeTransfer transfer) {
        synchronized (this) {
            if (pending.containsKey(transfer.contentId())) {
                return false;
            }
            if (pending.size() >= chainConfig.getTransferPoolSize()) {
                log.warn("知识转移池已满({})，丢弃 {}", pending.size(), transfer.contentId());
                return false;
            }
            pending.put(transfer.contentId(), transfer);
        }
        if (ledger.containsTransfer(transfer)) {
            synchronized (this) {
                pending.remove(transfer.contentId());
            }
            return false;
        }
        return true;
    }

    public synchronized boolean contains(KnowledgeTransfer transfer) {
        return pending.containsKey(transfer.contentId());
    }

    public synchronized int size() {
        return pending.size();
    }

    /**
     * 取出待打包的转移（不移除，上链后通过监听清理），跳过当前已不合法的
     */
    public List<KnowledgeTransfer> select(int limit) {
        List<KnowledgeTransfer> candidates;
        synchronized (this) {
            candidates = new ArrayList<>(pending.values());
        }
        List<KnowledgeTransfer> selected = new ArrayList<>();
        for (KnowledgeTransfer transfer : candidates) {
            if (selected.size() >= limit) {
                break;
            }
            if (ledger.validateTransfer(transfer).isOk()) {
                selected.add(transfer);
            }
        }
        return selected;
    }

    @Override
    public synchronized void onBlockAppended(Block block) {
        for (KnowledgeTransfer transfer : block.getTransactions()) {
            pending.remove(transfer.contentId());
        }
    }

    /**
     * 被替换掉的区块里、新链上没有的转移重新入池
     */
    @Override
    public synchronized void onChainReplaced(List<Block> removed, List<Block> added) {
        Set<ContentHash> nowCommitted = new HashSet<>();
        for (Block block : added) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                nowCommitted.add(transfer.contentId());
                pending.remove(transfer.contentId());
            }
        }
        int restored = 0;
        for (Block block : removed) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                if (!nowCommitted.contains(transfer.contentId()) && !ledger.containsTransfer(transfer)
                        && pending.size() < chainConfig.getTransferPoolSize()
                        && pending.putIfAbsent(transfer.contentId(), transfer) == null) {
                    restored++;
                }
            }
        }
        if (restored > 0) {
            log.info("链切换后 {} 个知识转移重新入池", restored);
        }
    }
}
