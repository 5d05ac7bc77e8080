package com.bit.sigmos.blockchain.impl;

import com.bit.sigmos.blockchain.ChainListener;
import com.bit.sigmos.blockchain.ChainPersistenceException;
import com.bit.sigmos.blockchain.ChainValidator;
import com.bit.sigmos.blockchain.ChainWork;
import com.bit.sigmos.blockchain.GenesisFactory;
import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.config.FatalErrorHandler;
import com.bit.sigmos.mining.DifficultyCalculator;
import com.bit.sigmos.store.ChainStore;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.transfer.KnowledgeTransferProtocol;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 账本实现
 * 读写锁保护活动链、已打包转移索引和累计难度；先持久化后更新内存，监听器在写锁内按提交顺序回调
 */
@Slf4j
@Component
public class LedgerImpl implements Ledger {

    private final ChainValidator validator;
    private final ChainStore chainStore;
    private final GenesisFactory genesisFactory;
    private final DifficultyCalculator difficultyCalculator;
    private final KnowledgeTransferProtocol transferProtocol;
    private final FatalErrorHandler fatalErrorHandler;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ChainListener> listeners = new CopyOnWriteArrayList<>();

    // 以下状态只在写锁内修改
    private List<Block> chain = new ArrayList<>();
    private Map<ContentHash, Long> committedTransfers = new HashMap<>();
    private BigInteger cumulativeDifficulty = BigInteger.ZERO;

    public LedgerImpl(ChainValidator validator, ChainStore chainStore, GenesisFactory genesisFactory,
                      DifficultyCalculator difficultyCalculator, KnowledgeTransferProtocol transferProtocol,
                      FatalErrorHandler fatalErrorHandler) {
        this.validator = validator;
        this.chainStore = chainStore;
        this.genesisFactory = genesisFactory;
        this.difficultyCalculator = difficultyCalculator;
        this.transferProtocol = transferProtocol;
        this.fatalErrorHandler = fatalErrorHandler;
    }

    @Override
    public void load() {
        lock.writeLock().lock();
        try {
            List<Block> stored = persist("加载链", chainStore::loadChain);
            if (stored.isEmpty()) {
                Block genesis = genesisFactory.genesis();
                persist("写入创世区块", () -> {
                    chainStore.append(genesis);
                    return null;
                });
                stored = Collections.singletonList(genesis);
                log.info("初始化创世区块: {}", genesis.getHash());
            } else {
                ValidationResult result = validator.validateChain(stored);
                if (!result.isOk()) {
                    ChainPersistenceException e = new ChainPersistenceException("本地链数据校验失败: " + result);
                    fatalErrorHandler.handle(e.getMessage(), e);
                    throw e;
                }
            }
            resetState(stored);
            log.info("账本加载完成，高度 {}，tip {}", height(), tip().getHash());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ValidationResult append(Block candidate) {
        lock.writeLock().lock();
        try {
            ValidationResult result = validator.validateNext(candidate, chain, committedTransfers);
            if (!result.isOk()) {
                log.debug("拒绝区块 {}: {}", candidate.getIndex(), result);
                return result;
            }
            persist("追加区块 " + candidate.getIndex(), () -> {
                chainStore.append(candidate);
                return null;
            });
            chain.add(candidate);
            for (KnowledgeTransfer transfer : candidate.getTransactions()) {
                committedTransfers.put(transfer.contentId(), candidate.getIndex());
            }
            cumulativeDifficulty = cumulativeDifficulty.add(ChainWork.work(candidate));
            log.info("追加区块 高度={} hash={} 矿工={} 转移数={}", candidate.getIndex(), candidate.getHash(),
                    candidate.getMinerId(), candidate.getTransactions().size());
            notifyListeners("区块追加", listener -> listener.onBlockAppended(candidate));
        } finally {
            lock.writeLock().unlock();
        }
        return ValidationResult.ok();
    }

    @Override
    public boolean replaceIfBetter(List<Block> candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        // 候选链的合法性不依赖本地链，锁外校验
        ValidationResult result = validator.validateChain(candidate);
        if (!result.isOk()) {
            log.debug("候选链校验失败: {}", result);
            return false;
        }
        BigInteger candidateWork = ChainWork.cumulative(candidate);

        lock.writeLock().lock();
        try {
            if (candidateWork.compareTo(cumulativeDifficulty) <= 0) {
                log.debug("候选链累计难度不高于当前链，保留当前链: candidate={} local={}",
                        candidateWork, cumulativeDifficulty);
                return false;
            }
            int fork = forkIndex(chain, candidate);
            List<Block> removed = new ArrayList<>(chain.subList(fork, chain.size()));
            List<Block> added = new ArrayList<>(candidate.subList(fork, candidate.size()));
            long previousHeight = chain.size() - 1;
            persist("切换链", () -> {
                chainStore.replace(fork, added, previousHeight);
                return null;
            });
            resetState(candidate);
            log.info("切换到更优链：分叉点 {}，移除 {} 个区块，新增 {} 个区块，新高度 {}",
                    fork, removed.size(), added.size(), chain.size() - 1);
            notifyListeners("链切换", listener -> listener.onChainReplaced(removed, added));
        } finally {
            lock.writeLock().unlock();
        }
        return true;
    }

    /**
     * 持有写锁时调用，通知顺序与提交顺序一致
     */
    private void notifyListeners(String event, Consumer<ChainListener> notification) {
        for (ChainListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("{}通知失败: {}", event, listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static int forkIndex(List<Block> local, List<Block> candidate) {
        int common = Math.min(local.size(), candidate.size());
        for (int i = 0; i < common; i++) {
            if (!local.get(i).equals(candidate.get(i))) {
                return i;
            }
        }
        return common;
    }

    private void resetState(List<Block> blocks) {
        List<Block> newChain = new ArrayList<>(blocks);
        Map<ContentHash, Long> index = new HashMap<>();
        for (Block block : newChain) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                index.put(transfer.contentId(), block.getIndex());
            }
        }
        chain = newChain;
        committedTransfers = index;
        cumulativeDifficulty = ChainWork.cumulative(newChain);
    }

    @FunctionalInterface
    private interface StoreAction<T> {
        T run();
    }

    /**
     * 持久化失败是致命错误：通知处理器后继续抛出，内存状态不变
     */
    private <T> T persist(String action, StoreAction<T> storeAction) {
        try {
            return storeAction.run();
        } catch (ChainPersistenceException e) {
            fatalErrorHandler.handle(action + " 持久化失败", e);
            throw e;
        }
    }

    @Override
    public Block tip() {
        lock.readLock().lock();
        try {
            return chain.get(chain.size() - 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long height() {
        lock.readLock().lock();
        try {
            return chain.size() - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Block genesis() {
        return genesisFactory.genesis();
    }

    @Override
    public BigInteger cumulativeDifficulty() {
        lock.readLock().lock();
        try {
            return cumulativeDifficulty;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Block> blocksFrom(long fromIndex, int limit) {
        lock.readLock().lock();
        try {
            if (fromIndex < 0 || fromIndex >= chain.size() || limit <= 0) {
                return new ArrayList<>();
            }
            int end = (int) Math.min(chain.size(), fromIndex + limit);
            return new ArrayList<>(chain.subList((int) fromIndex, end));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Block> blockAt(long index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= chain.size()) {
                return Optional.empty();
            }
            return Optional.of(chain.get((int) index));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ValidationResult validateChain(List<Block> candidate) {
        return validator.validateChain(candidate);
    }

    @Override
    public ValidationResult validateTransfer(KnowledgeTransfer transfer) {
        ValidationResult content = transferProtocol.validateContent(transfer);
        if (!content.isOk()) {
            return content;
        }
        lock.readLock().lock();
        try {
            Long existing = committedTransfers.get(transfer.contentId());
            if (existing != null) {
                return KnowledgeTransferProtocol.duplicate(transfer, existing);
            }
        } finally {
            lock.readLock().unlock();
        }
        return ValidationResult.ok();
    }

    @Override
    public boolean containsTransfer(KnowledgeTransfer transfer) {
        lock.readLock().lock();
        try {
            return committedTransfers.containsKey(transfer.contentId());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BigInteger> nextTarget(Block parent) {
        lock.readLock().lock();
        try {
            long index = parent.getIndex();
            if (index < 0 || index >= chain.size() || !chain.get((int) index).equals(parent)) {
                return Optional.empty();
            }
            return Optional.of(difficultyCalculator.expectedTarget(chain.subList(0, (int) index + 1)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void addListener(ChainListener listener) {
        listeners.add(listener);
    }
}
