package com.bit.sigmos.mining;

import com.bit.sigmos.blockchain.ChainListener;
import com.bit.sigmos.blockchain.ChainPersistenceException;
import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.config.ChainConfig;
import com.bit.sigmos.config.MiningConfig;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.txpool.TransferPool;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * 挖矿调度：每个本地身份一个循环，运行在守护线程池上
 * 新tip到达时放弃进行中的尝试，基于新tip重新开始
 */
@Slf4j
@Service
public class MiningService implements ChainListener {

    private final Ledger ledger;
    private final MiningEngine engine;
    private final IdentityRegistry identityRegistry;
    private final TransferPool transferPool;
    private final PeerSessionManager sessionManager;
    private final ChainConfig chainConfig;
    private final MiningConfig miningConfig;

    private final ExecutorService executor;
    private final Map<String, MinerTask> miners = new ConcurrentHashMap<>();
    /** tip 每变化一次加一 */
    private final AtomicLong tipVersion = new AtomicLong();

    public MiningService(Ledger ledger, MiningEngine engine, IdentityRegistry identityRegistry,
                         TransferPool transferPool, PeerSessionManager sessionManager,
                         ChainConfig chainConfig, MiningConfig miningConfig) {
        this.ledger = ledger;
        this.engine = engine;
        this.identityRegistry = identityRegistry;
        this.transferPool = transferPool;
        this.sessionManager = sessionManager;
        this.chainConfig = chainConfig;
        this.miningConfig = miningConfig;
        this.executor = Executors.newCachedThreadPool(new DefaultThreadFactory("miner", true));
    }

    /**
     * 启动挖矿循环
     * @param continuous false 时出一个块后停止
     * @return 已经在挖矿或超过线程上限时返回false
     */
    public boolean mine(String identityId, boolean continuous) {
        if (identityRegistry.get(identityId).isEmpty()) {
            throw new IllegalArgumentException("身份不存在: " + identityId);
        }
        synchronized (miners) {
            MinerTask existing = miners.get(identityId);
            if (existing != null && !existing.isDone()) {
                return false;
            }
            if (activeMiners() >= miningConfig.getMaxMiners()) {
                log.warn("挖矿线程已达上限 {}", miningConfig.getMaxMiners());
                return false;
            }
            MinerTask task = new MinerTask(identityId, continuous);
            miners.put(identityId, task);
            task.future = executor.submit(task);
        }
        log.info("身份 {} 开始挖矿，持续模式 {}", identityId, continuous);
        return true;
    }

    /**
     * 同步执行一轮尝试，找到区块则追加并广播
     */
    public Optional<Block> mineOnce(String identityId) {
        IdentityRecord miner = identityRegistry.get(identityId)
                .orElseThrow(() -> new IllegalArgumentException("身份不存在: " + identityId));
        return tryBlock(miner, () -> false);
    }

    public boolean stop(String identityId) {
        MinerTask task = miners.remove(identityId);
        if (task == null) {
            return false;
        }
        task.stopped.set(true);
        log.info("身份 {} 停止挖矿", identityId);
        return true;
    }

    public boolean isMining(String identityId) {
        MinerTask task = miners.get(identityId);
        return task != null && !task.isDone();
    }

    public List<String> miningIdentities() {
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, MinerTask> entry : miners.entrySet()) {
            if (!entry.getValue().isDone()) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    private int activeMiners() {
        int count = 0;
        for (MinerTask task : miners.values()) {
            if (!task.isDone()) {
                count++;
            }
        }
        return count;
    }

    private Optional<Block> tryBlock(IdentityRecord miner, BooleanSupplier stopped) {
        // 先取版本再取tip，之后的任何tip变化都会取消本轮
        long version = tipVersion.get();
        Block tip = ledger.tip();
        List<KnowledgeTransfer> transfers = transferPool.select(chainConfig.getMaxTransfersPerBlock());
        Optional<Block> found = engine.attempt(tip, miner, transfers,
                () -> stopped.getAsBoolean() || tipVersion.get() != version);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Block block = found.get();
        ValidationResult result = ledger.append(block);
        if (!result.isOk()) {
            // 与网络上的新区块竞争失败
            log.info("挖到的区块 {} 未能追加: {}", block.getIndex(), result);
            return Optional.empty();
        }
        int peers = sessionManager.broadcastBlock(block, null);
        log.info("身份 {} 挖出区块 高度={} hash={} 广播到 {} 个节点", miner.getId(), block.getIndex(),
                block.getHash(), peers);
        return Optional.of(block);
    }

    @Override
    public void onBlockAppended(Block block) {
        tipVersion.incrementAndGet();
    }

    @Override
    public void onChainReplaced(List<Block> removed, List<Block> added) {
        tipVersion.incrementAndGet();
    }

    public void shutdown() {
        for (MinerTask task : miners.values()) {
            task.stopped.set(true);
        }
        miners.clear();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("挖矿线程未在5秒内退出");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class MinerTask implements Runnable {
        private final String identityId;
        private final boolean continuous;
        private final AtomicBoolean stopped = new AtomicBoolean(false);
        private volatile Future<?> future;

        private MinerTask(String identityId, boolean continuous) {
            this.identityId = identityId;
            this.continuous = continuous;
        }

        boolean isDone() {
            Future<?> f = future;
            return stopped.get() || (f != null && f.isDone());
        }

        @Override
        public void run() {
            try {
                while (!stopped.get() && !Thread.currentThread().isInterrupted()) {
                    // 每轮重新读取身份快照，演化后的分数在下一轮生效
                    Optional<IdentityRecord> miner = identityRegistry.get(identityId);
                    if (miner.isEmpty()) {
                        log.warn("挖矿身份 {} 已不存在，停止", identityId);
                        break;
                    }
                    Optional<Block> block = tryBlock(miner.get(), stopped::get);
                    if (block.isPresent() && !continuous) {
                        break;
                    }
                }
            } catch (ChainPersistenceException e) {
                // 致命错误已由账本上报，这里只结束循环
                log.error("挖矿循环因持久化失败退出: {}", identityId, e);
            } catch (RuntimeException e) {
                log.error("挖矿循环异常退出: {}", identityId, e);
            } finally {
                stopped.set(true);
                miners.remove(identityId, this);
            }
        }
    }
}
