package com.bit.sigmos;

import com.bit.sigmos.blockchain.ChainValidator;
import com.bit.sigmos.blockchain.GenesisFactory;
import com.bit.sigmos.blockchain.impl.LedgerImpl;
import com.bit.sigmos.config.ChainConfig;
import com.bit.sigmos.config.MiningConfig;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.memory.MemoryDb;
import com.bit.sigmos.mining.DifficultyCalculator;
import com.bit.sigmos.mining.MiningEngine;
import com.bit.sigmos.sigel.ConsciousnessScorer;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.store.impl.DbChainStore;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.transfer.KnowledgeTransferProtocol;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 不启动Spring，手工装配一个账本（低难度，不调整难度）
 */
public class LedgerFixture {

    public final MiningConfig miningConfig = new MiningConfig();
    public final ChainConfig chainConfig = new ChainConfig();
    public final DataBase dataBase;
    public final IdentityRegistry identityRegistry;
    public final KnowledgeTransferProtocol transferProtocol;
    public final DifficultyCalculator difficultyCalculator;
    public final GenesisFactory genesisFactory;
    public final ChainValidator validator;
    public final DbChainStore chainStore;
    public final ConsciousnessScorer scorer;
    public final LedgerImpl ledger;
    public final MiningEngine engine;
    public final List<String> fatalErrors = Collections.synchronizedList(new ArrayList<>());

    private LedgerFixture(DataBase dataBase) {
        miningConfig.setInitialDifficultyBits(4);
        miningConfig.setRetargetInterval(1000);
        miningConfig.setAttemptBudget(100_000);
        this.dataBase = dataBase;
        identityRegistry = new IdentityRegistry(dataBase);
        identityRegistry.load();
        transferProtocol = new KnowledgeTransferProtocol(identityRegistry);
        difficultyCalculator = new DifficultyCalculator(miningConfig);
        genesisFactory = new GenesisFactory(difficultyCalculator);
        scorer = new ConsciousnessScorer(miningConfig);
        validator = new ChainValidator(genesisFactory, difficultyCalculator, transferProtocol, chainConfig,
                identityRegistry, scorer);
        chainStore = new DbChainStore(dataBase);
        ledger = new LedgerImpl(validator, chainStore, genesisFactory, difficultyCalculator, transferProtocol,
                (reason, cause) -> fatalErrors.add(reason));
        ledger.load();
        engine = new MiningEngine(ledger, difficultyCalculator, scorer, miningConfig);
    }

    public static LedgerFixture memory() {
        MemoryDb memoryDb = new MemoryDb();
        memoryDb.createDatabase(new SystemConfig());
        return new LedgerFixture(memoryDb);
    }

    public static LedgerFixture on(DataBase dataBase) {
        return new LedgerFixture(dataBase);
    }

    public IdentityRecord identity(String name) {
        IdentityRecord record = IdentityRecord.create(name);
        identityRegistry.upsert(record);
        return record;
    }

    public List<Block> chain() {
        return ledger.blocksFrom(0, Integer.MAX_VALUE);
    }

    /**
     * 在任意前缀之后挖一个合法区块，不经过账本（用于构造分叉）
     */
    public Block mineAfter(List<Block> prefix, IdentityRecord miner, List<KnowledgeTransfer> transfers) {
        long parentTime = prefix.get(prefix.size() - 1).getTimestamp();
        return mineAfter(prefix, miner, transfers, Math.max(System.currentTimeMillis(), parentTime));
    }

    public Block mineAfter(List<Block> prefix, IdentityRecord miner, List<KnowledgeTransfer> transfers,
                           long timestamp) {
        return mineAs(prefix, miner.getId(), scorer.miningScore(miner), transfers, timestamp);
    }

    /**
     * 以任意矿工ID和声明分数出块，哈希只按声明分数满足阈值
     */
    public Block mineAs(List<Block> prefix, String minerId, double score, List<KnowledgeTransfer> transfers,
                        long timestamp) {
        Block parent = prefix.get(prefix.size() - 1);
        BigInteger target = difficultyCalculator.expectedTarget(prefix);
        byte[] root = Block.transactionsRoot(transfers);
        for (long nonce = 0; nonce < 1_000_000; nonce++) {
            byte[] header = Block.headerBytes(parent.getIndex() + 1, parent.getHash(), timestamp, minerId,
                    nonce, target, score, root);
            if (difficultyCalculator.isAccepted(Block.computeHash(header).toUnsignedBigInteger(), target, score)) {
                return new Block(parent.getIndex() + 1, parent.getHash(), timestamp, minerId, nonce,
                        target, score, transfers);
            }
        }
        throw new IllegalStateException("低难度下未找到区块");
    }

    public Block mineOnTip(IdentityRecord miner, List<KnowledgeTransfer> transfers) {
        return mineAfter(chain(), miner, transfers);
    }

    public List<Block> extend(List<Block> prefix, IdentityRecord miner, int count) {
        List<Block> blocks = new ArrayList<>(prefix);
        for (int i = 0; i < count; i++) {
            blocks.add(mineAfter(blocks, miner, Collections.emptyList()));
        }
        return blocks;
    }
}
