package com.bit.sigmos.blockchain.impl;

import com.bit.sigmos.LedgerFixture;
import com.bit.sigmos.blockchain.ChainListener;
import com.bit.sigmos.blockchain.ChainWork;
import com.bit.sigmos.blockchain.RejectReason;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.transfer.KnowledgeStore;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LedgerImplTest {

    private LedgerFixture fixture;
    private LedgerImpl ledger;
    private IdentityRecord miner;

    @BeforeEach
    void setUp() {
        fixture = LedgerFixture.memory();
        ledger = fixture.ledger;
        miner = fixture.identity("miner");
    }

    @Test
    void testStartsFromGenesis() {
        assertEquals(0, ledger.height());
        assertEquals(fixture.genesisFactory.genesis(), ledger.tip());
        assertTrue(ledger.tip().isGenesis());
        assertEquals(BlockHash.ZERO, ledger.tip().getPreviousHash());
        assertTrue(ledger.cumulativeDifficulty().signum() > 0);
    }

    @Test
    void testAppendInOrder() {
        List<Block> blocks = fixture.extend(fixture.chain(), miner, 2);
        assertTrue(ledger.append(blocks.get(1)).isOk());
        assertTrue(ledger.append(blocks.get(2)).isOk());
        assertEquals(2, ledger.height());
        assertEquals(blocks.get(2), ledger.tip());
    }

    @Test
    void testOutOfOrderIsStale() {
        List<Block> blocks = fixture.extend(fixture.chain(), miner, 2);
        ValidationResult result = ledger.append(blocks.get(2));
        assertEquals(RejectReason.STALE_INDEX, result.getReason());
        // 同一高度重复追加也是过期
        assertTrue(ledger.append(blocks.get(1)).isOk());
        assertEquals(RejectReason.STALE_INDEX, ledger.append(blocks.get(1)).getReason());
        assertEquals(1, ledger.height());
    }

    @Test
    void testWrongParentIsHashMismatch() {
        Block genesis = ledger.tip();
        Block good = fixture.mineOnTip(miner, Collections.emptyList());
        Block forged = new Block(1, BlockHash.fromBytes(new byte[32]), good.getTimestamp(), miner.getId(),
                good.getNonce(), good.getDifficultyTarget(), good.getMinerScore(), Collections.emptyList());
        assertNotEquals(genesis.getHash(), forged.getPreviousHash());
        assertEquals(RejectReason.HASH_MISMATCH, ledger.append(forged).getReason());
    }

    @Test
    void testTamperedDeclaredHashIsHashMismatch() throws Exception {
        Block good = fixture.mineOnTip(miner, Collections.emptyList());
        byte[] wire = good.serialize();
        // 最后一个字段是区块哈希
        wire[wire.length - 1] ^= 0x01;
        Block tampered = Block.deserialize(wire);
        assertFalse(tampered.declaredHashMatches());
        assertEquals(RejectReason.HASH_MISMATCH, ledger.append(tampered).getReason());
        assertEquals(0, ledger.height());
    }

    @Test
    void testWrongTargetIsRejected() {
        Block good = fixture.mineOnTip(miner, Collections.emptyList());
        Block easier = new Block(1, good.getPreviousHash(), good.getTimestamp(), miner.getId(), good.getNonce(),
                good.getDifficultyTarget().shiftLeft(1), good.getMinerScore(), Collections.emptyList());
        assertEquals(RejectReason.DIFFICULTY_NOT_MET, ledger.append(easier).getReason());
    }

    @Test
    void testUnknownMinerIsRejected() {
        Block block = fixture.mineAs(fixture.chain(), "nobody", fixture.miningConfig.getMaxScore(),
                Collections.emptyList(), System.currentTimeMillis());
        assertEquals(RejectReason.DIFFICULTY_NOT_MET, ledger.append(block).getReason());
        assertEquals(0, ledger.height());
    }

    @Test
    void testDeclaredScoreAboveIdentityScoreIsRejected() {
        double real = fixture.scorer.miningScore(miner);
        double maxScore = fixture.miningConfig.getMaxScore();
        assertTrue(real < maxScore);

        Block inflated = fixture.mineAs(fixture.chain(), miner.getId(), maxScore, Collections.emptyList(),
                System.currentTimeMillis());
        assertEquals(RejectReason.DIFFICULTY_NOT_MET, ledger.append(inflated).getReason());

        // 声明低于身份分数只是放弃了优势
        Block modest = fixture.mineAs(fixture.chain(), miner.getId(), 0.0, Collections.emptyList(),
                System.currentTimeMillis());
        assertTrue(ledger.append(modest).isOk());
    }

    @Test
    void testTimestampBeforeParentIsRejected() {
        Block genesis = ledger.tip();
        Block early = new Block(1, genesis.getHash(), genesis.getTimestamp() - 1, miner.getId(), 0,
                genesis.getDifficultyTarget(), 0.0, Collections.emptyList());
        assertEquals(RejectReason.NON_MONOTONIC_TIMESTAMP, ledger.append(early).getReason());
    }

    @Test
    void testDuplicateTransferRejected() {
        IdentityRecord x = fixture.identity("X");
        IdentityRecord y = fixture.identity("Y");
        KnowledgeTransfer transfer = fixture.transferProtocol.prepare(x.getId(), y.getId(), "Mathematics", "1+1=2");

        assertTrue(ledger.append(fixture.mineOnTip(miner, List.of(transfer))).isOk());
        assertTrue(ledger.containsTransfer(transfer));
        assertFalse(ledger.validateTransfer(transfer).isOk());

        Block again = fixture.mineOnTip(miner, List.of(transfer));
        ValidationResult result = ledger.append(again);
        assertEquals(RejectReason.INVALID_TRANSACTION, result.getReason());
        log.info("重复转移被拒绝: {}", result);

        // 同一区块内重复
        KnowledgeTransfer other = fixture.transferProtocol.prepare(y.getId(), x.getId(), "Physics", "F=ma");
        Block doubled = fixture.mineOnTip(miner, List.of(other, other));
        assertEquals(RejectReason.INVALID_TRANSACTION, ledger.append(doubled).getReason());
    }

    @Test
    void testHeavierChainReplacesAndNotifies() {
        List<Block> local = fixture.extend(fixture.chain(), miner, 2);
        ledger.append(local.get(1));
        ledger.append(local.get(2));

        IdentityRecord rival = fixture.identity("rival");
        List<Block> fork = fixture.extend(local.subList(0, 2), rival, 3);

        List<List<Block>> notified = new ArrayList<>();
        ledger.addListener(new ChainListener() {
            @Override
            public void onBlockAppended(Block block) {
            }

            @Override
            public void onChainReplaced(List<Block> removed, List<Block> added) {
                notified.add(removed);
                notified.add(added);
            }
        });

        assertTrue(ledger.replaceIfBetter(fork));
        assertEquals(4, ledger.height());
        assertEquals(fork.get(4), ledger.tip());
        assertEquals(List.of(local.get(2)), notified.get(0));
        assertEquals(fork.subList(2, 5), notified.get(1));
    }

    @Test
    void testEqualHeightHeavierChainWinsEitherOrder() {
        fixture.miningConfig.setRetargetInterval(2);
        long now = System.currentTimeMillis();
        IdentityRecord rival = fixture.identity("rival");

        // 调整窗口跨度远超预期，第4块目标放宽到上限倍数
        List<Block> slow = new ArrayList<>(fixture.chain());
        slow.add(fixture.mineAfter(slow, miner, Collections.emptyList(), now - 200_000));
        slow.add(fixture.mineAfter(slow, miner, Collections.emptyList(), now - 100_000));
        slow.add(fixture.mineAfter(slow, miner, Collections.emptyList(), now - 10_000));
        slow.add(fixture.mineAfter(slow, miner, Collections.emptyList(), now - 10_000));
        // 调整窗口跨度为0，第4块目标收紧到下限倍数
        List<Block> fast = new ArrayList<>(fixture.chain());
        for (int i = 0; i < 4; i++) {
            fast.add(fixture.mineAfter(fast, rival, Collections.emptyList(), now - 10_000));
        }

        assertEquals(slow.size(), fast.size());
        assertTrue(fast.get(4).getDifficultyTarget().compareTo(slow.get(4).getDifficultyTarget()) < 0);
        assertTrue(ChainWork.cumulative(fast).compareTo(ChainWork.cumulative(slow)) > 0);

        for (Block block : slow.subList(1, 5)) {
            assertTrue(ledger.append(block).isOk());
        }
        assertTrue(ledger.replaceIfBetter(fast));
        assertEquals(fast.get(4), ledger.tip());

        LedgerFixture other = LedgerFixture.memory();
        other.miningConfig.setRetargetInterval(2);
        other.identityRegistry.upsert(miner);
        other.identityRegistry.upsert(rival);
        for (Block block : fast.subList(1, 5)) {
            assertTrue(other.ledger.append(block).isOk());
        }
        assertFalse(other.ledger.replaceIfBetter(slow));
        assertEquals(fast.get(4), other.ledger.tip());
    }

    @Test
    void testEqualWorkKeepsIncumbent() {
        List<Block> local = fixture.extend(fixture.chain(), miner, 2);
        ledger.append(local.get(1));
        ledger.append(local.get(2));
        Block tip = ledger.tip();

        List<Block> rival = fixture.extend(local.subList(0, 1), fixture.identity("rival"), 2);
        assertFalse(ledger.replaceIfBetter(rival));
        assertEquals(tip, ledger.tip());
        // 更短的链也不会替换
        assertFalse(ledger.replaceIfBetter(local.subList(0, 2)));
        assertEquals(tip, ledger.tip());
    }

    @Test
    void testInvalidCandidateChainIgnored() {
        List<Block> fork = fixture.extend(fixture.chain(), miner, 3);
        List<Block> broken = new ArrayList<>(fork);
        broken.remove(2);
        assertFalse(ledger.validateChain(broken).isOk());
        assertFalse(ledger.replaceIfBetter(broken));
        assertEquals(0, ledger.height());
    }

    @Test
    void testValidateOwnChain() {
        for (Block block : fixture.extend(fixture.chain(), miner, 3).subList(1, 4)) {
            assertTrue(ledger.append(block).isOk());
        }
        assertTrue(ledger.validateChain(fixture.chain()).isOk());
        assertEquals(3, ledger.blocksFrom(1, 10).size());
        assertTrue(ledger.blockAt(4).isEmpty());
    }

    @Test
    void testListenersSeeAppendBeforeCompetingReplace() throws Exception {
        IdentityRecord x = fixture.identity("X");
        IdentityRecord y = fixture.identity("Y");
        KnowledgeTransfer transfer = fixture.transferProtocol.prepare(x.getId(), y.getId(), "Mathematics", "1+1=2");
        Block withTransfer = fixture.mineOnTip(miner, List.of(transfer));
        List<Block> fork = fixture.extend(fixture.chain(), fixture.identity("rival"), 3);

        CountDownLatch inListener = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ledger.addListener(new ChainListener() {
            @Override
            public void onBlockAppended(Block block) {
                inListener.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void onChainReplaced(List<Block> removed, List<Block> added) {
            }
        });
        KnowledgeStore store = new KnowledgeStore(fixture.dataBase);
        ledger.addListener(store);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ValidationResult> appended = pool.submit(() -> ledger.append(withTransfer));
            assertTrue(inListener.await(5, TimeUnit.SECONDS));
            Future<Boolean> replaced = pool.submit(() -> ledger.replaceIfBetter(fork));
            // 让切换线程先走到写锁
            Thread.sleep(200);
            release.countDown();
            assertTrue(appended.get(5, TimeUnit.SECONDS).isOk());
            assertTrue(replaced.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(fork.get(3), ledger.tip());
        assertFalse(ledger.containsTransfer(transfer));
        assertFalse(store.hasKnowledge(y.getId(), transfer.contentId()));
        assertTrue(store.knowledgeOf(y.getId()).isEmpty());
    }

    @Test
    void testConcurrentAppendOnlyOneWins() throws Exception {
        int threads = 4;
        List<Block> candidates = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            candidates.add(fixture.mineOnTip(fixture.identity("m" + i), Collections.emptyList()));
        }
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ValidationResult>> results = new ArrayList<>();
        try {
            for (Block candidate : candidates) {
                Callable<ValidationResult> task = () -> {
                    start.await();
                    return ledger.append(candidate);
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int ok = 0;
            for (Future<ValidationResult> result : results) {
                ValidationResult r = result.get();
                if (r.isOk()) {
                    ok++;
                } else {
                    assertEquals(RejectReason.STALE_INDEX, r.getReason());
                }
            }
            assertEquals(1, ok);
            assertEquals(1, ledger.height());
        } finally {
            pool.shutdownNow();
        }
    }
}
