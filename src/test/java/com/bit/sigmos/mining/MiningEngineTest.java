package com.bit.sigmos.mining;

import com.bit.sigmos.LedgerFixture;
import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Slf4j
public class MiningEngineTest {

    private LedgerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = LedgerFixture.memory();
    }

    @Test
    void testMinesAcceptedBlockAtEasyTarget() {
        IdentityRecord miner = fixture.identity("miner");
        Block tip = fixture.ledger.tip();
        Optional<Block> found = fixture.engine.attempt(tip, miner, Collections.emptyList());
        assertTrue(found.isPresent());

        Block block = found.get();
        log.info("挖到区块 {}", block);
        assertEquals(1, block.getIndex());
        assertEquals(tip.getHash(), block.getPreviousHash());
        assertEquals(fixture.scorer.miningScore(miner), block.getMinerScore(), 0.0);
        assertTrue(fixture.difficultyCalculator.isAccepted(block.getHash().toUnsignedBigInteger(),
                block.getDifficultyTarget(), block.getMinerScore()));
        assertTrue(fixture.ledger.append(block).isOk());
    }

    @Test
    void testHigherScoreNeverLosesAcceptance() {
        DifficultyCalculator calculator = fixture.difficultyCalculator;
        BigInteger target = BigInteger.ONE.shiftLeft(250);
        IdentityRecord low = fixture.identity("low");
        IdentityRecord high = low.evolve().withTrait("logic", 1.0).withTrait("wisdom", 1.0);
        double lowScore = fixture.scorer.miningScore(low);
        double highScore = fixture.scorer.miningScore(high);
        assertTrue(highScore > lowScore);

        for (int i = 0; i < 2000; i++) {
            BigInteger hash = new BigInteger(256, new Random(i));
            if (calculator.isAccepted(hash, target, lowScore)) {
                assertTrue(calculator.isAccepted(hash, target, highScore), "hash " + hash.toString(16));
            }
        }
    }

    @Test
    void testCancellationStopsAttempt() {
        fixture.miningConfig.setAttemptBudget(Long.MAX_VALUE);
        fixture.miningConfig.setCancelCheckInterval(16);
        // 目标为0时任何哈希都不满足，只能靠取消退出
        Ledger ledger = mock(Ledger.class);
        when(ledger.nextTarget(any())).thenReturn(Optional.of(BigInteger.ZERO));
        MiningEngine engine = new MiningEngine(ledger, fixture.difficultyCalculator, fixture.scorer,
                fixture.miningConfig);

        AtomicInteger checks = new AtomicInteger();
        Optional<Block> found = engine.attempt(fixture.ledger.tip(), fixture.identity("miner"),
                Collections.emptyList(), () -> checks.incrementAndGet() > 3);
        assertTrue(found.isEmpty());
        assertEquals(4, checks.get());
    }

    @Test
    void testStaleTipIsAbandoned() {
        IdentityRecord miner = fixture.identity("miner");
        Block genesis = fixture.ledger.tip();
        Block first = fixture.mineOnTip(miner, Collections.emptyList());
        assertTrue(fixture.ledger.append(first).isOk());

        // 不在活动链上的父区块
        Block orphan = new Block(1, genesis.getHash(), first.getTimestamp(), "other", 42,
                first.getDifficultyTarget(), 0.0, Collections.emptyList());
        assertTrue(fixture.engine.attempt(orphan, miner, Collections.emptyList()).isEmpty());
    }
}
