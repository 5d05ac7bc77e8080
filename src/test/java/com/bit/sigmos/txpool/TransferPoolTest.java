package com.bit.sigmos.txpool;

import com.bit.sigmos.LedgerFixture;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransferPoolTest {

    private LedgerFixture fixture;
    private TransferPool pool;
    private IdentityRecord x;
    private IdentityRecord y;

    @BeforeEach
    void setUp() {
        fixture = LedgerFixture.memory();
        pool = new TransferPool(fixture.ledger, fixture.chainConfig);
        fixture.ledger.addListener(pool);
        x = fixture.identity("X");
        y = fixture.identity("Y");
    }

    private KnowledgeTransfer transfer(String topic) {
        return fixture.transferProtocol.prepare(x.getId(), y.getId(), topic, "payload of " + topic);
    }

    @Test
    void testAddRejectsDuplicates() {
        KnowledgeTransfer transfer = transfer("Mathematics");
        assertTrue(pool.add(transfer));
        assertFalse(pool.add(transfer));
        assertEquals(1, pool.size());
    }

    @Test
    void testCapacityLimit() {
        fixture.chainConfig.setTransferPoolSize(2);
        assertTrue(pool.add(transfer("a")));
        assertTrue(pool.add(transfer("b")));
        assertFalse(pool.add(transfer("c")));
        assertEquals(2, pool.size());
    }

    @Test
    void testSelectKeepsOrderAndSkipsInvalid() {
        KnowledgeTransfer first = transfer("a");
        KnowledgeTransfer unknown = fixture.transferProtocol.prepare(x.getId(), "ghost", "b", "p");
        KnowledgeTransfer third = transfer("c");
        pool.add(first);
        pool.add(unknown);
        pool.add(third);

        assertEquals(List.of(first, third), pool.select(10));
        assertEquals(List.of(first), pool.select(1));
    }

    @Test
    void testCommittedTransfersArePurged() {
        KnowledgeTransfer transfer = transfer("Mathematics");
        pool.add(transfer);
        assertTrue(fixture.ledger.append(fixture.mineOnTip(x, pool.select(10))).isOk());
        assertFalse(pool.contains(transfer));
        // 已上链的不能再入池
        assertFalse(pool.add(transfer));
    }

    @Test
    void testOrphanedTransfersReturnAfterReorg() {
        KnowledgeTransfer transfer = transfer("Mathematics");
        pool.add(transfer);
        List<Block> base = fixture.chain();
        assertTrue(fixture.ledger.append(fixture.mineAfter(base, x, List.of(transfer))).isOk());
        assertEquals(0, pool.size());

        List<Block> heavier = fixture.extend(base, y, 2);
        assertTrue(fixture.ledger.replaceIfBetter(heavier));
        assertTrue(pool.contains(transfer));
        assertEquals(List.of(transfer), pool.select(10));
        assertTrue(fixture.ledger.append(fixture.mineOnTip(x, Collections.singletonList(transfer))).isOk());
    }
}
