package com.bit.sigmos.store.impl;

import com.bit.sigmos.LedgerFixture;
import com.bit.sigmos.blockchain.ChainPersistenceException;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.memory.MemoryDb;
import com.bit.sigmos.database.rocksDb.RocksDb;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class DbChainStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testMemoryStoreReplaceShrinksChain() {
        MemoryDb dataBase = new MemoryDb();
        dataBase.createDatabase(new SystemConfig());
        LedgerFixture fixture = LedgerFixture.on(dataBase);
        IdentityRecord miner = fixture.identity("miner");

        List<Block> blocks = fixture.extend(fixture.chain(), miner, 3);
        DbChainStore store = fixture.chainStore;
        store.append(blocks.get(1));
        store.append(blocks.get(2));
        store.append(blocks.get(3));
        assertEquals(blocks, store.loadChain());

        Block replacement = fixture.mineAfter(blocks.subList(0, 1), fixture.identity("rival"), Collections.emptyList());
        store.replace(1, List.of(replacement), 3);
        assertEquals(List.of(blocks.get(0), replacement), store.loadChain());
    }

    @Test
    void testRocksDbSurvivesRestart() {
        SystemConfig config = new SystemConfig();
        config.setPath(tempDir.resolve("chain").toString());

        RocksDb first = new RocksDb();
        assertTrue(first.createDatabase(config));
        LedgerFixture fixture = LedgerFixture.on(first);
        IdentityRecord x = fixture.identity("X");
        IdentityRecord y = fixture.identity("Y");
        KnowledgeTransfer transfer = fixture.transferProtocol.prepare(x.getId(), y.getId(), "Mathematics", "pi");
        assertTrue(fixture.ledger.append(fixture.mineOnTip(x, List.of(transfer))).isOk());
        assertTrue(fixture.ledger.append(fixture.mineOnTip(y, Collections.emptyList())).isOk());
        Block tip = fixture.ledger.tip();
        first.closeDatabase();

        RocksDb second = new RocksDb();
        assertTrue(second.createDatabase(config));
        try {
            LedgerFixture reopened = LedgerFixture.on(second);
            log.info("重启后高度 {}", reopened.ledger.height());
            assertEquals(2, reopened.ledger.height());
            assertEquals(tip, reopened.ledger.tip());
            assertTrue(reopened.ledger.containsTransfer(transfer));
            assertTrue(reopened.identityRegistry.contains(x.getId()));
            assertEquals(fixture.ledger.cumulativeDifficulty(), reopened.ledger.cumulativeDifficulty());
        } finally {
            second.closeDatabase();
        }
    }

    @Test
    void testFailedWriteIsFatalAndLeavesLedgerUnchanged() {
        FailingMemoryDb dataBase = new FailingMemoryDb();
        dataBase.createDatabase(new SystemConfig());
        LedgerFixture fixture = LedgerFixture.on(dataBase);
        Block block = fixture.mineOnTip(fixture.identity("miner"), Collections.emptyList());

        dataBase.failing = true;
        assertThrows(ChainPersistenceException.class, () -> fixture.ledger.append(block));
        assertEquals(1, fixture.fatalErrors.size());
        assertEquals(0, fixture.ledger.height());
    }

    private static class FailingMemoryDb extends MemoryDb {
        volatile boolean failing;

        @Override
        public boolean dataTransaction(List<DataBase.DbOperation> operations) {
            return !failing && super.dataTransaction(operations);
        }
    }
}
