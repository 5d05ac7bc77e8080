package com.bit.sigmos.transfer;

import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.memory.MemoryDb;
import com.bit.sigmos.database.rocksDb.TableEnum;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KnowledgeStoreTest {

    private MemoryDb dataBase;
    private KnowledgeStore store;

    @BeforeEach
    void setUp() {
        dataBase = new MemoryDb();
        dataBase.createDatabase(new SystemConfig());
        store = new KnowledgeStore(dataBase);
    }

    @Test
    void testApplyIsIdempotent() {
        KnowledgeTransfer transfer = new KnowledgeTransfer("x", "y", "Mathematics", "prime numbers", 1L);
        assertTrue(store.apply(transfer));
        assertFalse(store.apply(transfer));
        assertEquals(1, store.knowledgeOf("y").size());
        assertEquals(1, dataBase.count(TableEnum.KNOWLEDGE));
        assertTrue(store.hasKnowledge("y", transfer.contentId()));
        assertFalse(store.hasKnowledge("x", transfer.contentId()));
    }

    @Test
    void testRevertRemovesKnowledge() {
        KnowledgeTransfer transfer = new KnowledgeTransfer("x", "y", "Mathematics", "prime numbers", 1L);
        store.apply(transfer);
        assertTrue(store.revert(transfer));
        assertFalse(store.revert(transfer));
        assertTrue(store.knowledgeOf("y").isEmpty());
        assertEquals(0, dataBase.count(TableEnum.KNOWLEDGE));
    }

    @Test
    void testReloadSkipsCorruptedRecords() {
        KnowledgeTransfer first = new KnowledgeTransfer("x", "y", "Mathematics", "a", 1L);
        KnowledgeTransfer second = new KnowledgeTransfer("x", "y", "Physics", "b", 2L);
        store.apply(first);
        store.apply(second);
        byte[] badKey = "broken".getBytes(StandardCharsets.UTF_8);
        dataBase.insert(TableEnum.KNOWLEDGE, badKey, new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF});

        KnowledgeStore reloaded = new KnowledgeStore(dataBase);
        reloaded.load();
        assertEquals(2, reloaded.knowledgeOf("y").size());
        assertEquals("Mathematics", reloaded.knowledgeOf("y").get(0).getTopic());
        assertFalse(dataBase.isExist(TableEnum.KNOWLEDGE, badKey));
    }

    @Test
    void testReplayDropsKnowledgeMissingFromChain() {
        KnowledgeTransfer onChain = new KnowledgeTransfer("x", "y", "Mathematics", "a", 1L);
        KnowledgeTransfer orphaned = new KnowledgeTransfer("x", "y", "Physics", "b", 2L);
        store.apply(orphaned);

        List<Block> chain = List.of(
                new Block(0, BlockHash.ZERO, 0L, "genesis", 0, BigInteger.ONE, 0.0, Collections.emptyList()),
                new Block(1, BlockHash.ZERO, 1L, "m", 0, BigInteger.ONE, 0.0, List.of(onChain)));
        KnowledgeStore reloaded = new KnowledgeStore(dataBase);
        reloaded.load();
        reloaded.replay(chain);

        assertEquals(List.of(onChain), reloaded.knowledgeOf("y"));
        assertFalse(reloaded.hasKnowledge("y", orphaned.contentId()));
        assertEquals(1, dataBase.count(TableEnum.KNOWLEDGE));
    }
}
