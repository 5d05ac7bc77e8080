package com.bit.sigmos.transfer;

import com.bit.sigmos.blockchain.ChainListener;
import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.rocksDb.TableEnum;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 各身份已接收的知识，只从已上链的区块应用
 * key = 2字节ID长度 + 接收方ID + 32字节内容哈希，同一内容重复应用无效果
 */
@Slf4j
@Component
public class KnowledgeStore implements ChainListener {

    private final DataBase dataBase;
    private final Map<String, Map<ContentHash, KnowledgeTransfer>> received = new ConcurrentHashMap<>();

    public KnowledgeStore(DataBase dataBase) {
        this.dataBase = dataBase;
    }

    public void load() {
        int[] count = {0};
        List<byte[]> corrupted = new ArrayList<>();
        dataBase.iterate(TableEnum.KNOWLEDGE, (key, value) -> {
            try {
                KnowledgeTransfer transfer = KnowledgeTransfer.deserialize(value);
                received.computeIfAbsent(transfer.getToId(), id -> new ConcurrentHashMap<>())
                        .put(transfer.contentId(), transfer);
                count[0]++;
            } catch (IOException e) {
                log.error("知识记录损坏，删除后由链上重放恢复", e);
                corrupted.add(key);
            }
            return true;
        });
        for (byte[] key : corrupted) {
            dataBase.delete(TableEnum.KNOWLEDGE, key);
        }
        log.info("加载已接收知识 {} 条", count[0]);
    }

    /**
     * 按链顺序重放：补齐存储中缺失的记录，删除不在这条链上的记录
     */
    public void replay(List<Block> chain) {
        Set<ContentHash> onChain = new HashSet<>();
        int applied = 0;
        for (Block block : chain) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                onChain.add(transfer.contentId());
                if (apply(transfer)) {
                    applied++;
                }
            }
        }
        int pruned = 0;
        for (Map<ContentHash, KnowledgeTransfer> store : received.values()) {
            for (KnowledgeTransfer transfer : new ArrayList<>(store.values())) {
                if (!onChain.contains(transfer.contentId()) && revert(transfer)) {
                    pruned++;
                }
            }
        }
        if (applied > 0 || pruned > 0) {
            log.info("重放链上知识转移，新增 {} 条，删除链外记录 {} 条", applied, pruned);
        }
    }

    /**
     * @return 首次应用返回true，重复应用返回false且状态不变
     */
    public boolean apply(KnowledgeTransfer transfer) {
        Map<ContentHash, KnowledgeTransfer> store =
                received.computeIfAbsent(transfer.getToId(), id -> new ConcurrentHashMap<>());
        if (store.putIfAbsent(transfer.contentId(), transfer) != null) {
            return false;
        }
        dataBase.insert(TableEnum.KNOWLEDGE, key(transfer), transfer.serialize());
        log.debug("{} 接收知识 [{}] 来自 {}", transfer.getToId(), transfer.getTopic(), transfer.getFromId());
        return true;
    }

    public boolean revert(KnowledgeTransfer transfer) {
        Map<ContentHash, KnowledgeTransfer> store = received.get(transfer.getToId());
        if (store == null || store.remove(transfer.contentId()) == null) {
            return false;
        }
        dataBase.delete(TableEnum.KNOWLEDGE, key(transfer));
        return true;
    }

    public boolean hasKnowledge(String identityId, ContentHash contentId) {
        Map<ContentHash, KnowledgeTransfer> store = received.get(identityId);
        return store != null && store.containsKey(contentId);
    }

    public List<KnowledgeTransfer> knowledgeOf(String identityId) {
        Map<ContentHash, KnowledgeTransfer> store = received.get(identityId);
        if (store == null) {
            return new ArrayList<>();
        }
        List<KnowledgeTransfer> list = new ArrayList<>(store.values());
        list.sort(Comparator.comparingLong(KnowledgeTransfer::getCreatedAt));
        return list;
    }

    @Override
    public void onBlockAppended(Block block) {
        for (KnowledgeTransfer transfer : block.getTransactions()) {
            apply(transfer);
        }
    }

    @Override
    public void onChainReplaced(List<Block> removed, List<Block> added) {
        for (Block block : removed) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                revert(transfer);
            }
        }
        for (Block block : added) {
            for (KnowledgeTransfer transfer : block.getTransactions()) {
                apply(transfer);
            }
        }
    }

    private static byte[] key(KnowledgeTransfer transfer) {
        byte[] id = transfer.getToId().getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(2 + id.length + ContentHash.HASH_LENGTH)
                .putShort((short) id.length)
                .put(id)
                .put(transfer.contentId().toBytes())
                .array();
    }
}
