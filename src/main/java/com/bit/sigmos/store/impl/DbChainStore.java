package com.bit.sigmos.store.impl;

import com.bit.sigmos.blockchain.ChainPersistenceException;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.DataBase.DbOperation;
import com.bit.sigmos.database.DatabaseException;
import com.bit.sigmos.database.rocksDb.TableEnum;
import com.bit.sigmos.store.ChainStore;
import com.bit.sigmos.structure.block.Block;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.bit.sigmos.util.ByteUtils.bytesToLong;
import static com.bit.sigmos.util.ByteUtils.longToBytes;

/**
 * 基于KV库的链存储
 * block表：8字节大端高度 → 区块；chain表：height → 当前高度
 */
@Slf4j
@Component
public class DbChainStore implements ChainStore {

    private static final byte[] HEIGHT_KEY = "height".getBytes(StandardCharsets.UTF_8);

    private final DataBase dataBase;

    public DbChainStore(DataBase dataBase) {
        this.dataBase = dataBase;
    }

    @Override
    public List<Block> loadChain() {
        byte[] heightBytes;
        try {
            heightBytes = dataBase.get(TableEnum.CHAIN, HEIGHT_KEY);
        } catch (DatabaseException e) {
            throw new ChainPersistenceException("读取链高度失败", e);
        }
        if (heightBytes == null) {
            return new ArrayList<>();
        }
        long height = bytesToLong(heightBytes);
        List<Block> chain = new ArrayList<>();
        for (long i = 0; i <= height; i++) {
            byte[] data;
            try {
                data = dataBase.get(TableEnum.BLOCK, longToBytes(i));
            } catch (DatabaseException e) {
                throw new ChainPersistenceException("读取区块失败，高度 " + i, e);
            }
            if (data == null) {
                throw new ChainPersistenceException("区块缺失，高度 " + i + "，记录高度 " + height);
            }
            try {
                chain.add(Block.deserialize(data));
            } catch (IOException e) {
                throw new ChainPersistenceException("区块数据损坏，高度 " + i, e);
            }
        }
        log.info("从存储加载链，高度 {}", height);
        return chain;
    }

    @Override
    public void append(Block block) {
        List<DbOperation> operations = new ArrayList<>(2);
        operations.add(DbOperation.put(TableEnum.BLOCK, longToBytes(block.getIndex()), block.serialize()));
        operations.add(DbOperation.put(TableEnum.CHAIN, HEIGHT_KEY, longToBytes(block.getIndex())));
        commit(operations, "追加区块 " + block.getIndex());
    }

    @Override
    public void replace(long forkIndex, List<Block> added, long previousHeight) {
        List<DbOperation> operations = new ArrayList<>();
        long newHeight = forkIndex - 1;
        for (Block block : added) {
            operations.add(DbOperation.put(TableEnum.BLOCK, longToBytes(block.getIndex()), block.serialize()));
            newHeight = block.getIndex();
        }
        // 新链更短时删除旧链多出的区块
        for (long i = newHeight + 1; i <= previousHeight; i++) {
            operations.add(DbOperation.delete(TableEnum.BLOCK, longToBytes(i)));
        }
        operations.add(DbOperation.put(TableEnum.CHAIN, HEIGHT_KEY, longToBytes(newHeight)));
        commit(operations, "切换链，分叉点 " + forkIndex + "，新高度 " + newHeight);
    }

    private void commit(List<DbOperation> operations, String action) {
        boolean committed;
        try {
            committed = dataBase.dataTransaction(operations);
        } catch (RuntimeException e) {
            throw new ChainPersistenceException(action + " 持久化失败", e);
        }
        if (!committed) {
            throw new ChainPersistenceException(action + " 持久化失败");
        }
    }
}
