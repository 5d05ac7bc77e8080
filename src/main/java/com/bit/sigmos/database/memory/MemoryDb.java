package com.bit.sigmos.database.memory;

import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.KeyValueHandler;
import com.bit.sigmos.database.rocksDb.TableEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存数据库，键按无符号字节序排列，遍历顺序与RocksDB一致
 * 用于测试和不需要持久化的临时节点
 */
@Slf4j
public class MemoryDb implements DataBase {

    private static final Comparator<byte[]> KEY_ORDER = Arrays::compareUnsigned;

    private final Map<TableEnum, ConcurrentSkipListMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new ConcurrentSkipListMap<>(KEY_ORDER));
        }
    }

    @Override
    public boolean createDatabase(SystemConfig config) {
        log.info("使用内存数据库，数据不会持久化");
        return true;
    }

    @Override
    public boolean closeDatabase() {
        close();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.readLock().lock();
        try {
            tables.get(table).put(key.clone(), value.clone());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            tables.get(table).remove(key);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        byte[] value = tables.get(table).get(key);
        return value == null ? null : value.clone();
    }

    @Override
    public int count(TableEnum table) {
        return tables.get(table).size();
    }

    @Override
    public void close() {
        // 内存数据随实例释放
    }

    /**
     * 写锁保证批量操作对其他写入整体可见
     */
    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return true;
        }
        rwLock.writeLock().lock();
        try {
            for (DbOperation op : operations) {
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        tables.get(op.table).put(op.key.clone(), op.value.clone());
                        break;
                    case DELETE:
                        tables.get(op.table).remove(op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("不支持的操作类型: " + op.type);
                }
            }
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        iterateFrom(table, null, handler);
    }

    @Override
    public void iterateFrom(TableEnum table, byte[] startKey, KeyValueHandler handler) {
        NavigableMap<byte[], byte[]> view = startKey == null
                ? tables.get(table)
                : tables.get(table).tailMap(startKey, true);
        for (Map.Entry<byte[], byte[]> entry : view.entrySet()) {
            if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                break;
            }
        }
    }
}
