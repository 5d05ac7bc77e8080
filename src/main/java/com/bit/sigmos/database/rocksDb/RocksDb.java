package com.bit.sigmos.database.rocksDb;

import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.DatabaseException;
import com.bit.sigmos.database.KeyValueHandler;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.*;

import java.io.File;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * RocksDB 实现
 * 区块按高度大端键顺序追加；链切换通过 WriteBatch 原子提交
 */
@Slf4j
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    private RocksDB db;
    private DBOptions dbOptions;
    private final RTable rTable = new RTable();
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(SystemConfig config) {
        String path = config.getPath();
        if (path == null) {
            return false;
        }
        dbPath = path;

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 1. 添加默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(
                    RocksDB.DEFAULT_COLUMN_FAMILY,
                    new ColumnFamilyOptions()
            ));

            // 2. 自定义列族，顺序与TableEnum一致
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            // 3. 打开数据库
            dbOptions = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(dbOptions, dbPath, cfDescriptors, cfHandles);

            // 4. 绑定列族句柄（cfHandles顺序与cfDescriptors严格一致）
            if (cfHandles.size() != cfDescriptors.size()) {
                throw new DatabaseException("列族句柄数量与描述符不匹配，初始化失败");
            }
            // 默认列族不使用
            cfHandles.get(0).close();
            for (int i = 0; i < tableEnums.size(); i++) {
                TableEnum table = tableEnums.get(i);
                rTable.setColumnFamilyHandle(table, cfHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", table, i + 1);
            }

            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    @Override
    public boolean closeDatabase() {
        try {
            close();
            log.info("数据库已关闭");
            return true;
        } catch (Exception e) {
            log.error("关闭数据库失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(requireHandle(table), key, value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new DatabaseException("插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            db.delete(requireHandle(table), key);
        } catch (RocksDBException e) {
            log.error("删除数据失败, table={}", table, e);
            throw new DatabaseException("删除数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        // RocksDB的更新就是覆盖写入
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            return db.get(requireHandle(table), key);
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new DatabaseException("获取数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeAll();
                db.close();
                db = null;
                if (dbOptions != null) {
                    dbOptions.close();
                    dbOptions = null;
                }
                log.info("RocksDB连接已关闭: {}", dbPath);
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.warn("事务操作列表为空，无需执行");
            return true;
        }

        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions().setSync(true)) {
            // 1. 校验所有操作的表（列族）是否存在，并添加到事务批次
            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = requireHandle(op.table);
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        writeBatch.put(cfHandle, op.key, op.value);
                        break;
                    case DELETE:
                        writeBatch.delete(cfHandle, op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("不支持的操作类型: " + op.type);
                }
            }

            // 2. 执行事务（原子提交）
            db.write(writeOptions, writeBatch);
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } catch (RocksDBException | DatabaseException e) {
            log.error("事务执行失败", e);
            return false;
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
        if (table == null || handler == null) {
            log.warn("迭代表失败：表名或处理器不能为空");
            return;
        }
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            if (startKey == null) {
                iterator.seekToFirst();
            } else {
                iterator.seek(startKey);
            }
            while (iterator.isValid()) {
                // 调用处理器处理键值对，返回false则停止迭代
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private ColumnFamilyHandle requireHandle(TableEnum table) {
        if (db == null) {
            throw new DatabaseException("数据库未打开: " + dbPath);
        }
        ColumnFamilyHandle cfHandle = rTable.getColumnFamilyHandle(table);
        if (cfHandle == null) {
            throw new DatabaseException("表不存在: " + table);
        }
        return cfHandle;
    }
}
