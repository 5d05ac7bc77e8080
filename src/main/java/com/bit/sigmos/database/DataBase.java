package com.bit.sigmos.database;

import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.rocksDb.TableEnum;

import java.util.List;

//KV数据库操作 按表(列族)隔离
public interface DataBase {

    /**
     * 创建数据库
     * @param config
     * @return
     */
    boolean createDatabase(SystemConfig config);

    /**
     * 关闭数据库
     * @return
     */
    boolean closeDatabase();

    /**
     * 判断是否存在
     * @param table
     * @param key
     * @return
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 删除一条数据
     */
    void delete(TableEnum table, byte[] key);

    /**
     * 修改一条数据
     */
    void update(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据，不存在返回null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    void close();

    /**
     * 事务完成 所有操作原子提交
     * @return 失败返回false，数据库状态不变
     */
    boolean dataTransaction(List<DbOperation> operations);

    /**
     * 迭代器遍历（按键字节序，避免一次性加载所有数据到内存）
     * @param table 表名
     * @param handler 迭代器处理器（处理每条键值对）
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    /**
     * 从指定键开始遍历（包含该键）
     */
    void iterateFrom(TableEnum table, byte[] startKey, KeyValueHandler handler);

    // 封装事务中的单个操作
    class DbOperation {
        public enum OpType { INSERT, UPDATE, DELETE }

        public final TableEnum table; // 表枚举
        public final byte[] key;      // 键
        public final byte[] value;    // 值（DELETE 操作可为 null）
        public final OpType type;     // 操作类型

        public DbOperation(TableEnum table, byte[] key, byte[] value, OpType type) {
            this.table = table;
            this.key = key;
            this.value = value;
            this.type = type;
        }

        public static DbOperation put(TableEnum table, byte[] key, byte[] value) {
            return new DbOperation(table, key, value, OpType.INSERT);
        }

        public static DbOperation delete(TableEnum table, byte[] key) {
            return new DbOperation(table, key, null, OpType.DELETE);
        }
    }
}
