package com.bit.sigmos.database.rocksDb;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyOptions;


/**
 * 表枚举（集中管理所有表的元信息，作为唯一数据源）
 */
public enum TableEnum {

    // 链信息表：当前高度等元数据
    CHAIN(
            (short) 1,
            "chain",  // 列族实际存储名称
            new ColumnFamilyOptions()  // 列族配置
    ),
    // 区块表：key = 8字节大端高度
    BLOCK(
            (short) 2,
            "block",
            new ColumnFamilyOptions()
                    .setTableFormatConfig(new BlockBasedTableConfig()
                            .setBlockCacheSize(64 * 1024 * 1024)  // 64MB缓存
                            .setCacheIndexAndFilterBlocks(true))
    ),
    // 身份档案表：key = 身份ID
    SIGEL(
            (short) 3,
            "sigel",
            new ColumnFamilyOptions()
    ),
    // 已接收知识表：key = 身份ID + 内容哈希
    KNOWLEDGE(
            (short) 4,
            "knowledge",
            new ColumnFamilyOptions()
    );

    @Getter private final short code;  // 表唯一标识（short类型）
    @Getter private final String columnFamilyName;  // 列族实际存储名称
    @Getter private final ColumnFamilyOptions columnFamilyOptions;  // 列族配置

    TableEnum(short code, String columnFamilyName, ColumnFamilyOptions columnFamilyOptions) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
        this.columnFamilyOptions = columnFamilyOptions;
    }

    // 缓存：标识 -> 枚举实例
    private static final Map<Short, TableEnum> CODE_TO_ENUM = new HashMap<>();

    static {
        for (TableEnum table : values()) {
            CODE_TO_ENUM.put(table.code, table);
        }
    }

    // 根据short标识获取枚举实例
    public static TableEnum getByCode(short code) {
        return CODE_TO_ENUM.get(code);
    }
}
