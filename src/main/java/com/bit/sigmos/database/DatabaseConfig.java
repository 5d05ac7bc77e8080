package com.bit.sigmos.database;

import com.bit.sigmos.config.SystemConfig;
import com.bit.sigmos.database.memory.MemoryDb;
import com.bit.sigmos.database.rocksDb.RocksDb;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DatabaseConfig {

    public static final String DB_TYPE_MEMORY = "memory";

    @Bean(destroyMethod = "closeDatabase")
    public DataBase dataBase(SystemConfig systemConfig) {
        log.info("系统数据路径:{} 数据库类型:{}", systemConfig.getPath(), systemConfig.getDbType());
        DataBase dataBase = DB_TYPE_MEMORY.equalsIgnoreCase(systemConfig.getDbType()) ? new MemoryDb() : new RocksDb();
        if (!dataBase.createDatabase(systemConfig)) {
            throw new DatabaseException("数据库创建失败: " + systemConfig.getPath());
        }
        return dataBase;
    }
}
