package com.bit.sigmos.blockchain;

/**
 * 链数据持久化失败，节点无法保证本地状态与磁盘一致，按致命错误处理
 */
public class ChainPersistenceException extends RuntimeException {

    public ChainPersistenceException(String message) {
        super(message);
    }

    public ChainPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
