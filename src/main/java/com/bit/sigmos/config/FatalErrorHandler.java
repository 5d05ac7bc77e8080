package com.bit.sigmos.config;

/**
 * 致命错误处理：本地持久化失败时节点进程必须退出
 */
@FunctionalInterface
public interface FatalErrorHandler {
    void handle(String reason, Throwable cause);
}
