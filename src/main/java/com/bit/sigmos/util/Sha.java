package com.bit.sigmos.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.Security;

@Slf4j
public class Sha {
    // ThreadLocal存储每个线程独立的SHA-256实例
    private static final ThreadLocal<MessageDigest> SHA256_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME);
        } catch (Exception e) {
            throw new RuntimeException("创建线程本地SHA-256实例失败", e);
        }
    });

    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            SHA256_THREAD_LOCAL.get();
        } catch (Exception e) {
            throw new RuntimeException("哈希算法初始化验证失败：" + e.getMessage()
                    + "，请确保BouncyCastle依赖正确", e);
        }
    }

    /**
     * 线程安全的SHA-256计算（每个线程复用自己的实例）
     */
    public static byte[] applySHA256(byte[] data) {
        // 允许空数组（哈希计算空数组是合法的）
        data = data == null ? new byte[0] : data;
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段数据连续计算SHA-256，避免先拼接大数组
     */
    public static byte[] applySHA256(byte[]... parts) {
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            if (part == null) {
                throw new IllegalArgumentException("输入数据不能为空");
            }
            digest.update(part);
        }
        return digest.digest();
    }
}
