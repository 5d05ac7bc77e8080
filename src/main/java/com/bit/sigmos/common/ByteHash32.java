package com.bit.sigmos.common;

import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * 32字节哈希的通用基类，封装共同逻辑（长度校验、不可变性、转换方法等）
 * 具体哈希类型（如区块哈希、知识内容哈希）应继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable {
    public static final int HASH_LENGTH = 32;
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    // 存储32字节哈希数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节哈希的原始字节数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = toHexInternal(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] toBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 转换为十六进制字符串（使用缓存值）
     */
    public String toHex() {
        return hexValue;
    }

    /**
     * 按无符号大整数解释哈希，用于和难度目标比较
     */
    public BigInteger toUnsignedBigInteger() {
        return new BigInteger(1, value);
    }

    /**
     * 判断是否为零哈希（全0字节）
     */
    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    private String toHexInternal(byte[] bytes) {
        StringBuilder sb = new StringBuilder(HASH_LENGTH * 2);
        for (byte b : bytes) {
            sb.append(HEX_CHARS[(b >>> 4) & 0x0F]);
            sb.append(HEX_CHARS[b & 0x0F]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return hexValue;
    }
}
