package com.bit.sigmos.common;

import static com.bit.sigmos.util.ByteUtils.hexToBytes;

/**
 * 区块哈希（32字节），标识一个区块的唯一ID
 */
public class BlockHash extends ByteHash32 {

    // 零哈希常量（创世区块的父哈希）
    public static final BlockHash ZERO = new BlockHash(new byte[HASH_LENGTH]);

    public BlockHash(byte[] value) {
        super(value);
    }

    public static BlockHash fromBytes(byte[] bytes) {
        return new BlockHash(bytes);
    }

    public static BlockHash fromHex(String hex) {
        return new BlockHash(hexToBytes(hex));
    }
}
