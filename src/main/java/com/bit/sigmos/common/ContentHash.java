package com.bit.sigmos.common;

import static com.bit.sigmos.util.ByteUtils.hexToBytes;

/**
 * 知识转移内容哈希（32字节）
 * 由 from/to/topic/payload/createdAt 五个字段计算，作为转移记录的内容身份
 */
public class ContentHash extends ByteHash32 {

    public ContentHash(byte[] value) {
        super(value);
    }

    public static ContentHash fromBytes(byte[] bytes) {
        return new ContentHash(bytes);
    }

    public static ContentHash fromHex(String hex) {
        return new ContentHash(hexToBytes(hex));
    }
}
