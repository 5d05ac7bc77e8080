package com.bit.sigmos.util;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;

/**
 * protobuf 线格式手写编解码辅助
 * 字段按编号顺序写出，结果字节是确定的，可直接作为哈希原像
 */
public class ProtoUtils {

    public static final int UINT256_LENGTH = 32;

    @FunctionalInterface
    public interface FieldWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    @FunctionalInterface
    public interface FieldReader<T> {
        T read(CodedInputStream in) throws IOException;
    }

    public static byte[] write(FieldWriter writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(256);
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.write(out);
            out.flush();
        } catch (IOException e) {
            // 写入内存流不会真正发生IO异常
            throw new UncheckedIOException("protobuf编码失败", e);
        }
        return bytes.toByteArray();
    }

    public static <T> T read(byte[] data, FieldReader<T> reader) throws IOException {
        if (data == null) {
            throw new IOException("待解码数据为空");
        }
        return reader.read(CodedInputStream.newInstance(data));
    }

    /**
     * 256位无符号整数编码为定长32字节大端
     */
    public static byte[] toUint256(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > UINT256_LENGTH * 8) {
            throw new IllegalArgumentException("数值超出uint256范围: " + value.toString(16));
        }
        byte[] raw = value.toByteArray();
        byte[] fixed = new byte[UINT256_LENGTH];
        int copy = Math.min(raw.length, UINT256_LENGTH);
        System.arraycopy(raw, raw.length - copy, fixed, UINT256_LENGTH - copy, copy);
        return fixed;
    }

    public static BigInteger fromUint256(byte[] bytes) {
        return new BigInteger(1, bytes);
    }
}
