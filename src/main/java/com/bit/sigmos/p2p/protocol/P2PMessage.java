package com.bit.sigmos.p2p.protocol;

import lombok.Data;

/**
 * P2P网络消息
 * 帧格式（大端）：| 版本(2字节) | 类型(4字节) | 长度(4字节) | 数据 |
 * 外层再由4字节长度前缀分帧
 */
@Data
public class P2PMessage {
    /** 当前协议版本 */
    public static final short CURRENT_VERSION = 1;
    /** 可兼容的最低协议版本 */
    public static final short MIN_COMPATIBLE_VERSION = 1;
    /** 帧头长度：version + type + length */
    public static final int HEADER_LENGTH = Short.BYTES + Integer.BYTES + Integer.BYTES;

    private short version = CURRENT_VERSION;
    private int type;              // 消息类型（转发至对应处理器）
    private int length;            // data字段长度
    private byte[] data = new byte[0];

    public static P2PMessage of(ProtocolEnum protocol, byte[] data) {
        P2PMessage message = new P2PMessage();
        message.setType(protocol.getCode());
        message.setData(data);
        return message;
    }

    public static boolean isCompatible(int version) {
        return version >= MIN_COMPATIBLE_VERSION && version <= CURRENT_VERSION;
    }

    /**
     * 设置业务数据，同步length字段，null按空数组处理
     */
    public void setData(byte[] data) {
        this.data = data == null ? new byte[0] : data;
        this.length = this.data.length;
    }

    public ProtocolEnum protocol() {
        return ProtocolEnum.fromCode(type);
    }

    @Override
    public String toString() {
        return "P2PMessage{type=" + type + ", version=" + version + ", length=" + length + '}';
    }
}
