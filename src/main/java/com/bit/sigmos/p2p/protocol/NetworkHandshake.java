package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.util.ProtoUtils;
import com.google.protobuf.WireFormat;
import lombok.Data;

import java.io.IOException;

/**
 * 握手消息（HELLO），连接建立后双方各发一次
 */
@Data
public class NetworkHandshake {
    /**
     * 网络魔法值：创世区块哈希
     * 作用：区分不同网络/难度配置，防止节点接入错误网络
     */
    private byte[] networkMagic = new byte[0];

    /**
     * 协议版本，不在兼容范围内则断开
     */
    private int protocolVersion;

    private long chainHeight;

    private byte[] tipHash = new byte[0];

    //节点ID
    private String nodeId = "";

    // ========================== 序列化/反序列化核心方法 ==========================

    public byte[] serialize() {
        return ProtoUtils.write(out -> {
            out.writeByteArray(1, networkMagic);
            out.writeInt32(2, protocolVersion);
            out.writeInt64(3, chainHeight);
            out.writeByteArray(4, tipHash);
            out.writeString(5, nodeId);
        });
    }

    public static NetworkHandshake deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            NetworkHandshake handshake = new NetworkHandshake();
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> handshake.setNetworkMagic(in.readByteArray());
                    case 2 -> handshake.setProtocolVersion(in.readInt32());
                    case 3 -> handshake.setChainHeight(in.readInt64());
                    case 4 -> handshake.setTipHash(in.readByteArray());
                    case 5 -> handshake.setNodeId(in.readString());
                    default -> in.skipField(tag);
                }
            }
            return handshake;
        });
    }
}
