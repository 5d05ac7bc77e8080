package com.bit.sigmos.structure.tx;

import com.bit.sigmos.common.ContentHash;
import com.bit.sigmos.util.ProtoUtils;
import com.bit.sigmos.util.Sha;
import com.google.protobuf.WireFormat;
import lombok.Getter;

import java.io.IOException;
import java.util.Objects;

/**
 * 知识转移记录，作为区块交易写入链上
 * 内容身份 = SHA-256(五个字段的规范序列化)，相等性按内容判断
 */
@Getter
public final class KnowledgeTransfer {

    private final String fromId;
    private final String toId;
    private final String topic;
    private final String payload;
    private final long createdAt;

    // 规范序列化和内容哈希在构造时计算一次
    private final transient byte[] encoded;
    private final transient ContentHash contentId;

    public KnowledgeTransfer(String fromId, String toId, String topic, String payload, long createdAt) {
        this.fromId = Objects.requireNonNull(fromId, "fromId");
        this.toId = Objects.requireNonNull(toId, "toId");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.createdAt = createdAt;
        this.encoded = ProtoUtils.write(out -> {
            out.writeString(1, this.fromId);
            out.writeString(2, this.toId);
            out.writeString(3, this.topic);
            out.writeString(4, this.payload);
            out.writeInt64(5, this.createdAt);
        });
        this.contentId = ContentHash.fromBytes(Sha.applySHA256(encoded));
    }

    public ContentHash contentId() {
        return contentId;
    }

    public byte[] serialize() {
        return encoded.clone();
    }

    public static KnowledgeTransfer deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            String from = "";
            String to = "";
            String topic = "";
            String payload = "";
            long createdAt = 0;
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> from = in.readString();
                    case 2 -> to = in.readString();
                    case 3 -> topic = in.readString();
                    case 4 -> payload = in.readString();
                    case 5 -> createdAt = in.readInt64();
                    default -> in.skipField(tag);
                }
            }
            return new KnowledgeTransfer(from, to, topic, payload, createdAt);
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KnowledgeTransfer)) {
            return false;
        }
        return contentId.equals(((KnowledgeTransfer) o).contentId);
    }

    @Override
    public int hashCode() {
        return contentId.hashCode();
    }

    @Override
    public String toString() {
        return "KnowledgeTransfer{" + fromId + " -> " + toId + ", topic='" + topic + "', id=" + contentId + "}";
    }
}
