package com.bit.sigmos.structure.block;

import com.bit.sigmos.common.BlockHash;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import com.bit.sigmos.util.ProtoUtils;
import com.bit.sigmos.util.Sha;
import com.google.protobuf.WireFormat;
import lombok.Getter;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 区块
 * 哈希 = SHA-256(区块头规范序列化)，区块头包含除哈希外的全部字段（交易以根哈希承诺）
 * 接收方总是重新计算哈希，线上传来的哈希只用于比对
 */
@Getter
public final class Block {

    private final long index;
    private final BlockHash previousHash;
    private final long timestamp;
    private final String minerId;
    private final long nonce;
    private final BigInteger difficultyTarget;
    /** 矿工出块时使用的意识分数快照，参与有效阈值计算 */
    private final double minerScore;
    private final List<KnowledgeTransfer> transactions;
    private final byte[] transactionsRoot;
    private final BlockHash hash;
    /**
     * 反序列化时线上携带的哈希，本地构造的区块为null
     */
    private final BlockHash declaredHash;

    public Block(long index, BlockHash previousHash, long timestamp, String minerId, long nonce,
                 BigInteger difficultyTarget, double minerScore, List<KnowledgeTransfer> transactions) {
        this(index, previousHash, timestamp, minerId, nonce, difficultyTarget, minerScore, transactions, null);
    }

    private Block(long index, BlockHash previousHash, long timestamp, String minerId, long nonce,
                  BigInteger difficultyTarget, double minerScore, List<KnowledgeTransfer> transactions,
                  BlockHash declaredHash) {
        this.index = index;
        this.previousHash = Objects.requireNonNull(previousHash, "previousHash");
        this.timestamp = timestamp;
        this.minerId = Objects.requireNonNull(minerId, "minerId");
        this.nonce = nonce;
        this.difficultyTarget = Objects.requireNonNull(difficultyTarget, "difficultyTarget");
        this.minerScore = minerScore;
        this.transactions = Collections.unmodifiableList(new ArrayList<>(transactions));
        this.transactionsRoot = transactionsRoot(this.transactions);
        this.hash = computeHash(headerBytes(index, previousHash, timestamp, minerId, nonce,
                difficultyTarget, minerScore, transactionsRoot));
        this.declaredHash = declaredHash;
    }

    /**
     * 交易根 = SHA-256(按顺序拼接的各转移内容哈希)
     */
    public static byte[] transactionsRoot(List<KnowledgeTransfer> transactions) {
        byte[][] ids = new byte[transactions.size()][];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = transactions.get(i).contentId().toBytes();
        }
        return Sha.applySHA256(ids);
    }

    /**
     * 区块头规范序列化，挖矿循环直接调用，避免每个nonce构造区块对象
     */
    public static byte[] headerBytes(long index, BlockHash previousHash, long timestamp, String minerId, long nonce,
                                     BigInteger difficultyTarget, double minerScore, byte[] transactionsRoot) {
        byte[] target = ProtoUtils.toUint256(difficultyTarget);
        return ProtoUtils.write(out -> {
            out.writeInt64(1, index);
            out.writeByteArray(2, previousHash.toBytes());
            out.writeInt64(3, timestamp);
            out.writeString(4, minerId);
            out.writeInt64(5, nonce);
            out.writeByteArray(6, target);
            out.writeDouble(7, minerScore);
            out.writeByteArray(8, transactionsRoot);
        });
    }

    public static BlockHash computeHash(byte[] headerBytes) {
        return BlockHash.fromBytes(Sha.applySHA256(headerBytes));
    }

    public byte[] getTransactionsRoot() {
        return transactionsRoot.clone();
    }

    public boolean isGenesis() {
        return index == 0;
    }

    /**
     * 线上哈希与重新计算的哈希是否一致（本地区块恒为true）
     */
    public boolean declaredHashMatches() {
        return declaredHash == null || declaredHash.equals(hash);
    }

    // ========================== 序列化反序列化 ==========================

    public byte[] serialize() {
        byte[] target = ProtoUtils.toUint256(difficultyTarget);
        return ProtoUtils.write(out -> {
            out.writeInt64(1, index);
            out.writeByteArray(2, previousHash.toBytes());
            out.writeInt64(3, timestamp);
            out.writeString(4, minerId);
            out.writeInt64(5, nonce);
            out.writeByteArray(6, target);
            out.writeDouble(7, minerScore);
            for (KnowledgeTransfer tx : transactions) {
                out.writeByteArray(9, tx.serialize());
            }
            out.writeByteArray(10, hash.toBytes());
        });
    }

    public static Block deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            long index = 0;
            byte[] previousHash = null;
            long timestamp = 0;
            String minerId = "";
            long nonce = 0;
            byte[] target = null;
            double minerScore = 0.0;
            List<KnowledgeTransfer> transactions = new ArrayList<>();
            byte[] declared = null;
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> index = in.readInt64();
                    case 2 -> previousHash = in.readByteArray();
                    case 3 -> timestamp = in.readInt64();
                    case 4 -> minerId = in.readString();
                    case 5 -> nonce = in.readInt64();
                    case 6 -> target = in.readByteArray();
                    case 7 -> minerScore = in.readDouble();
                    case 9 -> transactions.add(KnowledgeTransfer.deserialize(in.readByteArray()));
                    case 10 -> declared = in.readByteArray();
                    default -> in.skipField(tag);
                }
            }
            if (previousHash == null || previousHash.length != BlockHash.HASH_LENGTH) {
                throw new IOException("区块父哈希缺失或长度错误");
            }
            if (target == null || target.length != ProtoUtils.UINT256_LENGTH) {
                throw new IOException("区块难度目标缺失或长度错误");
            }
            if (declared == null || declared.length != BlockHash.HASH_LENGTH) {
                throw new IOException("区块哈希缺失或长度错误");
            }
            return new Block(index, BlockHash.fromBytes(previousHash), timestamp, minerId, nonce,
                    ProtoUtils.fromUint256(target), minerScore, transactions, BlockHash.fromBytes(declared));
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Block)) {
            return false;
        }
        return hash.equals(((Block) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Block{index=" + index + ", hash=" + hash + ", prev=" + previousHash + ", miner=" + minerId
                + ", txs=" + transactions.size() + "}";
    }
}
