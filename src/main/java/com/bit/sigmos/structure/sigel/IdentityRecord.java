package com.bit.sigmos.structure.sigel;

import com.bit.sigmos.util.ProtoUtils;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Sigel 身份档案（参与者画像）
 * 不可变快照：训练模块演化身份时产生新快照，账本、挖矿、知识转移只读取快照计算分数
 */
@Getter
@ToString
@EqualsAndHashCode
public final class IdentityRecord {

    /** 新建身份的默认性格特征 */
    private static final Map<String, Double> DEFAULT_TRAITS;

    static {
        Map<String, Double> traits = new TreeMap<>();
        traits.put("curiosity", 0.8);
        traits.put("wisdom", 0.5);
        traits.put("creativity", 0.7);
        traits.put("logic", 0.9);
        DEFAULT_TRAITS = Collections.unmodifiableMap(traits);
    }

    public static final double DEFAULT_DIMENSIONAL_AWARENESS = 3.0;
    public static final double DEFAULT_ENTROPY_RESISTANCE = 0.7;
    /** 每次演化维度感知的增长倍数 */
    private static final double EVOLVE_AWARENESS_FACTOR = 1.001;

    private final String id;
    private final String name;
    private final Map<String, Double> traits;
    private final double dimensionalAwareness;
    private final double entropyResistance;
    private final long trainingIterations;
    private final long createdAt;

    @Builder(toBuilder = true)
    public IdentityRecord(String id, String name, Map<String, Double> traits, double dimensionalAwareness,
                          double entropyResistance, long trainingIterations, long createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("身份ID不能为空");
        }
        if (!Double.isFinite(dimensionalAwareness) || dimensionalAwareness < 0) {
            throw new IllegalArgumentException("dimensionalAwareness必须为非负有限值: " + dimensionalAwareness);
        }
        if (!inUnitRange(entropyResistance)) {
            throw new IllegalArgumentException("entropyResistance必须在[0,1]内: " + entropyResistance);
        }
        if (trainingIterations < 0) {
            throw new IllegalArgumentException("trainingIterations不能为负: " + trainingIterations);
        }
        TreeMap<String, Double> copy = new TreeMap<>();
        if (traits != null) {
            for (Map.Entry<String, Double> entry : traits.entrySet()) {
                Double value = entry.getValue();
                if (value == null || !inUnitRange(value)) {
                    throw new IllegalArgumentException("特征[" + entry.getKey() + "]必须在[0,1]内: " + value);
                }
                copy.put(entry.getKey(), value);
            }
        }
        this.id = id;
        this.name = name == null ? "" : name;
        this.traits = Collections.unmodifiableMap(copy);
        this.dimensionalAwareness = dimensionalAwareness;
        this.entropyResistance = entropyResistance;
        this.trainingIterations = trainingIterations;
        this.createdAt = createdAt;
    }

    /**
     * 以默认画像创建新身份
     */
    public static IdentityRecord create(String name) {
        return new IdentityRecord(UUID.randomUUID().toString(), name, DEFAULT_TRAITS,
                DEFAULT_DIMENSIONAL_AWARENESS, DEFAULT_ENTROPY_RESISTANCE, 0, System.currentTimeMillis());
    }

    /**
     * 意识分数 = dimensional_awareness × entropy_resistance × (baseline + mean(traits))
     * 派生值，每次按当前快照重新计算
     */
    public double consciousnessScore(double traitBaseline) {
        return dimensionalAwareness * entropyResistance * (traitBaseline + meanTrait());
    }

    public double meanTrait() {
        if (traits.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : traits.values()) {
            sum += value;
        }
        return sum / traits.size();
    }

    /**
     * 演化一次：训练次数+1，维度感知缓慢增长
     */
    public IdentityRecord evolve() {
        return toBuilder()
                .trainingIterations(trainingIterations + 1)
                .dimensionalAwareness(dimensionalAwareness * EVOLVE_AWARENESS_FACTOR)
                .build();
    }

    public IdentityRecord withTrait(String trait, double value) {
        Map<String, Double> updated = new TreeMap<>(traits);
        updated.put(trait, value);
        return toBuilder().traits(updated).build();
    }

    private static boolean inUnitRange(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= 1.0;
    }

    // ========================== 序列化反序列化 ==========================

    public byte[] serialize() {
        return ProtoUtils.write(out -> {
            out.writeString(1, id);
            out.writeString(2, name);
            for (Map.Entry<String, Double> entry : traits.entrySet()) {
                byte[] trait = ProtoUtils.write(t -> {
                    t.writeString(1, entry.getKey());
                    t.writeDouble(2, entry.getValue());
                });
                out.writeByteArray(3, trait);
            }
            out.writeDouble(4, dimensionalAwareness);
            out.writeDouble(5, entropyResistance);
            out.writeInt64(6, trainingIterations);
            out.writeInt64(7, createdAt);
        });
    }

    public static IdentityRecord deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            IdentityRecordBuilder builder = IdentityRecord.builder();
            Map<String, Double> traits = new TreeMap<>();
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> builder.id(in.readString());
                    case 2 -> builder.name(in.readString());
                    case 3 -> readTrait(in.readByteArray(), traits);
                    case 4 -> builder.dimensionalAwareness(in.readDouble());
                    case 5 -> builder.entropyResistance(in.readDouble());
                    case 6 -> builder.trainingIterations(in.readInt64());
                    case 7 -> builder.createdAt(in.readInt64());
                    default -> in.skipField(tag);
                }
            }
            try {
                return builder.traits(traits).build();
            } catch (IllegalArgumentException e) {
                throw new IOException("身份档案字段非法: " + e.getMessage(), e);
            }
        });
    }

    private static void readTrait(byte[] data, Map<String, Double> traits) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(data);
        String key = null;
        double value = 0.0;
        boolean done = false;
        while (!done) {
            int tag = in.readTag();
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 0 -> done = true;
                case 1 -> key = in.readString();
                case 2 -> value = in.readDouble();
                default -> in.skipField(tag);
            }
        }
        if (key == null) {
            throw new IOException("特征缺少名称");
        }
        traits.put(key, value);
    }
}
