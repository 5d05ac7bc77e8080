package com.bit.sigmos.sigel;

import com.bit.sigmos.database.DataBase;
import com.bit.sigmos.database.rocksDb.TableEnum;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 身份注册表：本节点已知的全部身份快照（本地创建 + 网络广播）
 * 同一身份只保留训练次数最高的快照
 */
@Slf4j
@Component
public class IdentityRegistry {

    private final DataBase dataBase;
    private final Map<String, IdentityRecord> identities = new ConcurrentHashMap<>();

    public IdentityRegistry(DataBase dataBase) {
        this.dataBase = dataBase;
    }

    /**
     * 损坏的档案保留在存储中，对端重新广播该身份时覆盖
     */
    public void load() {
        int[] corrupted = {0};
        dataBase.iterate(TableEnum.SIGEL, (key, value) -> {
            try {
                IdentityRecord record = IdentityRecord.deserialize(value);
                identities.put(record.getId(), record);
            } catch (IOException e) {
                log.error("身份档案损坏，已跳过: {}", new String(key, StandardCharsets.UTF_8), e);
                corrupted[0]++;
            }
            return true;
        });
        log.info("加载身份档案 {} 个，损坏 {} 个", identities.size(), corrupted[0]);
    }

    /**
     * 注册或更新身份
     * @return 快照是否被采纳（新身份，或训练次数严格更高）
     */
    public boolean upsert(IdentityRecord record) {
        boolean[] accepted = {false};
        identities.compute(record.getId(), (id, existing) -> {
            if (existing != null && existing.getTrainingIterations() >= record.getTrainingIterations()) {
                return existing;
            }
            dataBase.update(TableEnum.SIGEL, key(id), record.serialize());
            accepted[0] = true;
            return record;
        });
        if (accepted[0]) {
            log.debug("身份档案已更新: {} iterations={}", record.getId(), record.getTrainingIterations());
        }
        return accepted[0];
    }

    public Optional<IdentityRecord> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(identities.get(id));
    }

    public boolean contains(String id) {
        return id != null && identities.containsKey(id);
    }

    public List<IdentityRecord> all() {
        List<IdentityRecord> records = new ArrayList<>(identities.values());
        records.sort(Comparator.comparingLong(IdentityRecord::getCreatedAt).thenComparing(IdentityRecord::getId));
        return records;
    }

    /**
     * 演化一次并保存
     */
    public Optional<IdentityRecord> evolve(String id) {
        IdentityRecord current = identities.get(id);
        if (current == null) {
            return Optional.empty();
        }
        IdentityRecord evolved = current.evolve();
        upsert(evolved);
        return get(id);
    }

    private static byte[] key(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }
}
