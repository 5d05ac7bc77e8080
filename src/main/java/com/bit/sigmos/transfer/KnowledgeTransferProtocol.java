package com.bit.sigmos.transfer;

import com.bit.sigmos.blockchain.RejectReason;
import com.bit.sigmos.blockchain.ValidationResult;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 知识转移协议：构造与校验
 * 只准备记录，不重试：未被打包的转移没有任何效果
 */
@Component
public class KnowledgeTransferProtocol {

    private final IdentityRegistry identityRegistry;

    public KnowledgeTransferProtocol(IdentityRegistry identityRegistry) {
        this.identityRegistry = identityRegistry;
    }

    public KnowledgeTransfer prepare(String fromId, String toId, String topic, String payload) {
        return new KnowledgeTransfer(fromId, toId, topic, payload, System.currentTimeMillis());
    }

    /**
     * 完整校验：内容合法，且未在给定链上出现过
     */
    public ValidationResult validate(KnowledgeTransfer transfer, List<Block> chain) {
        ValidationResult content = validateContent(transfer);
        if (!content.isOk()) {
            return content;
        }
        for (Block block : chain) {
            if (block.getTransactions().contains(transfer)) {
                return duplicate(transfer, block.getIndex());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * 与链无关的校验：双方身份存在，主题和内容非空
     */
    public ValidationResult validateContent(KnowledgeTransfer transfer) {
        if (!identityRegistry.contains(transfer.getFromId())) {
            return ValidationResult.reject(RejectReason.INVALID_TRANSACTION, "发送方身份不存在: " + transfer.getFromId());
        }
        if (!identityRegistry.contains(transfer.getToId())) {
            return ValidationResult.reject(RejectReason.INVALID_TRANSACTION, "接收方身份不存在: " + transfer.getToId());
        }
        if (transfer.getTopic().isBlank()) {
            return ValidationResult.reject(RejectReason.INVALID_TRANSACTION, "知识主题不能为空");
        }
        if (transfer.getPayload().isEmpty()) {
            return ValidationResult.reject(RejectReason.INVALID_TRANSACTION, "知识内容不能为空");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult duplicate(KnowledgeTransfer transfer, long blockIndex) {
        return ValidationResult.reject(RejectReason.INVALID_TRANSACTION,
                "知识转移重复: " + transfer.contentId() + " 已存在于区块 " + blockIndex);
    }
}
