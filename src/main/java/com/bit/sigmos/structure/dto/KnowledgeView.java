package com.bit.sigmos.structure.dto;

import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.Data;

@Data
public class KnowledgeView {
    private String contentId;
    private String fromId;
    private String toId;
    private String topic;
    private String payload;
    private long createdAt;

    public static KnowledgeView of(KnowledgeTransfer transfer) {
        KnowledgeView view = new KnowledgeView();
        view.setContentId(transfer.contentId().toHex());
        view.setFromId(transfer.getFromId());
        view.setToId(transfer.getToId());
        view.setTopic(transfer.getTopic());
        view.setPayload(transfer.getPayload());
        view.setCreatedAt(transfer.getCreatedAt());
        return view;
    }
}
