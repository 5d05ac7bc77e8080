package com.bit.sigmos.structure.dto;

import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.structure.tx.KnowledgeTransfer;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BlockView {
    private long index;
    private String hash;
    private String previousHash;
    private long timestamp;
    private String minerId;
    private long nonce;
    private String difficultyTarget;
    private double minerScore;
    private List<KnowledgeView> transactions = new ArrayList<>();

    public static BlockView of(Block block) {
        BlockView view = new BlockView();
        view.setIndex(block.getIndex());
        view.setHash(block.getHash().toHex());
        view.setPreviousHash(block.getPreviousHash().toHex());
        view.setTimestamp(block.getTimestamp());
        view.setMinerId(block.getMinerId());
        view.setNonce(block.getNonce());
        view.setDifficultyTarget(block.getDifficultyTarget().toString(16));
        view.setMinerScore(block.getMinerScore());
        for (KnowledgeTransfer transfer : block.getTransactions()) {
            view.getTransactions().add(KnowledgeView.of(transfer));
        }
        return view;
    }
}
