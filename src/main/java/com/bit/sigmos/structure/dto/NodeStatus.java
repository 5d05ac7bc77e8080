package com.bit.sigmos.structure.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class NodeStatus {
    private String nodeId;
    private int port;
    private long height;
    private String tipHash;
    //累计难度（十进制字符串）
    private String cumulativeDifficulty;
    private List<PeerView> knownPeers = new ArrayList<>();
    private List<String> miningIdentities = new ArrayList<>();
    private int pendingTransfers;
}
