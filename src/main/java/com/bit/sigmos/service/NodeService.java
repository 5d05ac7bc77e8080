package com.bit.sigmos.service;

import com.bit.sigmos.result.Result;
import com.bit.sigmos.structure.dto.BlockView;
import com.bit.sigmos.structure.dto.IdentityView;
import com.bit.sigmos.structure.dto.KnowledgeView;
import com.bit.sigmos.structure.dto.NodeStatus;
import com.bit.sigmos.structure.dto.PeerView;

import java.util.List;

/**
 * 节点对外操作，命令行/HTTP 层只消费 Result
 */
public interface NodeService {

    Result<IdentityView> createIdentity(String name);

    /**
     * @param identityId 以该本地身份接入网络，可为空
     */
    Result<PeerView> connect(String host, int port, String identityId);

    Result<String> mine(String identityId, boolean continuous);

    Result<BlockView> mineOnce(String identityId);

    Result<String> stopMining(String identityId);

    Result<NodeStatus> status();

    /**
     * @return 知识转移内容哈希
     */
    Result<String> transfer(String fromId, String toId, String topic, String payload);

    Result<List<IdentityView>> identities();

    Result<List<KnowledgeView>> knowledge(String identityId);

    Result<IdentityView> evolve(String identityId);

    Result<BlockView> block(long index);
}
