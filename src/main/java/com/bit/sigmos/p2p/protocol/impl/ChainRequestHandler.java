package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.blockchain.Ledger;
import com.bit.sigmos.config.P2pConfig;
import com.bit.sigmos.p2p.protocol.ChainRequest;
import com.bit.sigmos.p2p.protocol.ChainResponse;
import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.structure.block.Block;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 返回从 fromIndex 开始的区块，单次最多 maxBlocksPerResponse 个
 */
@Slf4j
@Component
public class ChainRequestHandler implements ProtocolHandler {

    private final Ledger ledger;
    private final P2pConfig p2pConfig;

    public ChainRequestHandler(Ledger ledger, P2pConfig p2pConfig) {
        this.ledger = ledger;
        this.p2pConfig = p2pConfig;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.CHAIN_REQUEST;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        ChainRequest request = ChainRequest.deserialize(message.getData());
        long height = ledger.height();
        List<Block> blocks = ledger.blocksFrom(Math.max(0, request.getFromIndex()), p2pConfig.getMaxBlocksPerResponse());
        log.debug("{} 请求区块 from={}，返回 {} 个", session.getPeerNodeId(), request.getFromIndex(), blocks.size());
        session.send(ProtocolEnum.CHAIN_RESPONSE, new ChainResponse(blocks, height).serialize());
    }
}
