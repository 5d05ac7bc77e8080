package com.bit.sigmos.p2p.protocol.impl;

import com.bit.sigmos.p2p.protocol.P2PMessage;
import com.bit.sigmos.p2p.protocol.ProtocolEnum;
import com.bit.sigmos.p2p.protocol.ProtocolHandler;
import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.PeerSessionManager;
import com.bit.sigmos.sigel.IdentityRegistry;
import com.bit.sigmos.structure.sigel.IdentityRecord;
import org.springframework.stereotype.Component;

/**
 * 身份快照广播，注册表采纳了更新的快照才继续转发
 */
@Component
public class IdentityAnnounceHandler implements ProtocolHandler {

    private final IdentityRegistry identityRegistry;
    private final PeerSessionManager sessionManager;

    public IdentityAnnounceHandler(IdentityRegistry identityRegistry, PeerSessionManager sessionManager) {
        this.identityRegistry = identityRegistry;
        this.sessionManager = sessionManager;
    }

    @Override
    public ProtocolEnum protocol() {
        return ProtocolEnum.IDENTITY_ANNOUNCE;
    }

    @Override
    public void handle(PeerSession session, P2PMessage message) throws Exception {
        IdentityRecord record = IdentityRecord.deserialize(message.getData());
        if (identityRegistry.upsert(record)) {
            sessionManager.broadcastIdentity(record, session);
        }
    }
}
