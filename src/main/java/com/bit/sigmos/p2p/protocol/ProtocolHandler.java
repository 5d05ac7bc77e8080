package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.p2p.session.PeerSession;

/**
 * 协议处理器，每种消息类型一个实现，由 ProtocolRegistry 按 type 分发
 * 有返回的协议由处理器自行通过会话回写响应
 */
public interface ProtocolHandler {

    ProtocolEnum protocol();

    void handle(PeerSession session, P2PMessage message) throws Exception;
}
