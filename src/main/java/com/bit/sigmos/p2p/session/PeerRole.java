package com.bit.sigmos.p2p.session;

public enum PeerRole {
    /** 本节点主动发起连接 */
    INITIATOR,
    /** 对端连入本节点 */
    ACCEPTOR
}
