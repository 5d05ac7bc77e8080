package com.bit.sigmos.p2p.session;

/**
 * 会话状态机
 * DISCONNECTED → CONNECTING → HANDSHAKING → SYNCED ⇄ RELAYING → DISCONNECTED
 * SYNCED：握手完成，双方互知tip；RELAYING：正在与该节点交换链数据
 */
public enum PeerState {
    DISCONNECTED,
    CONNECTING,
    HANDSHAKING,
    SYNCED,
    RELAYING;

    public boolean canTransitionTo(PeerState next) {
        if (next == DISCONNECTED) {
            return this != DISCONNECTED;
        }
        switch (this) {
            case DISCONNECTED:
                return next == CONNECTING;
            case CONNECTING:
                return next == HANDSHAKING;
            case HANDSHAKING:
                return next == SYNCED;
            case SYNCED:
                return next == RELAYING;
            case RELAYING:
                return next == SYNCED;
            default:
                return false;
        }
    }

    /**
     * 握手完成后的状态，可以收发链数据
     */
    public boolean isEstablished() {
        return this == SYNCED || this == RELAYING;
    }
}
