package com.bit.sigmos.p2p.session;

/**
 * 对端违反协议（非法状态迁移、握手不兼容等），会话必须断开
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
