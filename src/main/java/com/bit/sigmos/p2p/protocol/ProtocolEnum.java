package com.bit.sigmos.p2p.protocol;

import lombok.Getter;


/**
 * 协议枚举（作为注册Key），code 对应 P2PMessage 的 type 字段
 */
@Getter
public enum ProtocolEnum {
    // 枚举项：(code, 协议字符串, 是否有返回)
    HELLO(1, "/hello/1.0.0", false),

    STATUS_REQUEST(2, "/status/request/1.0.0", true),//需要返回STATUS_RESPONSE
    STATUS_RESPONSE(3, "/status/response/1.0.0", false),

    CHAIN_REQUEST(4, "/chain/request/1.0.0", true),//需要返回CHAIN_RESPONSE
    CHAIN_RESPONSE(5, "/chain/response/1.0.0", false),

    BLOCK_ANNOUNCE(6, "/block/1.0.0", false),
    TRANSFER_ANNOUNCE(7, "/transfer/1.0.0", false),
    IDENTITY_ANNOUNCE(8, "/identity/1.0.0", false),
    ;

    // 协议编码（对应P2PMessage的type字段）
    private final int code;
    // 协议字符串标识
    private final String protocol;
    // 是否有返回值 true/有返回值 false/无返回值
    private final boolean hasResponse;


    ProtocolEnum(int code, String protocol, boolean hasResponse) {
        this.code = code;
        this.protocol = protocol;
        this.hasResponse = hasResponse;
    }

    /** 根据code反向查找枚举 */
    public static ProtocolEnum fromCode(int code) {
        for (ProtocolEnum e : values()) {
            if (e.getCode() == code) {
                return e;
            }
        }
        throw new IllegalArgumentException("无效的协议code：" + code);
    }

    /** 根据协议字符串反向查找枚举（标准化处理） */
    public static ProtocolEnum fromProtocol(String protocol) {
        String standardized = protocol.trim().toLowerCase().replaceAll("/+", "/").replaceAll("/$", "");
        for (ProtocolEnum e : values()) {
            if (e.getProtocol().equals(standardized)) {
                return e;
            }
        }
        throw new IllegalArgumentException("未注册的协议字符串：" + protocol);
    }
}
