package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.p2p.session.PeerSession;
import com.bit.sigmos.p2p.session.ProtocolViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 协议注册表：核心管理枚举与处理器的绑定关系
 */
@Slf4j
@Component
public class ProtocolRegistry {

    // 存储协议枚举 → 处理器的映射，启动后只读
    private final Map<ProtocolEnum, ProtocolHandler> handlerMap = new EnumMap<>(ProtocolEnum.class);

    public ProtocolRegistry(List<ProtocolHandler> handlers) {
        for (ProtocolHandler handler : handlers) {
            ProtocolHandler previous = handlerMap.put(handler.protocol(), handler);
            if (previous != null) {
                throw new IllegalStateException("协议重复注册：" + handler.protocol().getProtocol());
            }
            log.info("注册协议处理器：{} -> {}", handler.protocol().getProtocol(), handler.getClass().getSimpleName());
        }
    }

    /**
     * 执行协议处理（核心调用入口）
     * 握手完成前只接受 HELLO
     */
    public void dispatch(PeerSession session, P2PMessage message) throws Exception {
        if (!P2PMessage.isCompatible(message.getVersion())) {
            throw new ProtocolViolationException("不兼容的协议版本: " + message.getVersion());
        }
        ProtocolEnum protocol = message.protocol();
        if (protocol != ProtocolEnum.HELLO && !session.getState().isEstablished()) {
            throw new ProtocolViolationException("握手完成前收到消息: " + protocol.getProtocol());
        }
        ProtocolHandler handler = handlerMap.get(protocol);
        if (handler == null) {
            throw new IllegalStateException("未找到协议处理器：" + protocol.getProtocol());
        }
        handler.handle(session, message);
    }
}
