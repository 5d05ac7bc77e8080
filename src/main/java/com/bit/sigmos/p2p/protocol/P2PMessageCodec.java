package com.bit.sigmos.p2p.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;

/**
 * P2PMessage 与已分帧 ByteBuf 之间的编解码（网络字节序）
 * 非法帧抛出 CorruptedFrameException，由会话处理器断开连接
 */
public class P2PMessageCodec extends MessageToMessageCodec<ByteBuf, P2PMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, P2PMessage msg, List<Object> out) {
        byte[] data = msg.getData();
        ByteBuf buf = ctx.alloc().buffer(P2PMessage.HEADER_LENGTH + data.length);
        buf.writeShort(msg.getVersion());
        buf.writeInt(msg.getType());
        buf.writeInt(data.length);
        buf.writeBytes(data);
        out.add(buf);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        if (frame.readableBytes() < P2PMessage.HEADER_LENGTH) {
            throw new CorruptedFrameException("帧长度不足: " + frame.readableBytes());
        }
        short version = frame.readShort();
        int type = frame.readInt();
        int length = frame.readInt();
        if (length < 0 || length != frame.readableBytes()) {
            throw new CorruptedFrameException("数据长度与帧不一致: 声明 " + length + "，实际 " + frame.readableBytes());
        }
        try {
            ProtocolEnum.fromCode(type);
        } catch (IllegalArgumentException e) {
            throw new CorruptedFrameException("未知消息类型: " + type, e);
        }
        byte[] data = new byte[length];
        frame.readBytes(data);

        P2PMessage message = new P2PMessage();
        message.setVersion(version);
        message.setType(type);
        message.setData(data);
        out.add(message);
    }
}
