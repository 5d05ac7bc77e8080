package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.structure.block.Block;
import com.bit.sigmos.util.ProtoUtils;
import com.google.protobuf.WireFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * CHAIN_RESPONSE 负载：按高度升序的连续区块，附带应答方当前高度
 * 接收方据此判断是否需要继续请求后续区块
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainResponse {

    private List<Block> blocks = new ArrayList<>();
    private long chainHeight;

    public byte[] serialize() {
        return ProtoUtils.write(out -> {
            out.writeInt64(1, chainHeight);
            for (Block block : blocks) {
                out.writeByteArray(2, block.serialize());
            }
        });
    }

    public static ChainResponse deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            ChainResponse response = new ChainResponse();
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> response.setChainHeight(in.readInt64());
                    case 2 -> response.getBlocks().add(Block.deserialize(in.readByteArray()));
                    default -> in.skipField(tag);
                }
            }
            return response;
        });
    }
}
