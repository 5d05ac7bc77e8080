package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.util.ProtoUtils;
import com.google.protobuf.WireFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * STATUS_RESPONSE 负载：对端当前高度和tip
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainStatus {

    private long chainHeight;
    private byte[] tipHash = new byte[0];

    public byte[] serialize() {
        return ProtoUtils.write(out -> {
            out.writeInt64(1, chainHeight);
            out.writeByteArray(2, tipHash);
        });
    }

    public static ChainStatus deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            ChainStatus status = new ChainStatus();
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> status.setChainHeight(in.readInt64());
                    case 2 -> status.setTipHash(in.readByteArray());
                    default -> in.skipField(tag);
                }
            }
            return status;
        });
    }
}
