package com.bit.sigmos.p2p.protocol;

import com.bit.sigmos.util.ProtoUtils;
import com.google.protobuf.WireFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainRequest {

    private long fromIndex;

    public byte[] serialize() {
        return ProtoUtils.write(out -> out.writeInt64(1, fromIndex));
    }

    public static ChainRequest deserialize(byte[] data) throws IOException {
        return ProtoUtils.read(data, in -> {
            ChainRequest request = new ChainRequest();
            boolean done = false;
            while (!done) {
                int tag = in.readTag();
                switch (WireFormat.getTagFieldNumber(tag)) {
                    case 0 -> done = true;
                    case 1 -> request.setFromIndex(in.readInt64());
                    default -> in.skipField(tag);
                }
            }
            return request;
        });
    }
}
