package com.bit.sigmos.structure.dto;

import com.bit.sigmos.p2p.session.PeerSession;
import lombok.Data;

@Data
public class PeerView {
    private String nodeId;
    private String address;
    private String role;
    private String state;
    private long height;
    private String tipHash;

    public static PeerView of(PeerSession session) {
        PeerView view = new PeerView();
        view.setNodeId(session.getPeerNodeId());
        view.setAddress(String.valueOf(session.getRemoteAddress()));
        view.setRole(session.getRole().name());
        view.setState(session.getState().name());
        view.setHeight(session.getPeerHeight());
        view.setTipHash(session.getPeerTipHash() == null ? null : session.getPeerTipHash().toHex());
        return view;
    }
}
