package com.bit.sigmos.structure.dto;

import lombok.Data;

@Data
public class TransferRequest {
    private String fromId;
    private String toId;
    private String topic;
    private String payload;
}
