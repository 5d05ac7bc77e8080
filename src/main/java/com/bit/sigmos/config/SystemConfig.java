package com.bit.sigmos.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {
    private String path = "data/sigmos";//保存路径
    private String dbType = "rocksdb";//rocksdb / memory
    private String nodeId = UUID.randomUUID().toString();//节点ID 每次启动可不同
    private String host = "0.0.0.0";
    private int port = 7788;
    private List<String> bootstrapPeers = new ArrayList<>();// host:port
    private String autoMineIdentity;//启动后自动挖矿的身份ID
    private boolean autoMineContinuous = true;
}
