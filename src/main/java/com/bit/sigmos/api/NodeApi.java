package com.bit.sigmos.api;

import com.bit.sigmos.result.Result;
import com.bit.sigmos.service.NodeService;
import com.bit.sigmos.structure.dto.BlockView;
import com.bit.sigmos.structure.dto.IdentityView;
import com.bit.sigmos.structure.dto.KnowledgeView;
import com.bit.sigmos.structure.dto.NodeStatus;
import com.bit.sigmos.structure.dto.PeerView;
import com.bit.sigmos.structure.dto.TransferRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/node")
public class NodeApi {

    @Autowired
    private NodeService nodeService;

    // 创建身份
    @PostMapping("/identity")
    public Result<IdentityView> createIdentity(@RequestParam String name) {
        return nodeService.createIdentity(name);
    }

    @GetMapping("/identities")
    public Result<List<IdentityView>> identities() {
        return nodeService.identities();
    }

    // 演化一次身份
    @PostMapping("/identity/{id}/evolve")
    public Result<IdentityView> evolve(@PathVariable String id) {
        return nodeService.evolve(id);
    }

    // 某身份已接收的知识
    @GetMapping("/identity/{id}/knowledge")
    public Result<List<KnowledgeView>> knowledge(@PathVariable String id) {
        return nodeService.knowledge(id);
    }

    @PostMapping("/connect")
    public Result<PeerView> connect(@RequestParam String host, @RequestParam int port,
                                    @RequestParam(required = false) String identityId) {
        return nodeService.connect(host, port, identityId);
    }

    // 启动挖矿 continuous=false 时出一个块后停止
    @PostMapping("/mine")
    public Result<String> mine(@RequestParam String identityId,
                               @RequestParam(defaultValue = "true") boolean continuous) {
        return nodeService.mine(identityId, continuous);
    }

    // 同步执行一轮挖矿尝试
    @PostMapping("/mine/once")
    public Result<BlockView> mineOnce(@RequestParam String identityId) {
        return nodeService.mineOnce(identityId);
    }

    @PostMapping("/mine/stop")
    public Result<String> stopMining(@RequestParam String identityId) {
        return nodeService.stopMining(identityId);
    }

    @GetMapping("/status")
    public Result<NodeStatus> status() {
        return nodeService.status();
    }

    // 提交知识转移
    @PostMapping("/transfer")
    public Result<String> transfer(@RequestBody TransferRequest request) {
        return nodeService.transfer(request.getFromId(), request.getToId(), request.getTopic(), request.getPayload());
    }

    @GetMapping("/block/{index}")
    public Result<BlockView> block(@PathVariable long index) {
        return nodeService.block(index);
    }
}
