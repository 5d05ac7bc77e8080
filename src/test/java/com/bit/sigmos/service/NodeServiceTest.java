package com.bit.sigmos.service;

import com.bit.sigmos.result.Result;
import com.bit.sigmos.structure.dto.BlockView;
import com.bit.sigmos.structure.dto.IdentityView;
import com.bit.sigmos.structure.dto.NodeStatus;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
public class NodeServiceTest {

    @Autowired
    private NodeService nodeService;

    @Test
    void testIdentityLifecycle() {
        Result<IdentityView> created = nodeService.createIdentity("Ada");
        assertTrue(created.isSuccess());
        IdentityView view = created.getData();
        assertEquals("Ada", view.getName());
        assertEquals(0, view.getTrainingIterations());

        Result<IdentityView> evolved = nodeService.evolve(view.getId());
        assertEquals(1, evolved.getData().getTrainingIterations());
        assertTrue(evolved.getData().getConsciousnessScore() > view.getConsciousnessScore());
        assertTrue(nodeService.identities().getData().stream().anyMatch(i -> i.getId().equals(view.getId())));
    }

    @Test
    void testRejectsBadInput() {
        assertEquals(Result.SC_REJECTED_400, nodeService.createIdentity(" ").getCode());
        assertEquals(Result.SC_NOT_FOUND_404, nodeService.evolve("missing").getCode());
        assertEquals(Result.SC_NOT_FOUND_404, nodeService.mineOnce("missing").getCode());
        assertEquals(Result.SC_NOT_FOUND_404, nodeService.block(10_000).getCode());

        String x = nodeService.createIdentity("X").getData().getId();
        Result<String> unknownTarget = nodeService.transfer(x, "missing", "Mathematics", "p");
        assertFalse(unknownTarget.isSuccess());
        log.info("非法转移: {}", unknownTarget.getMessage());
    }

    @Test
    void testMineAndTransfer() {
        String x = nodeService.createIdentity("X").getData().getId();
        String y = nodeService.createIdentity("Y").getData().getId();
        long before = nodeService.status().getData().getHeight();

        Result<String> submitted = nodeService.transfer(x, y, "Mathematics", "Pythagoras");
        assertTrue(submitted.isSuccess(), submitted.getMessage());
        assertEquals(1, nodeService.status().getData().getPendingTransfers());

        BlockView mined = null;
        for (int i = 0; i < 50 && mined == null; i++) {
            mined = nodeService.mineOnce(x).getData();
        }
        assertNotNull(mined);
        assertEquals(before + 1, mined.getIndex());
        assertEquals(submitted.getData(), mined.getTransactions().get(0).getContentId());

        NodeStatus status = nodeService.status().getData();
        assertEquals(before + 1, status.getHeight());
        assertEquals(mined.getHash(), status.getTipHash());
        assertEquals(0, status.getPendingTransfers());
        assertEquals("Mathematics", nodeService.knowledge(y).getData().get(0).getTopic());
        assertEquals(mined.getHash(), nodeService.block(mined.getIndex()).getData().getHash());
    }

    @Test
    void testStopWithoutMining() {
        String x = nodeService.createIdentity("idle").getData().getId();
        assertEquals(Result.SC_NOT_FOUND_404, nodeService.stopMining(x).getCode());
    }
}
