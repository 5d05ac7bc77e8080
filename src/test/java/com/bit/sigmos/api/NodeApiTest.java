package com.bit.sigmos.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class NodeApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testStatusShowsGenesisOrLater() throws Exception {
        mockMvc.perform(get("/node/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.nodeId").isNotEmpty())
                .andExpect(jsonPath("$.data.height").isNumber());
    }

    @Test
    void testCreateIdentity() throws Exception {
        mockMvc.perform(post("/node/identity").param("name", "Ada"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Ada"))
                .andExpect(jsonPath("$.data.traits.logic").value(0.9));
    }

    @Test
    void testGenesisBlock() throws Exception {
        mockMvc.perform(get("/node/block/0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.index").value(0))
                .andExpect(jsonPath("$.data.minerId").value("genesis"));
    }

    @Test
    void testTransferBetweenUnknownIdentitiesRejected() throws Exception {
        mockMvc.perform(post("/node/transfer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fromId\":\"a\",\"toId\":\"b\",\"topic\":\"Mathematics\",\"payload\":\"p\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(400));
    }
}
