package com.bit.vote.api;

import com.bit.vote.common.Address;
import com.bit.vote.support.MutableClock;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
public class VotingApiTest {

    private static final long NOW = 1_700_000_000L;

    private static final String ADMIN = Address.ofSeed("admin").toBase58();
    private static final String VAULT = Address.ofSeed("vault").toBase58();
    private static final String ALICE = Address.ofSeed("alice").toBase58();
    private static final String BOB = Address.ofSeed("bob").toBase58();

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        public MutableClock testClock() {
            return new MutableClock(NOW);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @Test
    void votingFlowOverHttp() throws Exception {
        String body = "{\"caller\":\"%s\",\"name\":\"community\",\"description\":\"d\",\"startTime\":%d,\"duration\":100}";

        // 非管理员被切面拦截
        ok(mockMvc.perform(post("/project/create").contentType(MediaType.APPLICATION_JSON)
                .content(String.format(body, ALICE, NOW + 10))))
                .andExpect(jsonPath("$.code").value(510));

        ok(mockMvc.perform(post("/project/create").contentType(MediaType.APPLICATION_JSON)
                .content(String.format(body, ADMIN, NOW + 10))))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data").value(0));
        ok(mockMvc.perform(get("/project/total"))).andExpect(jsonPath("$.data").value(1));

        ok(mockMvc.perform(post("/token/mint").param("caller", ADMIN).param("to", ALICE).param("amount", "1000")))
                .andExpect(jsonPath("$.data").value(1000));
        ok(mockMvc.perform(post("/token/mint").param("caller", ADMIN).param("to", VAULT).param("amount", "1000")))
                .andExpect(jsonPath("$.code").value(200));
        ok(mockMvc.perform(post("/token/approve").param("caller", ALICE).param("spender", VAULT).param("amount", "1000")))
                .andExpect(jsonPath("$.data").value(1000));

        // 未到开始时间
        ok(mockMvc.perform(post("/voting/vote").param("caller", ALICE).param("projectId", "0").param("amount", "400")))
                .andExpect(jsonPath("$.code").value(4004));

        clock.set(NOW + 10);
        ok(mockMvc.perform(post("/voting/vote").param("caller", ALICE).param("projectId", "0").param("amount", "400")))
                .andExpect(jsonPath("$.code").value(200));
        ok(mockMvc.perform(post("/voting/vote").param("caller", "0OIl").param("projectId", "0").param("amount", "1")))
                .andExpect(jsonPath("$.code").value(400));
        ok(mockMvc.perform(get("/project/voters").param("id", "0")))
                .andExpect(jsonPath("$.data[0]").value(ALICE));
        ok(mockMvc.perform(get("/project/get").param("id", "0")))
                .andExpect(jsonPath("$.data.totalVotes").value(400))
                .andExpect(jsonPath("$.data.status").value("VOTING"));

        clock.set(NOW + 111);
        ok(mockMvc.perform(post("/voting/finalize").param("caller", BOB).param("projectId", "0")))
                .andExpect(jsonPath("$.code").value(510));
        ok(mockMvc.perform(post("/voting/finalize").param("caller", ADMIN).param("projectId", "0")))
                .andExpect(jsonPath("$.data").value(ALICE));

        ok(mockMvc.perform(get("/voting/unstakeable").param("projectId", "0").param("participant", ALICE)))
                .andExpect(jsonPath("$.data").value(800));
        ok(mockMvc.perform(post("/voting/unstake").param("caller", ALICE).param("projectId", "0")))
                .andExpect(jsonPath("$.data").value(800));
        ok(mockMvc.perform(post("/voting/unstake").param("caller", ALICE).param("projectId", "0")))
                .andExpect(jsonPath("$.code").value(4008));
        ok(mockMvc.perform(get("/voting/stake").param("projectId", "0").param("participant", ALICE)))
                .andExpect(jsonPath("$.data.amount").value(400))
                .andExpect(jsonPath("$.data.hasUnstaked").value(true))
                .andExpect(jsonPath("$.data.unstakeable").value(0));
        ok(mockMvc.perform(get("/token/balance").param("owner", ALICE)))
                .andExpect(jsonPath("$.data").value(1400));

        ok(mockMvc.perform(get("/event/list").param("from", "1").param("limit", "10")))
                .andExpect(jsonPath("$.data.length()").value(4))
                .andExpect(jsonPath("$.data[0].type").value("ProjectCreated"))
                .andExpect(jsonPath("$.data[3].type").value("TokensUnstaked"))
                .andExpect(jsonPath("$.data[3].payout").value(800));

        ok(mockMvc.perform(get("/project/get").param("id", "9")))
                .andExpect(jsonPath("$.code").value(404));
    }

    private static ResultActions ok(ResultActions actions) throws Exception {
        return actions.andExpect(status().isOk());
    }
}
