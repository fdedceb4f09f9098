package com.programmersdiary.marketdaemon;

import com.programmersdiary.marketdaemon.scheduling.RefreshScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "marketdaemon.cache.rest-url=",
        "marketdaemon.cache.rest-token="
})
@AutoConfigureMockMvc
class MarketDaemonApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RefreshScheduler refreshScheduler;

    @AfterEach
    void tearDown() {
        refreshScheduler.stop();
    }

    @Test
    void schedulerLifecycleOverHttp() throws Exception {
        mockMvc.perform(get("/scheduler"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalJobs").value(0));

        mockMvc.perform(post("/scheduler").contentType(MediaType.APPLICATION_JSON).content("{\"action\":\"start\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timezone").value("Asia/Seoul"));
        mockMvc.perform(post("/scheduler").contentType(MediaType.APPLICATION_JSON).content("{\"action\":\"start\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/scheduler"))
                .andExpect(jsonPath("$.totalJobs").value(2))
                .andExpect(jsonPath("$.jobs[0].id").value(0))
                .andExpect(jsonPath("$.jobs[0].running").value(true))
                .andExpect(jsonPath("$.jobs[0].destroyed").value(false))
                .andExpect(jsonPath("$.jobs[1].id").value(1));

        mockMvc.perform(post("/scheduler").contentType(MediaType.APPLICATION_JSON).content("{\"action\":\"bogus\"}"))
                .andExpect(status().isBadRequest());
        assertThat(refreshScheduler.status().totalJobs()).isEqualTo(2);

        mockMvc.perform(delete("/scheduler"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/scheduler"))
                .andExpect(jsonPath("$.totalJobs").value(0));
    }

    @Test
    void cacheClearWithoutCredentialsIsServiceUnavailable() throws Exception {
        mockMvc.perform(post("/cache/clear"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("configuration_missing"));
    }

    @Test
    void exactKeyInvalidationWithoutCredentialsIsServiceUnavailable() throws Exception {
        mockMvc.perform(post("/cache/invalidate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"market_indicators\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("configuration_missing"));
    }
}
