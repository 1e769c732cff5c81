package com.herzen.gradepipe;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PipelineControllerTest {
    @Autowired
    private MockMvc mvc;

    @Test
    void malformedFilterIsBadRequest() throws Exception {
        mvc.perform(post("/api/pipeline/splits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filters\":\"0-4-7\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("0-4-7")));
    }

    @Test
    void unknownVariantIsBadRequest() throws Exception {
        mvc.perform(post("/api/pipeline/variants/PMF/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void leaderboardForUnknownSplitIsEmpty() throws Exception {
        mvc.perform(get("/api/pipeline/leaderboard").param("split", "9-9").param("topN", "3"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    void emptyTableStillHasHeader() throws Exception {
        mvc.perform(get("/api/pipeline/leaderboard/table").param("split", "9-9"))
                .andExpect(status().isOk())
                .andExpect(content().string(org.hamcrest.Matchers.startsWith("method")));
    }
}
