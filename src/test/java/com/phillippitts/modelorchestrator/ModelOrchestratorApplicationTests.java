package com.phillippitts.modelorchestrator;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ModelOrchestratorApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
    }

    @Test
    void runsSubmittedTaskThroughPipeline() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"it-1\",\"type\":\"transcribe_and_analyze\",\"input\":\"meeting.wav\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("it-1"))
                .andExpect(jsonPath("$.steps[0]").value("plan@test-reasoner"))
                .andExpect(jsonPath("$.steps[1]").value("transcribe@test-transcriber"))
                .andExpect(jsonPath("$.steps[2]").value("analyze@test-reasoner"))
                .andExpect(jsonPath("$.outputs[1].input").value("meeting.wav"))
                .andExpect(jsonPath("$.outputs[1].plan").exists())
                .andExpect(jsonPath("$.outputs[2].model").value("test-reasoner"))
                .andExpect(jsonPath("$.phases[1].operation").value("transcribe"))
                .andExpect(jsonPath("$.metrics.phaseCount").value(3));

        mockMvc.perform(get("/api/orchestration/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loadedModel").value("test-reasoner"))
                .andExpect(jsonPath("$.pool.activeReservations").value(0));
    }

    @Test
    void rejectsTaskWithoutType() throws Exception {
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BadRequest"));
    }

    @Test
    void exposesModelScores() throws Exception {
        mockMvc.perform(get("/api/models/test-transcriber/scores"))
                .andExpect(status().isOk());
    }
}
