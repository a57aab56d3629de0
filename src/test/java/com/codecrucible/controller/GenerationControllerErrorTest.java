package com.codecrucible.controller;

import com.codecrucible.orchestrator.WorkflowException;
import com.codecrucible.orchestrator.WorkflowOrchestrator;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "mock"})
class GenerationControllerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WorkflowOrchestrator orchestrator;

    @Test
    void testWorkflowFailureIsServerErrorWithMessage() throws Exception {
        when(orchestrator.runWorkflow(any(), any()))
                .thenThrow(new WorkflowException("Code generation failed: API error: overloaded", "e-1", null));

        mockMvc.perform(post("/api/v1/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"add two numbers\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Code generation failed: API error: overloaded"));
    }
}
