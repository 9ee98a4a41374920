package com.prepcoach.interviewer.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepcoach.interviewer.engine.AnswerScorer;
import com.prepcoach.interviewer.engine.QuestionGenerator;
import com.prepcoach.interviewer.engine.ScoreJudgment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class InterviewControllerTest {

    private static final String SETUP = """
            {
                "candidate_name": "Ada Lovelace",
                "resume_text": "Java developer with 5 years of Spring experience",
                "job_description": "Backend engineer: Java, Spring, Kubernetes",
                "company_name": "Acme"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private QuestionGenerator questionGenerator;

    @MockBean
    private AnswerScorer answerScorer;

    @BeforeEach
    void scriptCollaborators() {
        when(questionGenerator.generate(any())).thenReturn("Tell me about a system you scaled.");
    }

    private long createSession() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SETUP))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("session_id").asLong();
    }

    private void answer(long sessionId, String text) throws Exception {
        mockMvc.perform(post("/api/interview/sessions/" + sessionId + "/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("answer_text", text))))
                .andExpect(status().isOk());
    }

    @Test
    void testHealthCheck() throws Exception {
        mockMvc.perform(get("/health/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
        mockMvc.perform(get("/health/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void testRootEndpoint() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists())
                .andExpect(jsonPath("$.active_sessions").isNumber())
                .andExpect(jsonPath("$.endpoints.resume_review").value("POST /api/resume/review"));
    }

    @Test
    void testCreateSession() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SETUP))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").isNumber())
                .andExpect(jsonPath("$.question").value("Tell me about a system you scaled."))
                .andExpect(jsonPath("$.question_number").value(1))
                .andExpect(jsonPath("$.stage").value("intro"))
                .andExpect(jsonPath("$.persona").value("neutral"));
    }

    @Test
    void testCreateSessionRejectsMissingInputs() throws Exception {
        mockMvc.perform(post("/api/interview/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidate_name\": \"Ada\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSubmitAnswerReturnsFeedbackAndNextQuestion() throws Exception {
        when(answerScorer.score(anyString(), anyString(), any()))
                .thenReturn(ScoreJudgment.builder().score(7).strengths("concrete").tip("add metrics").build());
        long sessionId = createSession();

        mockMvc.perform(post("/api/interview/sessions/" + sessionId + "/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer_text\": \"I built a payments API on Spring Boot.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision_state").value("continuing"))
                .andExpect(jsonPath("$.question_number").value(2))
                .andExpect(jsonPath("$.stage").value("technical"))
                .andExpect(jsonPath("$.feedback.score").value(7.0))
                .andExpect(jsonPath("$.feedback.degraded").value(false))
                .andExpect(jsonPath("$.next_question").exists());
    }

    @Test
    void testEarlyTerminationProducesReport() throws Exception {
        when(answerScorer.score(anyString(), anyString(), any()))
                .thenReturn(ScoreJudgment.builder().score(6).build())
                .thenReturn(ScoreJudgment.builder().score(2).build())
                .thenReturn(ScoreJudgment.builder().score(1).build());
        long sessionId = createSession();

        mockMvc.perform(get("/api/interview/sessions/" + sessionId + "/report"))
                .andExpect(status().isConflict());

        answer(sessionId, "first");
        answer(sessionId, "second");
        mockMvc.perform(post("/api/interview/sessions/" + sessionId + "/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer_text\": \"third\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision_state").value("terminated"))
                .andExpect(jsonPath("$.termination_reason").value("Performance below bar (avg 3.0/10)"));

        mockMvc.perform(get("/api/interview/sessions/" + sessionId + "/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall_score").value(3.0))
                .andExpect(jsonPath("$.total_questions").value(3))
                .andExpect(jsonPath("$.verdict").isNotEmpty())
                .andExpect(jsonPath("$.answers.length()").value(3));

        mockMvc.perform(post("/api/interview/sessions/" + sessionId + "/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer_text\": \"too late\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/history/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session.overall_score").value(3.0))
                .andExpect(jsonPath("$.session.early_termination").value("Performance below bar (avg 3.0/10)"))
                .andExpect(jsonPath("$.questions.length()").value(3))
                .andExpect(jsonPath("$.profile.experience_level").value("unknown"));

        mockMvc.perform(get("/api/history/sessions").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void testUnknownSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/api/interview/sessions/987654/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer_text\": \"hello\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/history/sessions/987654"))
                .andExpect(status().isNotFound());
    }
}
