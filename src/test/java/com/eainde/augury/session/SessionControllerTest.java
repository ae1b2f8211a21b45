package com.eainde.augury.session;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.conversation.ModificationResult;
import com.eainde.augury.conversation.TurnReply;
import com.eainde.augury.error.InputValidationException;
import com.eainde.augury.error.SessionNotFoundException;
import com.eainde.augury.theory.FieldNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionService sessionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(sessionService)).build();
    }

    @Test
    void startReturnsCreatedWithSessionId() throws Exception {
        when(sessionService.startSession("Should I move abroad?")).thenReturn(
                new SessionStarted("s-1", TurnReply.prompt(ConversationStage.ICEBREAK, "Welcome.")));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Should I move abroad?\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session_id").value("s-1"))
                .andExpect(jsonPath("$.reply.type").value("PROMPT"))
                .andExpect(jsonPath("$.reply.message").value("Welcome."));
    }

    @Test
    void turnIsForwardedToTheSession() throws Exception {
        when(sessionService.submitTurn("s-1", "3 5 8"))
                .thenReturn(TurnReply.prompt(ConversationStage.DEEPEN, "Tell me more."));

        mockMvc.perform(post("/sessions/s-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"3 5 8\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("DEEPEN"));
    }

    @Test
    void invalidFieldValueIsUnprocessable() throws Exception {
        when(sessionService.modifyField(eq("s-1"), eq(FieldNames.BIRTH_MONTH), any()))
                .thenThrow(new InputValidationException(FieldNames.BIRTH_MONTH, "must be between 1 and 12"));

        mockMvc.perform(put("/sessions/s-1/fields/birth_month")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":13}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.field").value(FieldNames.BIRTH_MONTH))
                .andExpect(jsonPath("$.message").value("Please provide a different value: must be between 1 and 12"));
    }

    @Test
    void validFieldValueReturnsInvalidatedTheories() throws Exception {
        when(sessionService.modifyField("s-1", FieldNames.BIRTH_YEAR, 1991)).thenReturn(
                new ModificationResult(FieldNames.BIRTH_YEAR, 1990, 1991, List.of("bazi"), ConversationStage.VERIFY));

        mockMvc.perform(put("/sessions/s-1/fields/birth_year")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":1991}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated[0]").value("bazi"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(sessionService.submitTurn(eq("missing"), any())).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(post("/sessions/missing/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void abandonReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/sessions/s-1"))
                .andExpect(status().isNoContent());

        verify(sessionService).abandonSession("s-1");
    }
}
