package com.example.MedifBot.controller;

import com.example.MedifBot.exception.GlobalExceptionHandler;
import com.example.MedifBot.exception.InvalidMessageException;
import com.example.MedifBot.exception.RetrievalException;
import com.example.MedifBot.model.ChatMessage;
import com.example.MedifBot.model.ChatRequest;
import com.example.MedifBot.model.ChatResponse;
import com.example.MedifBot.service.ChatService;
import com.example.MedifBot.service.ConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock private ChatService chatService;
    @Mock private ConversationStore conversationStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatService, conversationStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void chatReturnsAnswerWithConversationId() throws Exception {
        when(chatService.chat(any(ChatRequest.class)))
                .thenReturn(Mono.just(new ChatResponse("Hola, ¿cómo estás?", "c1")));

        MvcResult pending = mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hola\",\"conversation_id\":\"c1\",\"ip\":\"10.0.0.1\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Hola, ¿cómo estás?"))
                .andExpect(jsonPath("$.conversation_id").value("c1"));

        ArgumentCaptor<ChatRequest> captured = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatService).chat(captured.capture());
        assertThat(captured.getValue().conversationId()).isEqualTo("c1");
        assertThat(captured.getValue().ip()).isEqualTo("10.0.0.1");
    }

    @Test
    void blankMessageIsBadRequest() throws Exception {
        when(chatService.chat(any(ChatRequest.class)))
                .thenThrow(new InvalidMessageException("El mensaje no puede estar vacio."));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_MESSAGE"))
                .andExpect(jsonPath("$.message").value("El mensaje no puede estar vacio."));
    }

    @Test
    void retrievalFailureIsServerErrorWithFriendlyMessage() throws Exception {
        when(chatService.chat(any(ChatRequest.class)))
                .thenReturn(Mono.error(new RetrievalException("pgvector down", new IllegalStateException())));

        MvcResult pending = mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"¿Que cursos ofrecen?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("RETRIEVAL_ERROR"))
                .andExpect(jsonPath("$.message").value(RetrievalException.USER_MESSAGE));
    }

    @Test
    void listsTranscript() throws Exception {
        ChatMessage message = new ChatMessage();
        message.setConversationId("c1");
        message.setRole("user");
        message.setContent("hola");
        when(conversationStore.listMessages("c1")).thenReturn(List.of(message));

        mockMvc.perform(get("/api/chat/messages").param("conversation_id", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("hola"))
                .andExpect(jsonPath("$[0].role").value("user"));
    }
}
