package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.exception.GenerationException;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GenerationServiceTest {

    private final ChatbotProperties properties = new ChatbotProperties();

    private static ChatClient replying(String content) {
        ChatClient client = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(client.prompt().user(anyString()).options(any()).call().content()).thenReturn(content);
        return client;
    }

    @Test
    void returnsStrippedContent() {
        GenerationService service = new GenerationService(
                Map.of("deepseekChatClient", replying("  Ofrecemos 9 cursos.\n")), properties);

        assertThat(service.generate("prompt", 0.0, 1.0)).isEqualTo("Ofrecemos 9 cursos.");
    }

    @Test
    void blankReplyIsAnError() {
        GenerationService service = new GenerationService(
                Map.of("deepseekChatClient", replying("   ")), properties);

        assertThatThrownBy(() -> service.generate("prompt", 0.0, 1.0))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("replied without text");
    }

    @Test
    void modelFailureIsWrapped() {
        ChatClient client = mock(ChatClient.class);
        when(client.prompt()).thenThrow(new IllegalStateException("read timed out"));
        GenerationService service = new GenerationService(Map.of("deepseekChatClient", client), properties);

        assertThatThrownBy(() -> service.generate("prompt", 0.0, 1.0))
                .isInstanceOf(GenerationException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("read timed out");
    }

    @Test
    void resolvesClientByModelName() {
        ChatClient deepseek = mock(ChatClient.class);
        ChatClient openai = mock(ChatClient.class);
        GenerationService service = new GenerationService(
                Map.of("deepseekChatClient", deepseek, "openaiChatClient", openai), properties);

        assertThat(service.resolveClient("OpenAI")).isSameAs(openai);
        assertThat(service.resolveClient("mistral")).isSameAs(deepseek);
        assertThat(service.resolveClient(null)).isSameAs(deepseek);
    }

    @Test
    void noClientsAvailable() {
        GenerationService service = new GenerationService(Map.of(), properties);

        assertThatThrownBy(() -> service.resolveClient("deepseek"))
                .isInstanceOf(GenerationException.class);
    }
}
