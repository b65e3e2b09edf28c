package com.example.MedifBot.config;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AiConfigTest {

    @Test
    void defaultOptionsFollowGenerationSettings() {
        ChatbotProperties.Generation generation = new ChatbotProperties.Generation();
        generation.setTemperature(0.3);
        generation.setTopP(0.9);

        ChatOptions options = AiConfig.defaultOptions(generation);

        assertThat(options.getTemperature()).isEqualTo(0.3);
        assertThat(options.getTopP()).isEqualTo(0.9);
    }

    @Test
    void productionDefaultsAreDeterministic() {
        ChatOptions options = AiConfig.defaultOptions(new ChatbotProperties().getGeneration());

        assertThat(options.getTemperature()).isZero();
        assertThat(options.getTopP()).isEqualTo(1.0);
    }

    @Test
    void buildsClientWithoutCallingTheModel() {
        AiConfig config = new AiConfig(new ChatbotProperties());

        assertThat(config.openaiChatClient(mock(OpenAiChatModel.class))).isNotNull();
    }
}
