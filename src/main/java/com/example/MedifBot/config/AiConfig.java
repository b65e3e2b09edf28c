package com.example.MedifBot.config;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Chat clients keyed by bean name, resolved per request by GenerationService
 * ("deepseekChatClient", "openaiChatClient"). The system instructions travel inside
 * the assembled prompt, so no default system message is set here. Every client carries the
 * {@code medif.generation} sampling settings as its default options.
 */
@Configuration
@RequiredArgsConstructor
public class AiConfig {

    private final ChatbotProperties properties;

    /**
     * DeepSeek is the default ChatClient.
     * Only created when a DeepSeekChatModel bean exists, so a missing DeepSeek key does not break startup.
     */
    @Bean
    @Primary
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return buildClient(model);
    }

    @Bean
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return buildClient(model);
    }

    /**
     * Used when neither conditional bean above matched: DeepSeek when available, otherwise OpenAI.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return buildClient(deepseekModel);
        }
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return buildClient(openAiModel);
        }
        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    private ChatClient buildClient(ChatModel model) {
        return ChatClient.builder(model)
                .defaultOptions(defaultOptions(properties.getGeneration()))
                .build();
    }

    static ChatOptions defaultOptions(ChatbotProperties.Generation generation) {
        return ChatOptions.builder()
                .temperature(generation.getTemperature())
                .topP(generation.getTopP())
                .build();
    }
}
