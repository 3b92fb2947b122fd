package com.example.hipagent.config;

import com.example.hipagent.exception.AgentConfigurationException;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * ChatClients for the generation service. The agent picks one by
 * {@code hip-agent.generation.provider}; see ChatClientGenerationClient.
 */
@Configuration
public class AiConfig {

    /**
     * OpenAI ChatClient, the default provider.
     * Only created when an OpenAiChatModel bean exists
     * (so a missing OpenAI API key does not break environments that use DeepSeek).
     */
    @Bean
    @Primary
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model).build();
    }

    /**
     * DeepSeek ChatClient as an alternative.
     */
    @Bean
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model).build();
    }

    /**
     * If no ChatClient beans are registered (e.g. the conditions above were evaluated before
     * the models existed), build one from OpenAI when available, otherwise from DeepSeek.
     */
    @Bean
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).build();
        }

        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).build();
        }

        throw new AgentConfigurationException(
                "No ChatModel beans are available; configure spring.ai.openai.api-key or spring.ai.deepseek.api-key");
    }
}
