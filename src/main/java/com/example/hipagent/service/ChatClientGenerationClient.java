package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.exception.GenerationException;
import com.example.hipagent.model.Prompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link GenerationClient} backed by a Spring AI {@link ChatClient}.
 * The blocking call runs on boundedElastic and is cut off after the configured timeout.
 */
public class ChatClientGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationClient.class);

    private final ChatClient chatClient;
    private final ChatOptions options;
    private final HipAgentProperties.Generation settings;

    public ChatClientGenerationClient(Map<String, ChatClient> chatClients, HipAgentProperties.Generation settings) {
        this.settings = settings;
        this.chatClient = resolveClient(chatClients, settings.provider());
        this.options = ChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .build();
    }

    @Override
    public String generate(Prompt prompt) {
        String content;
        try {
            content = Mono.fromCallable(() -> call(prompt))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(settings.timeout())
                    .block();
        } catch (RuntimeException e) {
            log.warn("[GEN][CALL_FAIL] provider={} model={} err={}", settings.provider(), settings.model(), e.toString());
            throw new GenerationException("Generation call failed: " + rootMessage(e), e);
        }
        if (content == null || content.isBlank()) {
            throw new GenerationException("Generation service returned an empty response");
        }
        return content.strip();
    }

    private String call(Prompt prompt) {
        ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
        if (!prompt.system().isBlank()) {
            spec = spec.system(prompt.system());
        }
        return spec.user(prompt.user())
                .options(options)
                .call()
                .content();
    }

    /**
     * Resolve ChatClient bean based on the configured provider.
     * Supported lookup keys:
     *  - "&lt;provider&gt;ChatClient"
     *  - "&lt;provider&gt;"
     * Fallback:
     *  - the only ChatClient, if exactly one exists
     */
    static ChatClient resolveClient(Map<String, ChatClient> chatClients, String provider) {
        if (chatClients == null || chatClients.isEmpty()) {
            throw new AgentConfigurationException("No ChatClient beans are available");
        }
        String key = Optional.ofNullable(provider)
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .orElse("");
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        if (chatClients.size() == 1) {
            ChatClient only = chatClients.values().iterator().next();
            log.warn("No ChatClient for provider '{}', using the only one available: {}",
                    provider, chatClients.keySet().iterator().next());
            return only;
        }
        throw new AgentConfigurationException("No ChatClient for provider '" + provider
                + "', available: " + chatClients.keySet());
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.toString();
    }
}
