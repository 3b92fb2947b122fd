package com.example.hipagent.config;

import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.model.FewShotExample;
import com.example.hipagent.repository.CorpusIndex;
import com.example.hipagent.service.AnswerExtractor;
import com.example.hipagent.service.ChatClientGenerationClient;
import com.example.hipagent.service.CorpusIndexer;
import com.example.hipagent.service.EvaluationService;
import com.example.hipagent.service.GenerationClient;
import com.example.hipagent.service.PromptComposer;
import com.example.hipagent.service.QuestionSetLoader;
import com.example.hipagent.service.RagAnswerService;
import com.example.hipagent.service.RagRetrievalService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Wires the answering pipeline. Each component receives its slice of
 * {@link HipAgentProperties} through its constructor.
 *
 * The corpus index is built, and its embedding dimension verified, while the context starts;
 * any setup problem fails startup.
 */
@Configuration
@EnableConfigurationProperties(HipAgentProperties.class)
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    @Bean
    public CorpusIndex corpusIndex(HipAgentProperties props,
                                   ObjectProvider<EmbeddingModel> embeddingModel,
                                   ResourceLoader resourceLoader) {
        HipAgentProperties.Corpus corpus = props.corpus();
        if (!props.rag().enabled()) {
            log.info("RAG disabled, skipping corpus indexing");
            return CorpusIndex.empty();
        }
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            throw new AgentConfigurationException("RAG is enabled but no EmbeddingModel is configured");
        }
        String text = CorpusIndexer.readCorpus(resourceLoader.getResource(corpus.location()));
        if (text.isBlank()) {
            throw new AgentConfigurationException("RAG is enabled but corpus " + corpus.location() + " is empty");
        }
        return new CorpusIndexer(model).build(text, corpus.chunkSize(), corpus.chunkOverlap());
    }

    @Bean
    public RagRetrievalService ragRetrievalService(ObjectProvider<EmbeddingModel> embeddingModel,
                                                   CorpusIndex corpusIndex,
                                                   HipAgentProperties props) {
        RagRetrievalService service = new RagRetrievalService(
                embeddingModel.getIfAvailable(), corpusIndex, props.rag());
        service.verifyDimensions();
        return service;
    }

    @Bean
    public PromptComposer promptComposer(HipAgentProperties props,
                                         ObjectMapper objectMapper,
                                         ResourceLoader resourceLoader) {
        HipAgentProperties.PromptSettings settings = props.prompt();
        List<FewShotExample> exemplars = settings.fewShotEnabled()
                ? loadExemplars(objectMapper, resourceLoader.getResource(settings.exemplarsLocation()))
                : List.of();
        return new PromptComposer(settings, exemplars);
    }

    @Bean
    public AnswerExtractor answerExtractor(HipAgentProperties props) {
        return new AnswerExtractor(props.extraction());
    }

    @Bean
    public GenerationClient generationClient(Map<String, ChatClient> chatClients, HipAgentProperties props) {
        return new ChatClientGenerationClient(chatClients, props.generation());
    }

    @Bean
    public RagAnswerService ragAnswerService(RagRetrievalService ragRetrievalService,
                                             PromptComposer promptComposer,
                                             GenerationClient generationClient,
                                             AnswerExtractor answerExtractor,
                                             HipAgentProperties props) {
        return new RagAnswerService(ragRetrievalService, promptComposer, generationClient, answerExtractor, props.rag());
    }

    @Bean
    public QuestionSetLoader questionSetLoader(ObjectMapper objectMapper) {
        return new QuestionSetLoader(objectMapper);
    }

    @Bean
    public EvaluationService evaluationService(HipAgentProperties props) {
        return new EvaluationService(props.evaluation());
    }

    static List<FewShotExample> loadExemplars(ObjectMapper objectMapper, Resource resource) {
        if (!resource.exists()) {
            throw new AgentConfigurationException("Few-shot exemplars not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            List<FewShotExample> exemplars = objectMapper.readValue(in, new TypeReference<List<FewShotExample>>() {
            });
            log.info("Loaded {} few-shot exemplars from {}", exemplars.size(), resource.getDescription());
            return exemplars;
        } catch (IOException | IllegalArgumentException e) {
            throw new AgentConfigurationException("Could not read few-shot exemplars " + resource.getDescription(), e);
        }
    }
}
