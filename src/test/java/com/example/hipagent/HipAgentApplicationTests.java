package com.example.hipagent;

import com.example.hipagent.model.AgentAnswer;
import com.example.hipagent.model.Prompt;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.repository.CorpusIndex;
import com.example.hipagent.service.AnswerExtractor;
import com.example.hipagent.service.ChatClientGenerationClient;
import com.example.hipagent.service.GenerationClient;
import com.example.hipagent.service.PromptComposer;
import com.example.hipagent.service.RagAnswerService;
import com.example.hipagent.service.RagRetrievalService;
import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.support.HashingEmbeddingModel;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.model.embedding=none",
                "spring.ai.openai.api-key=test",
                "hip-agent.corpus.location=classpath:corpus/test-corpus.txt",
                "hip-agent.corpus.chunk-size=400",
                "hip-agent.corpus.chunk-overlap=40",
                "hip-agent.rag.min-similarity=0.0",
                "hip-agent.evaluation.enabled=false"
        }
)
@Import(HipAgentApplicationTests.TestAiConfiguration.class)
class HipAgentApplicationTests {

    @Autowired
    private CorpusIndex corpusIndex;

    @Autowired
    private RagRetrievalService ragRetrievalService;

    @Autowired
    private PromptComposer promptComposer;

    @Autowired
    private AnswerExtractor answerExtractor;

    @Autowired
    private GenerationClient generationClient;

    @Autowired
    private RagAnswerService ragAnswerService;

    @Autowired
    private HipAgentProperties properties;

    @Test
    void contextLoads() {
        assertThat(ragAnswerService).isNotNull();
        assertThat(generationClient).isInstanceOf(ChatClientGenerationClient.class);
    }

    @Test
    void corpusIsIndexedAtStartup() {
        assertThat(corpusIndex.size()).isGreaterThan(1);
        assertThat(corpusIndex.dimension()).isEqualTo(256);
        assertThat(corpusIndex.skipped()).isEmpty();
    }

    @Test
    void retrievalRanksIndexedChunks() {
        RetrievalResult result = ragRetrievalService.retrieve("mitochondria ATP cellular respiration", 3, 0);

        assertThat(result.chunks()).hasSize(3);
        assertThat(result.chunks().get(0).score()).isGreaterThanOrEqualTo(result.chunks().get(2).score());
        assertThat(result.context()).startsWith("[Context 1]");
    }

    @Test
    void wiredPipelineAnswersWithOneGenerationCall() {
        List<Prompt> prompts = new ArrayList<>();
        GenerationClient stub = prompt -> {
            prompts.add(prompt);
            return "Reasoning: respiration happens in the mitochondria.\nFinal answer: B";
        };
        RagAnswerService agent = new RagAnswerService(
                ragRetrievalService, promptComposer, stub, answerExtractor, properties.rag());

        AgentAnswer answer = agent.answer("Where does cellular respiration produce ATP?",
                List.of("Nucleus", "Mitochondria", "Ribosome", "Chloroplast"));

        assertThat(answer.index()).isEqualTo(1);
        assertThat(answer.retrieval().isEmpty()).isFalse();
        assertThat(prompts).hasSize(1);
        assertThat(prompts.get(0).user())
                .contains(PromptComposer.CONTEXT_HEADER)
                .contains("Example 1:")
                .endsWith(PromptComposer.finalAnswerInstruction(4));
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        EmbeddingModel embeddingModel() {
            return new HashingEmbeddingModel(256);
        }

        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
