package com.example.hipagent.config;

import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.model.FewShotExample;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentConfigTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void loadsBundledExemplars() {
        List<FewShotExample> exemplars =
                AgentConfig.loadExemplars(objectMapper, new ClassPathResource("prompts/few-shot-examples.json"));

        assertThat(exemplars).hasSize(3);
        assertThat(exemplars).extracting(FewShotExample::answerIndex).containsExactly(1, 1, 0);
        assertThat(exemplars.get(1).choices()).contains("natural selection");
    }

    @Test
    void exemplarWithAnswerOutsideItsChoicesIsAConfigurationError() {
        ByteArrayResource broken = new ByteArrayResource(
                "[{\"question\": \"Q?\", \"choices\": [\"x\", \"y\"], \"answerIndex\": 5}]".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> AgentConfig.loadExemplars(objectMapper, broken))
                .isInstanceOf(AgentConfigurationException.class);
    }

    @Test
    void missingExemplarsAreAConfigurationError() {
        assertThatThrownBy(() -> AgentConfig.loadExemplars(objectMapper, new ClassPathResource("prompts/none.json")))
                .isInstanceOf(AgentConfigurationException.class);
    }
}
