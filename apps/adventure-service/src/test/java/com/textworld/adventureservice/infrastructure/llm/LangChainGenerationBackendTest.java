package com.textworld.adventureservice.infrastructure.llm;

import com.textworld.adventureservice.engine.core.GenerationResult;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LangChainGenerationBackendTest {

    @Test
    void withoutModelReturnsFailure() {
        GenerationResult r = new LangChainGenerationBackend(Optional.empty()).generate("开场");

        assertThat(r.ok()).isFalse();
        assertThat(r.textOr("兜底")).isEqualTo("兜底");
    }

    @Test
    void returnsStrippedText() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat("开场")).thenReturn("  火光摇曳。 \n");

        GenerationResult r = new LangChainGenerationBackend(Optional.of(model)).generate("开场");

        assertThat(r.ok()).isTrue();
        assertThat(r.text()).isEqualTo("火光摇曳。");
    }

    @Test
    void blankAnswerIsFailure() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat("开场")).thenReturn("   ");

        assertThat(new LangChainGenerationBackend(Optional.of(model)).generate("开场").ok()).isFalse();
    }
}
