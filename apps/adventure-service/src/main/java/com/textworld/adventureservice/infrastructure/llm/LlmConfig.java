package com.textworld.adventureservice.infrastructure.llm;

import com.textworld.adventureservice.config.TextworldProperties;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 叙事模型装配：仅在配置了 textworld.llm.api-key 时注册 ChatModel。
 * 未配置时没有模型 Bean，生成后端对所有调用返回失败，由上层走兜底文案。
 */
@Slf4j
@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnExpression("'${textworld.llm.api-key:}' != ''")
    public ChatModel narrationChatModel(TextworldProperties properties) {
        TextworldProperties.Llm llm = properties.getLlm();
        log.info("叙事模型已配置: baseUrl={}, model={}", llm.getBaseUrl(), llm.getModelName());
        return OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .baseUrl(llm.getBaseUrl())
                .modelName(llm.getModelName())
                .timeout(Duration.ofSeconds(Math.max(1, llm.getTimeoutSeconds())))
                .build();
    }
}
