package com.textworld.adventureservice.infrastructure.llm;

import com.textworld.adventureservice.engine.core.GenerationBackend;
import com.textworld.adventureservice.engine.core.GenerationResult;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 基于 LangChain4j ChatModel 的生成后端，在此处统一做熔断/兜底。
 */
@Slf4j
@Service
public class LangChainGenerationBackend implements GenerationBackend {

    private final Optional<ChatModel> chatModel;

    public LangChainGenerationBackend(Optional<ChatModel> chatModel) {
        this.chatModel = chatModel;
        if (chatModel.isEmpty()) {
            log.warn("未配置叙事模型（textworld.llm.api-key），所有生成将使用兜底文案");
        }
    }

    /**
     * @param prompt 提示词
     * @return 生成结果（失败时 ok=false，不抛异常）
     */
    @Override
    @CircuitBreaker(name = "generation", fallbackMethod = "fallbackGenerate")
    public GenerationResult generate(String prompt) {
        if (chatModel.isEmpty()) {
            return GenerationResult.failure("无可用的AI服务");
        }
        String text = chatModel.get().chat(prompt);
        if (StringUtils.isBlank(text)) {
            log.warn("生成结果为空: promptLength={}", prompt.length());
            return GenerationResult.failure("AI返回为空");
        }
        return GenerationResult.success(text.strip());
    }

    /**
     * 熔断 / 超时 / 远程异常时的兜底逻辑。
     */
    @SuppressWarnings("unused")
    private GenerationResult fallbackGenerate(String prompt, Throwable ex) {
        log.warn("调用叙事模型失败，走兜底: promptLength={}, ex={}", prompt.length(), ex.toString());
        return GenerationResult.failure(StringUtils.abbreviate(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), 40));
    }
}
