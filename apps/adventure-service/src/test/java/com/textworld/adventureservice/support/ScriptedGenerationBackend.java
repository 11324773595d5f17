package com.textworld.adventureservice.support;

import com.textworld.adventureservice.engine.core.GenerationBackend;
import com.textworld.adventureservice.engine.core.GenerationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 记录提示词、按脚本返回结果的生成后端
 */
public class ScriptedGenerationBackend implements GenerationBackend {

    private final List<String> prompts = new ArrayList<>();
    private volatile Function<String, GenerationResult> script;

    public ScriptedGenerationBackend(Function<String, GenerationResult> script) {
        this.script = script;
    }

    public static ScriptedGenerationBackend answering(String text) {
        return new ScriptedGenerationBackend(p -> GenerationResult.success(text));
    }

    public static ScriptedGenerationBackend failing(String error) {
        return new ScriptedGenerationBackend(p -> GenerationResult.failure(error));
    }

    public void answer(Function<String, GenerationResult> script) {
        this.script = script;
    }

    @Override
    public GenerationResult generate(String prompt) {
        synchronized (prompts) {
            prompts.add(prompt);
        }
        return script.apply(prompt);
    }

    public List<String> prompts() {
        synchronized (prompts) {
            return List.copyOf(prompts);
        }
    }

    public long promptsContaining(String fragment) {
        return prompts().stream().filter(p -> p.contains(fragment)).count();
    }
}
