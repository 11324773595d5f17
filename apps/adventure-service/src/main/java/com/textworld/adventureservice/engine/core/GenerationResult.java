package com.textworld.adventureservice.engine.core;

/**
 * 生成结果
 *
 * @param ok    是否成功拿到非空文本
 * @param text  生成的文本（失败时为空）
 * @param error 失败原因（成功时为空）
 */
public record GenerationResult(boolean ok, String text, String error) {

    public static GenerationResult success(String text) {
        return new GenerationResult(true, text, null);
    }

    public static GenerationResult failure(String error) {
        return new GenerationResult(false, null, error);
    }

    /** 成功时返回文本，否则返回兜底 */
    public String textOr(String fallback) {
        return ok && text != null && !text.isBlank() ? text : fallback;
    }
}
