package com.textworld.adventureservice.engine.core;

/**
 * 文件解析结果
 *
 * @param ok    是否成功
 * @param text  提取出的文本
 * @param error 失败原因
 */
public record ParseResult(boolean ok, String text, String error) {

    public static ParseResult success(String text) {
        return new ParseResult(true, text, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(false, null, error);
    }
}
