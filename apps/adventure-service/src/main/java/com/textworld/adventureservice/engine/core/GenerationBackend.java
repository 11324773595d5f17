package com.textworld.adventureservice.engine.core;

/**
 * 文本生成后端抽象：给定提示词，返回一段生成文本（开场、回合叙事、世界观总结）。
 * <p>
 * 实现不得抛出异常：没有可用后端、超时、远程错误都以 {@link GenerationResult#failure(String)} 返回。
 * 调用方不得在持有房间锁时调用。
 */
public interface GenerationBackend {

    GenerationResult generate(String prompt);
}
