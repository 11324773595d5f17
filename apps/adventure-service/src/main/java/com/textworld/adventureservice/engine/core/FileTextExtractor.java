package com.textworld.adventureservice.engine.core;

/**
 * 上传文件解析抽象：下载并提取纯文本（用于世界观设定）。
 * 不支持的格式、下载失败、解析失败都作为 {@link ParseResult} 返回，不抛异常。
 */
public interface FileTextExtractor {

    ParseResult parse(String url, String filename);
}
