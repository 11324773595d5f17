package com.textworld.adventureservice.platform.transport;

/**
 * 入站消息携带的文件
 *
 * @param url      下载地址
 * @param filename 原始文件名（用于判断格式）
 */
public record FileAttachment(String url, String filename) {
}
