package com.textworld.adventureservice.platform.transport;

import com.textworld.web.common.CurrentPlayerInfo;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * 一条入站消息：发送者身份 + 文本 + 可选附件。
 */
public record InboundMessage(CurrentPlayerInfo sender, String text, FileAttachment attachment) {

    public InboundMessage {
        text = text == null ? "" : text.strip();
    }

    public static InboundMessage text(CurrentPlayerInfo sender, String text) {
        return new InboundMessage(sender, text, null);
    }

    /**
     * 提取附件；只有带下载地址的附件才算数，缺省文件名为 "file"。
     */
    public Optional<FileAttachment> fileAttachment() {
        if (attachment == null || StringUtils.isBlank(attachment.url())) {
            return Optional.empty();
        }
        String filename = StringUtils.defaultIfBlank(attachment.filename(), "file");
        return Optional.of(new FileAttachment(attachment.url().strip(), filename));
    }
}
