package com.textworld.adventureservice.games.textworld.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 -> 后端：/app/textworld.input
 * 后端 -> 前端：/user/queue/textworld（回复）与 /topic/inbox.{address}（广播），统一包在 Envelope 里。
 */
public class TextworldMessages {

    /**
     * 输入命令（客户端 → 服务端）
     * 字段：
     *   - text          ：原始文本，命令或自由输入；
     *   - attachmentUrl ：附件下载地址，可空；
     *   - attachmentName：附件文件名，可空。
     */
    @Data
    public static class InputCmd {
        private String text;
        private String attachmentUrl;
        private String attachmentName;
    }
}
