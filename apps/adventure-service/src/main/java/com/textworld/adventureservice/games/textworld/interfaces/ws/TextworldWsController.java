package com.textworld.adventureservice.games.textworld.interfaces.ws;

import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.interfaces.command.CommandDispatcher;
import com.textworld.adventureservice.games.textworld.interfaces.ws.dto.TextworldMessages.InputCmd;
import com.textworld.adventureservice.platform.transport.Envelope;
import com.textworld.adventureservice.platform.transport.FileAttachment;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.adventureservice.platform.ws.PlayerPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.List;

/**
 * Textworld WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/textworld.input，经 {@link CommandDispatcher} 处理后，
 * 把回复逐条推送到发起者的 /user/queue/textworld。
 * 房间广播由 Broadcaster 单独投递。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class TextworldWsController {

    public static final String REPLY_DESTINATION = "/queue/textworld";

    private final CommandDispatcher dispatcher;
    private final SimpMessagingTemplate messaging;

    @MessageMapping("/textworld.input")
    public void input(InputCmd cmd, SimpMessageHeaderAccessor sha) {
        Principal principal = sha.getUser();
        if (!(principal instanceof PlayerPrincipal pp)) {
            log.warn("未识别身份的输入被忽略: sessionId={}", sha.getSessionId());
            return;
        }
        String userName = pp.getName();
        FileAttachment attachment = StringUtils.isBlank(cmd.getAttachmentUrl())
                ? null
                : new FileAttachment(cmd.getAttachmentUrl(), cmd.getAttachmentName());
        InboundMessage message = new InboundMessage(pp.player(), cmd.getText(), attachment);
        try {
            List<String> replies = dispatcher.dispatch(message);
            for (String reply : replies) {
                messaging.convertAndSendToUser(userName, REPLY_DESTINATION, Envelope.reply(pp.player().replyAddress(), reply));
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(pp, e.getMessage());
        } catch (Exception e) {
            log.error("处理输入失败: player={}", userName, e);
            sendError(pp, "服务器内部错误，请稍后再试");
        }
    }

    private void sendError(PlayerPrincipal pp, String msg) {
        messaging.convertAndSendToUser(pp.getName(), REPLY_DESTINATION,
                Envelope.error(pp.player().replyAddress(), GameMessages.ERROR_PREFIX + msg));
    }
}
