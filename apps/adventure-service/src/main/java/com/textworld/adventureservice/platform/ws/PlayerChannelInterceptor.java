package com.textworld.adventureservice.platform.ws;

import com.textworld.web.common.CurrentPlayerHelper;
import com.textworld.web.common.CurrentPlayerInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * WebSocket STOMP 身份拦截器
 *
 * 在 STOMP CONNECT 阶段读取 player-id / player-name / reply-to 头并设置会话身份，供后续消息处理使用。
 * 仅处理 CONNECT 命令，其他消息直接放行。
 * 身份缺失或不合法时不设置用户，后续发送会因缺少身份而被拒绝。
 */
@Slf4j
@Component
public class PlayerChannelInterceptor implements ChannelInterceptor {

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        CurrentPlayerInfo player = CurrentPlayerHelper.from(
                key -> firstHeader(accessor, key),
                CurrentPlayerHelper.STOMP_PLAYER_ID,
                CurrentPlayerHelper.STOMP_PLAYER_NAME,
                CurrentPlayerHelper.STOMP_REPLY_TO);
        if (player != null) {
            accessor.setUser(new PlayerPrincipal(player));
        } else {
            log.debug("CONNECT 缺少合法的玩家身份: session={}", accessor.getSessionId());
        }
        return message;
    }

    /**
     * 从 STOMP header 中提取指定 key 的第一个值
     */
    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
