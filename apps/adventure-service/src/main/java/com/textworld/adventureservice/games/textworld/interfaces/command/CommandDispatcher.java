package com.textworld.adventureservice.games.textworld.interfaces.command;

import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.service.TextworldService;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.CurrentPlayerInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 文本命令分发器
 * ----------------------------------------
 * 把一条入站消息路由到 {@link TextworldService}：
 *   - 以 "/tw" 开头：解析子命令并调用对应操作；
 *   - 其他 "/" 命令：不属于本游戏，忽略；
 *   - 普通文本：交给创建向导 / 角色创建。
 *
 * 拒绝类异常原样抛出，由 WS / HTTP 控制器统一转换。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    public static final String PREFIX = "/tw";

    private final TextworldService service;

    /**
     * @return 给发起者的回复（可能为空）
     */
    public List<String> dispatch(InboundMessage message) {
        String text = message.text();
        if (!text.startsWith("/")) {
            return service.handleFreeText(message);
        }
        if (!isOwnCommand(text)) {
            return List.of();
        }

        String body = text.substring(PREFIX.length()).strip();
        String[] parts = body.split("\\s+", 2);
        String cmd = parts[0].toLowerCase(Locale.ROOT);
        String arg = parts.length > 1 ? parts[1].strip() : "";
        CurrentPlayerInfo player = message.sender();
        log.debug("命令: player={}, cmd={}", player.playerId(), cmd);

        return List.of(switch (cmd) {
            case "", "help" -> service.help();
            case "start" -> service.createRoom(player);
            case "quickstart" -> service.quickCreate(player, arg);
            case "cancel" -> service.cancelCreation(player);
            case "join" -> service.join(player, arg);
            case "leave" -> service.leave(player);
            case "begin" -> service.begin(player);
            case "act" -> {
                if (arg.isEmpty()) {
                    throw new UserInputException(GameMessages.USAGE_ACT);
                }
                yield service.act(player, arg);
            }
            case "pause" -> service.pause(player);
            case "resume" -> service.resume(player);
            case "timeout" -> service.stageTimeout(player, arg);
            case "note" -> service.stageNote(player, arg);
            case "status" -> service.status(player, arg);
            case "world" -> service.world(player);
            case "chars" -> service.characters(player);
            case "list" -> service.list();
            case "close" -> service.close(player);
            case "admin" -> admin(player, arg);
            default -> throw new UserInputException(GameMessages.UNKNOWN_COMMAND);
        });
    }

    private String admin(CurrentPlayerInfo player, String arg) {
        String[] parts = arg.split("\\s+", 2);
        String sub = parts[0].toLowerCase(Locale.ROOT);
        String roomId = parts.length > 1 ? parts[1].strip() : "";
        return switch (sub) {
            case "close" -> service.adminClose(player, roomId);
            case "list" -> service.adminList(player);
            default -> GameMessages.USAGE_ADMIN;
        };
    }

    static boolean isOwnCommand(String text) {
        if (!text.startsWith(PREFIX)) {
            return false;
        }
        return text.length() == PREFIX.length() || Character.isWhitespace(text.charAt(PREFIX.length()));
    }
}
