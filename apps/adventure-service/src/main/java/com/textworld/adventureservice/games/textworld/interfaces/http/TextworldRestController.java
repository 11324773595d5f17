package com.textworld.adventureservice.games.textworld.interfaces.http;

import com.textworld.adventureservice.games.textworld.interfaces.command.CommandDispatcher;
import com.textworld.adventureservice.games.textworld.interfaces.http.dto.InputRequest;
import com.textworld.adventureservice.platform.transport.FileAttachment;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.ApiResponse;
import com.textworld.web.common.CurrentPlayerHelper;
import com.textworld.web.common.CurrentPlayerInfo;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 文字冒险 http 输入接口
 *
 * 与 WS 入口走同一个 {@link CommandDispatcher}，回复直接放在响应体里；
 * 身份取自 X-Player-Id / X-Player-Name / X-Reply-To 头。
 */
@RestController
@RequestMapping("/api/textworld")
@RequiredArgsConstructor
public class TextworldRestController {

    private final CommandDispatcher dispatcher;

    @PostMapping("/input")
    public ApiResponse<List<String>> input(@Valid @RequestBody InputRequest body, HttpServletRequest request) {
        CurrentPlayerInfo player = CurrentPlayerHelper.from(request::getHeader,
                CurrentPlayerHelper.HTTP_PLAYER_ID, CurrentPlayerHelper.HTTP_PLAYER_NAME, CurrentPlayerHelper.HTTP_REPLY_TO);
        if (player == null) {
            throw new IllegalArgumentException("缺少玩家身份");
        }
        FileAttachment attachment = StringUtils.isBlank(body.getAttachmentUrl())
                ? null
                : new FileAttachment(body.getAttachmentUrl(), body.getAttachmentName());
        return ApiResponse.success(dispatcher.dispatch(new InboundMessage(player, body.getText(), attachment)));
    }
}
