package com.textworld.adventureservice.platform.ws;

import com.textworld.web.common.CurrentPlayerInfo;

import java.security.Principal;

/**
 * STOMP 会话的玩家身份，name 即玩家 ID（用户目的地 /user/queue/... 按它路由）。
 */
public record PlayerPrincipal(CurrentPlayerInfo player) implements Principal {

    @Override
    public String getName() {
        return player.playerId();
    }
}
