package com.textworld.adventureservice.games.textworld.domain.model;

import com.textworld.adventureservice.games.textworld.domain.enums.PlayerStatus;
import com.textworld.web.common.CurrentPlayerInfo;
import lombok.Data;

/**
 * 房间内的玩家。只在所属房间的锁内被修改。
 */
@Data
public class Player {
    private final String id;
    private final String displayName;
    private final String replyAddress;
    private final long joinedAt;

    private CharacterSheet character;
    private PlayerStatus status = PlayerStatus.ACTIVE;
    /** 本轮行动，每轮开始时清空 */
    private String lastAction;
    private long lastActionAt;

    public static Player of(CurrentPlayerInfo info, long now) {
        return new Player(info.playerId(), info.displayName(), info.replyAddress(), now);
    }

    public boolean hasCharacter() {
        return character != null;
    }

    /** 叙事中使用的名字：有角色用角色名，否则用玩家名 */
    public String narrativeName() {
        return hasCharacter() ? character.name() : displayName;
    }

    public void recordAction(String action, long now) {
        this.lastAction = action;
        this.lastActionAt = now;
        this.status = PlayerStatus.ACTED;
    }

    public void resetForNewRound() {
        this.status = PlayerStatus.ACTIVE;
        this.lastAction = null;
    }
}
