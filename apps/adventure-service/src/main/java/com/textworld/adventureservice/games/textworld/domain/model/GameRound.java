package com.textworld.adventureservice.games.textworld.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一轮的历史记录，追加后不可变。
 *
 * @param roundNumber   轮次
 * @param playerActions 角色名（无角色时为玩家名）→ 行动
 * @param narration     DM 叙事回应
 * @param timestamp     记录时间（毫秒）
 */
public record GameRound(int roundNumber, Map<String, String> playerActions, String narration, long timestamp) {

    public GameRound {
        playerActions = Collections.unmodifiableMap(new LinkedHashMap<>(playerActions));
    }
}
