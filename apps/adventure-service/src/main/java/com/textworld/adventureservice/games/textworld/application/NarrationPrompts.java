package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 叙事提示词：开场、回合结算、世界观总结
 */
@Component
@RequiredArgsConstructor
public class NarrationPrompts {

    /** 开场提示词中世界观截取的长度 */
    static final int OPENING_WORLD_LIMIT = 1500;

    private final TextworldProperties properties;

    public String opening(String worldSetting, String charactersInfo) {
        String world = worldSetting.length() > OPENING_WORLD_LIMIT
                ? worldSetting.substring(0, OPENING_WORLD_LIMIT) : worldSetting;
        return "你是文字冒险游戏的DM，叙事风格：" + properties.getDmStyle() + "\n\n"
                + "【世界观】\n" + world + "\n\n"
                + "【参与角色】\n" + charactersInfo + "\n\n"
                + "请用" + properties.getOpeningMaxLength()
                + "字以内生动描述冒险的开场，介绍场景氛围，让每个角色自然地出现在开场场景中。不要替玩家做决定。";
    }

    public String round(String context, int round, Map<String, String> actions) {
        String actionText = actions.entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        return "你是文字冒险游戏的DM，叙事风格：" + properties.getDmStyle() + "\n\n"
                + context + "\n\n"
                + "【第" + round + "轮玩家行动】\n" + actionText + "\n\n"
                + "请根据玩家行动描述发生的事情和结果，用" + properties.getDmResponseMaxLength()
                + "字以内，保持故事连贯性。不要替玩家做决定。";
    }

    public String summary(String worldSetting) {
        return "请将以下世界观设定精简总结为" + properties.getWorldSettingSummaryLength()
                + "字以内，保留核心设定：\n\n" + worldSetting;
    }
}
