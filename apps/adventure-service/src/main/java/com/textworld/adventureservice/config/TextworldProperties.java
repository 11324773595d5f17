package com.textworld.adventureservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 文字冒险引擎的全部可调参数。
 *
 * 支持通过 application.yml 或环境变量覆盖（前缀 textworld）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "textworld")
public class TextworldProperties {

    /** 同时存在的房间上限 */
    private int maxRooms = 10;

    /** 默认回合超时（秒） */
    private int defaultTimeout = 300;

    /** 角色创建阶段超时（秒） */
    private int charCreationTimeout = 180;

    /** 每个房间的人数上限（正式 + 候补） */
    private int maxPlayersPerRoom = 8;

    /** 创建向导超时（秒），在下一次输入时惰性检查 */
    private int creationTimeout = 300;

    /** 管理员玩家 ID */
    private List<String> adminIds = new ArrayList<>();

    /** 世界观建议长度上限，超过时进入“过长”选择 */
    private int worldSettingMaxLength = 4000;

    /** AI 总结的目标长度 */
    private int worldSettingSummaryLength = 2000;

    /** “默认”世界观模板，为空时快速创建使用内置世界观 */
    private String worldTemplate = "";

    /** 长文本分段长度 */
    private int chunkSize = 1000;

    /** 开场叙事长度上限（写入提示词） */
    private int openingMaxLength = 400;

    /** 每轮 DM 回应长度上限（写入提示词） */
    private int dmResponseMaxLength = 500;

    /** 叙事上下文中保留的历史轮数 */
    private int historyRoundsInContext = 5;

    /** 角色设定长度上限，超过截断并追加 "..." */
    private int characterSettingMaxLength = 500;

    /** DM 叙事风格 */
    private String dmStyle = "生动有趣，富有想象力";

    /** 上传文件下载超时（秒） */
    private int fileDownloadTimeoutSeconds = 30;

    /** 叙事模型（OpenAI 兼容接口） */
    private Llm llm = new Llm();

    public boolean isAdmin(String playerId) {
        return adminIds.contains(playerId);
    }

    @Data
    public static class Llm {
        /** 为空时不创建模型，所有生成调用直接失败并走兜底 */
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String modelName = "gpt-4o-mini";
        private int timeoutSeconds = 60;
    }
}
