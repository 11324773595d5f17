package com.textworld.adventureservice.games.textworld.domain.constants;

import java.util.List;

/**
 * 文字冒险相关的消息常量
 * 统一管理所有玩家可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    public static final String DIVIDER = "━━━━━━━━━━━━━━━━";

    /** 拒绝/错误前缀 */
    public static final String ERROR_PREFIX = "❌ ";

    // ========== 默认值 ==========

    /** 快速创建时没有配置模板所用的世界观 */
    public static final String QUICKSTART_WORLD = "这是一个充满奇幻与冒险的世界，魔法与剑术并存，危险与机遇共生。";

    /** 快速创建的默认房间名 */
    public static final String QUICKSTART_ROOM_NAME = "快速冒险";

    /** 角色创建超时分配的默认设定 */
    public static final String DEFAULT_CHARACTER_SETTING = "一位神秘的冒险者";

    /** 开场叙事生成失败时的兜底 */
    public static final String OPENING_FALLBACK = "冒险开始了...";

    /** DM 没有返回内容时的占位 */
    public static final String NARRATION_PLACEHOLDER = "（无响应）";

    // ========== 用法 ==========

    public static final String USAGE_JOIN = "用法: /tw join <房间ID>";
    public static final String USAGE_ACT = "用法: /tw act <行动描述>";
    public static final String USAGE_TIMEOUT = "用法: /tw timeout <秒数>（仅暂停期间）";
    public static final String USAGE_NOTE = "用法: /tw note <补充说明>（仅暂停期间）";
    public static final String USAGE_ADMIN = "🔧 管理员命令:\n"
            + "/tw admin close <房间ID> - 强制关闭\n"
            + "/tw admin list - 详细列表";
    public static final String UNKNOWN_COMMAND = "未知命令，发送 /tw help 查看帮助";

    public static final String HELP = "🎮 Textworld 文字冒险\n"
            + DIVIDER + "\n"
            + "📌 创建房间\n"
            + "  /tw start - 引导创建\n"
            + "  /tw quickstart [名称] - 快速创建\n"
            + "  /tw cancel - 取消创建\n"
            + DIVIDER + "\n"
            + "📌 加入游戏\n"
            + "  /tw join <ID> - 加入房间\n"
            + "  /tw leave - 离开房间\n"
            + "  /tw list - 房间列表\n"
            + DIVIDER + "\n"
            + "🎭 游戏命令\n"
            + "  /tw begin - 开始游戏\n"
            + "  /tw act <行动> - 执行行动\n"
            + "  /tw status [ID] - 查看状态\n"
            + "  /tw world - 查看世界观\n"
            + "  /tw chars - 查看角色\n"
            + DIVIDER + "\n"
            + "⚙️ 房主命令\n"
            + "  /tw pause - 暂停\n"
            + "  /tw resume - 恢复\n"
            + "  /tw timeout <秒> - 暂停期间修改回合超时\n"
            + "  /tw note <说明> - 暂停期间补充剧情说明\n"
            + "  /tw close - 关闭房间";

    // ========== 创建向导 ==========

    public static final String WIZARD_STARTED = "🎮 创建冒险房间\n"
            + DIVIDER + "\n"
            + "📝 请输入房间名称（1-30字）\n"
            + DIVIDER + "\n"
            + "💡 /tw cancel 取消创建";
    public static final String WIZARD_EXPIRED = "⏰ 创建超时，请重新 /tw start";
    public static final String WIZARD_BUSY = "⏳ AI处理中，请稍候...";
    public static final String WIZARD_CANCELLED = "✅ 已取消创建";
    public static final String WIZARD_RESTARTED = "🔄 重新开始\n📝 请输入房间名称（1-30字）:";
    public static final String ROOM_NAME_INVALID = "房间名称应为 1-30 字符";
    public static final String TIMEOUT_NOT_A_NUMBER = "请输入数字或 '默认'";
    public static final String TIMEOUT_OUT_OF_RANGE = "请输入 %d-%d 之间的数字";
    public static final String WORLD_TOO_SHORT = "世界观至少需要 %d 个字";
    public static final String CONFIRM_PROMPT = "❓ 请输入: 确认 | 取消 | 重来 | 查看完整";
    public static final String TOO_LONG_PROMPT = "❓ 请选择：\n"
            + "• 总结 - AI总结\n"
            + "• 截断 - 保留前部分\n"
            + "• 保留 - 使用全文\n"
            + "• 或输入新的世界观（≥10字）";
    public static final String FILE_PARSING = "📄 解析中...";

    public static String formatRoomNameAccepted(String name, int defaultTimeout) {
        return "✅ 名称: " + name + "\n"
                + DIVIDER + "\n"
                + "⏱️ 请输入回合超时时间（30-600秒）\n"
                + "💡 输入 '默认' = " + defaultTimeout + "秒";
    }

    public static String formatTimeoutAccepted(int seconds, int maxLength) {
        return "✅ 超时: " + seconds + "秒\n"
                + DIVIDER + "\n"
                + "🌍 请输入世界观设定\n"
                + "📝 支持：直接输入 / 上传 .txt / .docx\n"
                + "💡 建议不超过 " + maxLength + " 字";
    }

    public static String formatWorldTooLong(int length, int maxLength, int summaryLength) {
        return "⚠️ 世界观过长！\n"
                + DIVIDER + "\n"
                + "📊 当前: " + length + " 字\n"
                + "📊 建议: ≤ " + maxLength + " 字\n"
                + DIVIDER + "\n"
                + "请选择处理方式：\n\n"
                + "1️⃣ 输入 '总结' → AI总结为 ~" + summaryLength + "字\n"
                + "2️⃣ 输入 '截断' → 保留前 " + maxLength + "字\n"
                + "3️⃣ 输入 '保留' → 使用全文（可能影响AI效果）\n"
                + "4️⃣ 重新输入更短的世界观";
    }

    public static String formatStillTooLong(int length) {
        return "⚠️ 仍然过长 (" + length + "字)\n请选择：总结 / 截断 / 保留";
    }

    public static String formatSummarizing(int length) {
        return "⏳ AI正在总结 " + length + " 字...";
    }

    public static String formatSummaryDone(int from, int to) {
        return "✅ 总结完成: " + from + " → " + to + " 字";
    }

    public static String formatSummaryFailed(String error) {
        return "❌ 总结失败: " + error + "\n请重新选择：总结 / 截断 / 保留";
    }

    public static String formatTruncated(int maxLength) {
        return "✅ 已截断为前 " + maxLength + " 字";
    }

    public static String formatKeptFull(int length) {
        return "✅ 保留全部 " + length + " 字";
    }

    public static String formatNewWorldSaved(int length) {
        return "✅ 新世界观已保存 (" + length + "字)";
    }

    public static String formatFileParsed(int length) {
        return "✅ 解析成功，" + length + "字";
    }

    public static String formatConfirm(String roomName, int timeout, String world, String original) {
        String preview = world.length() > 200 ? world.substring(0, 200) + "..." : world;
        String originalInfo = "";
        if (original != null && original.length() != world.length()) {
            originalInfo = "\n📊 原文 " + original.length() + " → 当前 " + world.length() + " 字";
        }
        return "📋 请确认房间配置\n"
                + DIVIDER + "\n"
                + "📍 名称: " + roomName + "\n"
                + "⏱️ 超时: " + timeout + "秒\n"
                + "🌍 世界观: " + world.length() + "字" + originalInfo + "\n\n"
                + preview + "\n"
                + DIVIDER + "\n"
                + "输入: 确认 | 取消 | 重来 | 查看完整";
    }

    public static String formatRoomCreated(String name, String id, int timeout) {
        return "🎮 房间创建成功！\n"
                + DIVIDER + "\n"
                + "📍 名称: " + name + "\n"
                + "🆔 ID: " + id + "\n"
                + "⏱️ 超时: " + timeout + "秒\n"
                + DIVIDER + "\n"
                + "📢 邀请: /tw join " + id + "\n"
                + "👉 开始: /tw begin";
    }

    public static String formatQuickCreated(String name, String id) {
        return "⚡ 快速创建成功！\n"
                + "📍 " + name + " | 🆔 " + id + "\n"
                + "加入: /tw join " + id + "\n"
                + "开始: /tw begin";
    }

    // ========== 房间成员 ==========

    public static String formatJoined(String roomName) {
        return "✅ 已加入房间 [" + roomName + "]";
    }

    public static String formatJoinedAsPending(String roomName) {
        return "✅ 已加入房间 [" + roomName + "]，房间暂停中，恢复后参与游戏";
    }

    public static String formatJoinBroadcast(String playerName, int activeCount) {
        return "📢 " + playerName + " 加入！(" + activeCount + "人)";
    }

    public static String formatJoinPendingBroadcast(String playerName) {
        return "📢 " + playerName + " 加入候补，恢复后参与";
    }

    public static String formatLeft(String roomName) {
        return "✅ 已离开房间 [" + roomName + "]";
    }

    public static String formatLeaveBroadcast(String playerName) {
        return "📢 " + playerName + " 离开了房间";
    }

    public static String formatClosedByHost(String roomName) {
        return "🚫 房间 [" + roomName + "] 已关闭";
    }

    public static String formatClosedByAdmin(String roomName) {
        return "🚫 房间 [" + roomName + "] 被管理员强制关闭";
    }

    public static final String ROOM_CLOSED_REPLY = "✅ 已关闭";

    public static String formatAdminClosed(String roomName) {
        return "✅ 已强制关闭 [" + roomName + "]";
    }

    // ========== 暂停/恢复 ==========

    public static final String PAUSED_BROADCAST = "⏸️ 房间已暂停\n/tw resume 恢复";
    public static final String PAUSED_REPLY = "✅ 已暂停";
    public static final String RESUMED_REPLY = "✅ 已恢复";
    public static final String TIMEOUT_STAGED = "✅ 新的回合超时 %d 秒，恢复后生效";
    public static final String NOTE_STAGED = "✅ 补充说明已暂存，恢复后并入下一轮叙事";

    public static String formatResumed(int round, Integer appliedTimeout, List<String> admitted) {
        StringBuilder sb = new StringBuilder();
        sb.append(round > 0 ? "▶️ 继续第" + round + "轮" : "▶️ 房间已恢复");
        if (appliedTimeout != null) {
            sb.append("\n⏱️ 回合超时调整为 ").append(appliedTimeout).append("秒");
        }
        if (!admitted.isEmpty()) {
            sb.append("\n👥 新加入: ").append(String.join(", ", admitted));
        }
        return sb.toString();
    }

    // ========== 角色创建 ==========

    public static final String BEGIN_REPLY = "✅ 已开始角色创建阶段";
    public static final String CHARACTER_FORMAT_INVALID = "格式错误\n请使用: 角色名：角色设定\n或: 角色名\\n角色设定";
    public static final String CHARACTER_NAME_INVALID = "角色名 1-20 字";
    public static final String CHARACTER_SETTING_TOO_SHORT = "角色设定至少 5 字";

    public static String formatCharacterCreationStarted(String roomName, String world, int timeoutSeconds) {
        String preview = world.length() > 300 ? world.substring(0, 300) + "..." : world;
        return "🎭 " + roomName + " - 角色创建阶段\n"
                + DIVIDER + "\n"
                + "【世界观预览】\n" + preview + "\n"
                + DIVIDER + "\n"
                + "⏱️ 请在 " + timeoutSeconds + "秒 内完成\n\n"
                + "📝 格式：角色名：背景、性格、技能\n\n"
                + "示例：艾琳：精灵弓箭手，冷静，擅长追踪";
    }

    public static String formatCharacterDone(String characterName, String setting) {
        String preview = setting.length() > 80 ? setting.substring(0, 80) + "..." : setting;
        return "✅ 角色创建完成！\n👤 " + characterName + "\n📝 " + preview;
    }

    public static String formatCharacterBroadcast(String playerName, String characterName) {
        return "✅ " + playerName + " → 【" + characterName + "】";
    }

    public static String formatCharacterTimeout(List<String> names) {
        return "⏰ 超时: " + String.join(", ", names) + "\n已使用默认角色";
    }

    public static String formatGameStart(String roomName, String roster, String opening, int timeoutSeconds) {
        return "━━━━ 🎭 " + roomName + " 开始！ ━━━━\n\n"
                + "【参与角色】\n" + roster + "\n"
                + "【开场】\n" + opening + "\n\n"
                + DIVIDER + "\n"
                + "🔄 第1轮 | ⏱️" + timeoutSeconds + "秒\n"
                + "使用 /tw act <行动描述> 进行冒险";
    }

    // ========== 回合 ==========

    public static final String NO_VALID_ACTIONS = "⚠️ 本轮没有有效行动，计时重新开始";
    public static final String ALL_TIMED_OUT = "🚫 全员超时，房间关闭";

    public static String formatActionRecorded(String name) {
        return "✅ 【" + name + "】行动已记录";
    }

    public static String formatRoundTimeout(List<String> names) {
        return "⏰ 超时: " + String.join(", ", names);
    }

    public static String formatRoundResult(int round, String actionLines, String narration, int nextRound, int timeoutSeconds) {
        return "━━━━ 📖 第" + round + "轮结果 ━━━━\n\n"
                + "【玩家行动】\n" + actionLines + "\n\n"
                + "【DM回应】\n" + narration + "\n\n"
                + DIVIDER + "\n"
                + "🔄 第" + nextRound + "轮开始！\n"
                + "⏱️ 超时: " + timeoutSeconds + "秒\n"
                + "使用 /tw act <行动> 进行冒险";
    }

    // ========== 查询 ==========

    public static final String NO_ROOMS = "📭 当前没有房间\n/tw start 创建";
    public static final String NO_ROOMS_ADMIN = "📭 没有房间";
    public static final String NO_CHARACTERS = "还没有角色信息";
}
