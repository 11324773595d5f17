package com.textworld.web.common;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * 当前玩家信息提取工具类
 *
 * 统一从传输层的头信息中提取玩家身份：
 * - 玩家ID（必填）
 * - 显示名称（可选，缺省用玩家ID）
 * - 回复地址（可选，缺省为 user.{playerId}）
 *
 * 使用方式：
 * <pre>
 * {@code
 * CurrentPlayerInfo player = CurrentPlayerHelper.from(request::getHeader,
 *         CurrentPlayerHelper.HTTP_PLAYER_ID, CurrentPlayerHelper.HTTP_PLAYER_NAME, CurrentPlayerHelper.HTTP_REPLY_TO);
 * }
 * </pre>
 */
@Slf4j
public final class CurrentPlayerHelper {

    public static final String HTTP_PLAYER_ID = "X-Player-Id";
    public static final String HTTP_PLAYER_NAME = "X-Player-Name";
    public static final String HTTP_REPLY_TO = "X-Reply-To";

    public static final String STOMP_PLAYER_ID = "player-id";
    public static final String STOMP_PLAYER_NAME = "player-name";
    public static final String STOMP_REPLY_TO = "reply-to";

    /** 玩家ID与回复地址只允许用作 STOMP 目的地后缀的字符 */
    private static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9_.:@-]{1,64}");

    /** 显示名称最大长度 */
    private static final int MAX_NAME_LENGTH = 32;

    private CurrentPlayerHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 从头信息中提取当前玩家
     *
     * @param headers   头查找函数（不存在时返回 null）
     * @param idKey     玩家ID头名
     * @param nameKey   显示名称头名
     * @param replyKey  回复地址头名
     * @return 当前玩家；缺少或非法玩家ID时返回 null
     */
    public static CurrentPlayerInfo from(Function<String, String> headers,
                                         String idKey, String nameKey, String replyKey) {
        if (headers == null) {
            return null;
        }
        return of(headers.apply(idKey), headers.apply(nameKey), headers.apply(replyKey));
    }

    /**
     * 用原始值构造当前玩家，做裁剪与兜底
     */
    public static CurrentPlayerInfo of(String rawId, String rawName, String rawReplyTo) {
        String playerId = StringUtils.trimToNull(rawId);
        if (playerId == null || !SAFE_TOKEN.matcher(playerId).matches()) {
            log.debug("忽略非法玩家ID: {}", rawId);
            return null;
        }

        // 1. 显示名称（缺省用玩家ID，过长截断）
        String displayName = StringUtils.defaultIfBlank(StringUtils.trim(rawName), playerId);
        displayName = StringUtils.truncate(displayName, MAX_NAME_LENGTH);

        // 2. 回复地址（缺省或非法时回退到按玩家投递）
        String replyAddress = StringUtils.trimToNull(rawReplyTo);
        if (replyAddress == null || !SAFE_TOKEN.matcher(replyAddress).matches()) {
            replyAddress = CurrentPlayerInfo.USER_ADDRESS_PREFIX + playerId;
        }
        return new CurrentPlayerInfo(playerId, displayName, replyAddress);
    }
}
