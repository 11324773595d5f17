package com.textworld.web.common;

/**
 * 当前玩家身份 DTO
 * 由传输层（HTTP 头 / STOMP CONNECT 头）解析得到，统一封装。
 */
public record CurrentPlayerInfo(
    /** 玩家唯一标识 */
    String playerId,

    /** 显示名称（未提供时回退为 playerId） */
    String displayName,

    /** 回复地址：广播与私信投递的目的地 */
    String replyAddress
) {
    /**
     * 默认回复地址前缀：未显式给出 reply-to 时，按玩家投递
     */
    public static final String USER_ADDRESS_PREFIX = "user.";

    /**
     * 是否使用的是按玩家生成的默认地址
     */
    public boolean hasDefaultAddress() {
        return replyAddress != null && replyAddress.equals(USER_ADDRESS_PREFIX + playerId);
    }
}
