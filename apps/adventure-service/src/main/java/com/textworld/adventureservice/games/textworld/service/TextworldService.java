package com.textworld.adventureservice.games.textworld.service;

import com.textworld.adventureservice.games.textworld.domain.dto.RoomSummary;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.CurrentPlayerInfo;

import java.util.List;

/**
 * 文字冒险的命令面：每个方法对应一个玩家命令，返回给发起者的回复。
 * 拒绝以 {@code UserInputException} / {@code StateConflictException} 抛出，由传输层转换成错误回复。
 */
public interface TextworldService {

    /** 开始创建向导 */
    String createRoom(CurrentPlayerInfo player);

    /** 快速创建：默认世界观、默认超时；roomName 可空 */
    String quickCreate(CurrentPlayerInfo player, String roomName);

    String cancelCreation(CurrentPlayerInfo player);

    String join(CurrentPlayerInfo player, String roomId);

    String leave(CurrentPlayerInfo player);

    /** 房主开始游戏（进入角色创建） */
    String begin(CurrentPlayerInfo player);

    String act(CurrentPlayerInfo player, String action);

    String pause(CurrentPlayerInfo player);

    String resume(CurrentPlayerInfo player);

    /** 暂停期间暂存新的回合超时 */
    String stageTimeout(CurrentPlayerInfo player, String seconds);

    /** 暂停期间暂存房主补充说明 */
    String stageNote(CurrentPlayerInfo player, String note);

    /** roomId 为空时查看自己所在的房间 */
    String status(CurrentPlayerInfo player, String roomId);

    String world(CurrentPlayerInfo player);

    String characters(CurrentPlayerInfo player);

    String list();

    String help();

    String close(CurrentPlayerInfo player);

    String adminClose(CurrentPlayerInfo player, String roomId);

    String adminList(CurrentPlayerInfo player);

    /** 非命令文本：交给创建向导或角色创建；都不适用时返回空列表 */
    List<String> handleFreeText(InboundMessage message);

    /** 大厅列表 */
    List<RoomSummary> listRooms();
}
