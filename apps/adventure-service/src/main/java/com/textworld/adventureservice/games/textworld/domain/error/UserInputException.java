package com.textworld.adventureservice.games.textworld.domain.error;

/**
 * 玩家输入不合法（格式、长度、取值范围）。向导与回合状态保持不变，玩家可直接重试。
 */
public class UserInputException extends IllegalArgumentException {

    public UserInputException(String message) {
        super(message);
    }
}
