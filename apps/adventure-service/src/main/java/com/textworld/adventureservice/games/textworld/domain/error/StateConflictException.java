package com.textworld.adventureservice.games.textworld.domain.error;

import lombok.Getter;

/**
 * 操作与当前房间/回合状态冲突
 */
@Getter
public class StateConflictException extends IllegalStateException {

    private final RoomRejection rejection;

    public StateConflictException(RoomRejection rejection) {
        super(rejection.message());
        this.rejection = rejection;
    }
}
