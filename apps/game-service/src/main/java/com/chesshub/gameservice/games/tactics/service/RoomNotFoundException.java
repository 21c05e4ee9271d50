package com.chesshub.gameservice.games.tactics.service;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;

/**
 * 房间不存在（或已因断线被丢弃）。
 */
public class RoomNotFoundException extends IllegalArgumentException {

    public RoomNotFoundException(String roomId) {
        super(TacticsMessages.ROOM_NOT_FOUND + ": " + roomId);
    }
}
