package com.chesshub.gameservice.games.tactics.domain.enums;

public enum RoomPhase {

    WAITING,   // 等待黑方加入（联机房间）
    PLAYING,   // 对局中
    ENDED      // 已分胜负（可重置回 PLAYING）
}
