package com.chesshub.gameservice.games.tactics.domain.enums;

/**
 * 房间模式：
 * ONLINE：双人联机，房主执白，加入者执黑；
 * LOCAL ：单人本地对弈，房主一人执双方。
 */
public enum Mode {
    ONLINE,
    LOCAL
}
