package com.chesshub.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：房间快照、调试视图拿到的都是副本，不会污染实盘。
 * - 具体游戏（如 TacticsState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
