package com.chesshub.gameservice.games.tactics.domain.model;

/** 一次点击的处理结果，供上层决定广播什么 */
public enum ClickResult {
    /** 点击被忽略（空格、对方棋子、对局已结束） */
    IGNORED,
    /** 选中了己方棋子，缓存了可达集合 */
    SELECTED,
    /** 已选中状态下点了不可达的格子：取消选中，棋盘不变 */
    CLEARED,
    /** 完成一次普通移动 */
    MOVED,
    /** 完成一次吃子 */
    CAPTURED
}
