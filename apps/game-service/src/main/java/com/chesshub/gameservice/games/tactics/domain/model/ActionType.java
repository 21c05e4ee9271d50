package com.chesshub.gameservice.games.tactics.domain.model;

/** 行动类别：普通移动 / 吃子 / 被拒绝（目标不在可达集合内） */
public enum ActionType {
    MOVE,
    CAPTURE,
    REJECTED
}
