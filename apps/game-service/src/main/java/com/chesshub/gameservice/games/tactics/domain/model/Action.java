package com.chesshub.gameservice.games.tactics.domain.model;

/**
 * 一步已完成的行动：from → to。
 * 作用：记录上一手，便于前端高亮与日志排查。
 */
public record Action(Position from, Position to, ActionType type) {
}
