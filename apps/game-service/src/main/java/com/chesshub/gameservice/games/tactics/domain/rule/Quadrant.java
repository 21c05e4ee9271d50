package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Position;

/**
 * 刺客使用的棋盘象限（按顺时针编号）：
 * Q1 = 上右（row&lt;4, col≥4）
 * Q2 = 上左（row&lt;4, col&lt;4）
 * Q3 = 下左（row≥4, col&lt;4）
 * Q4 = 下右（row≥4, col≥4）
 * q 的顺时针后继为 (q mod 4) + 1。
 */
public enum Quadrant {
    Q1, Q2, Q3, Q4;

    private static final int HALF = Board.SIZE / 2;

    /** 象限编号 1..4 */
    public int number() {
        return ordinal() + 1;
    }

    public Quadrant clockwise() {
        return values()[number() % 4];
    }

    public boolean contains(Position p) {
        return of(p) == this;
    }

    /** 按当前坐标计算所在象限（每次查询都重新计算，不单独记录） */
    public static Quadrant of(Position p) {
        boolean top = p.row() < HALF;
        boolean left = p.col() < HALF;
        if (top) return left ? Q2 : Q1;
        return left ? Q3 : Q4;
    }
}
