package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.Position;

import java.util.Set;

/**
 * 一种棋子的能力对：移动规则 + 攻击规则。
 * 每个棋子种类在 {@link Reachability} 的分派表里恰好对应一个 PieceRule。
 */
public record PieceRule(Reach move, Reach attack) {

    /**
     * 纯函数：给定棋盘快照、起点与起点上的棋子，返回可达格子集合。
     */
    @FunctionalInterface
    public interface Reach {
        /** 无任何可达格（弓兵移动、吟游诗人攻击等） */
        Reach NONE = (b, from, piece) -> Set.of();

        Set<Position> apply(Board b, Position from, Piece piece);
    }
}
