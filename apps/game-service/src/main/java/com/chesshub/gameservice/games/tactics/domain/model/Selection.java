package com.chesshub.gameservice.games.tactics.domain.model;

import java.util.Set;

/**
 * 选中某个棋子后缓存的可达集合：
 * - moves  ：可移动（普通落点）的格子；
 * - attacks：可攻击（吃子）的格子。
 * 两个集合都不包含 origin 本身。
 */
public record Selection(Position origin, Set<Position> moves, Set<Position> attacks) {

    public Selection {
        moves = Set.copyOf(moves);
        attacks = Set.copyOf(attacks);
    }

    public boolean canMoveTo(Position p) {
        return moves.contains(p);
    }

    public boolean canAttack(Position p) {
        return attacks.contains(p);
    }

    public boolean isEmpty() {
        return moves.isEmpty() && attacks.isEmpty();
    }
}
