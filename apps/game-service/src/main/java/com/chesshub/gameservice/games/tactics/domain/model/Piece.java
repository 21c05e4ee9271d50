package com.chesshub.gameservice.games.tactics.domain.model;

import java.util.Objects;

/**
 * 棋子（不可变）。
 * 附加状态按种类区分，而不是共用一个整数：
 * - stance：仅勇士持有，其余种类必须为 null；
 * - cooldown：仅法师有意义（0=可攻击，&gt;0=冷却中），其余种类恒为 0。
 */
public record Piece(PieceKind kind, PieceColor color, Stance stance, int cooldown) {

    /** 法师攻击后的冷却回合数，也是开局初始值 */
    public static final int MAGE_COOLDOWN = 2;

    public Piece {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(color, "color");
        if (kind == PieceKind.WARRIOR && stance == null) {
            throw new IllegalArgumentException("warrior requires a stance");
        }
        if (kind != PieceKind.WARRIOR && stance != null) {
            throw new IllegalArgumentException(kind.code() + " cannot carry a stance");
        }
        if (cooldown < 0) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
        if (kind != PieceKind.MAGE && cooldown != 0) {
            throw new IllegalArgumentException(kind.code() + " cannot carry a cooldown");
        }
    }

    /** 无附加状态的棋子；勇士默认移动姿态，法师默认可攻击 */
    public static Piece of(PieceKind kind, PieceColor color) {
        return new Piece(kind, color, kind == PieceKind.WARRIOR ? Stance.MOBILE : null, 0);
    }

    public static Piece warrior(PieceColor color, Stance stance) {
        return new Piece(PieceKind.WARRIOR, color, stance, 0);
    }

    public static Piece mage(PieceColor color, int cooldown) {
        return new Piece(PieceKind.MAGE, color, null, cooldown);
    }

    public boolean is(PieceKind k) {
        return kind == k;
    }

    public boolean isEnemyOf(PieceColor side) {
        return color != side;
    }

    /** 法师是否冷却中 */
    public boolean recovering() {
        return kind == PieceKind.MAGE && cooldown > 0;
    }

    public Piece withStance(Stance next) {
        return new Piece(kind, color, next, cooldown);
    }

    public Piece withCooldown(int turns) {
        return new Piece(kind, color, stance, turns);
    }
}
