package com.chesshub.gameservice.games.tactics.domain.model;

/**
 * 勇士姿态：每完成一次行动（移动或攻击）按 0 → 1 → 2 → 0 循环。
 */
public enum Stance {
    /** 0：可移动，不可攻击 */
    MOBILE,
    /** 1：弱攻，半径 1 */
    WEAK_STRIKE,
    /** 2：强攻，半径 2 */
    STRONG_STRIKE;

    public Stance next() {
        return values()[(ordinal() + 1) % values().length];
    }

    /**
     * 传输层的整数值（即 ordinal）转姿态。
     *
     * @throws IllegalArgumentException 超出 0..2
     */
    public static Stance ofValue(int value) {
        if (value < 0 || value >= values().length) {
            throw new IllegalArgumentException("UNKNOWN_STANCE: " + value);
        }
        return values()[value];
    }
}
