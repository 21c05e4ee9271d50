package com.chesshub.gameservice.games.tactics.domain.model;

/**
 * 棋子种类（固定 9 种，棋子实例的种类永不改变）。
 * code 为传输层使用的小写名称，例如 "warrior"。
 */
public enum PieceKind {
    /** 王：被吃即判负 */
    KING("king"),
    /** 勇士：移动 → 弱攻 → 强攻 三段循环 */
    WARRIOR("warrior"),
    /** 防御兵：只向前一格（左前/正前/右前） */
    DEFENDER("defender"),
    /** 圣骑士：半径 2 的移动与攻击 */
    PALADIN("paladin"),
    /** 法师：十字远程攻击，攻击后冷却 */
    MAGE("mage"),
    /** 枪兵：直线前进，只攻击正前方第 3 格 */
    SPEARMAN("spearman"),
    /** 弓兵：不可移动，前方半圆攻击 */
    ARCHER("archer"),
    /** 吟游诗人：纯辅助，给周围友军移动 +1 */
    BARD("bard"),
    /** 刺客：只能进入顺时针下一个象限 */
    ASSASSIN("assassin");

    private final String code;

    PieceKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * 按传输名称解析（大小写不敏感）。
     *
     * @throws IllegalArgumentException 未知的棋子名称
     */
    public static PieceKind fromCode(String code) {
        if (code != null) {
            for (PieceKind k : values()) {
                if (k.code.equalsIgnoreCase(code.trim())) return k;
            }
        }
        throw new IllegalArgumentException("UNKNOWN_PIECE_KIND: " + code);
    }
}
