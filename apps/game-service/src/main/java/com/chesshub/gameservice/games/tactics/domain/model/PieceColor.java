package com.chesshub.gameservice.games.tactics.domain.model;

/**
 * 执子方。白方底线在第 7 行（向上走，行号递减），黑方底线在第 0 行。
 */
public enum PieceColor {
    WHITE("white", -1),
    BLACK("black", 1);

    private final String code;
    /** 朝对方底线前进一步时的行偏移 */
    private final int forward;

    PieceColor(String code, int forward) {
        this.code = code;
        this.forward = forward;
    }

    public String code() {
        return code;
    }

    public int forward() {
        return forward;
    }

    public PieceColor opponent() {
        return this == WHITE ? BLACK : WHITE;
    }

    /**
     * 按传输名称解析（"white" / "black"，大小写不敏感）。
     *
     * @throws IllegalArgumentException 未知颜色
     */
    public static PieceColor fromCode(String code) {
        if (code != null) {
            for (PieceColor c : values()) {
                if (c.code.equalsIgnoreCase(code.trim())) return c;
            }
        }
        throw new IllegalArgumentException("UNKNOWN_COLOR: " + code);
    }
}
