package com.chesshub.gameservice.games.tactics.domain.model;

/**
 * 棋盘坐标：row 为行（0=黑方底线），col 为列。
 * 不保证在棋盘内，需要时用 {@link #onBoard()} 判断。
 */
public record Position(int row, int col) {

    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    public boolean onBoard() {
        return row >= 0 && row < Board.SIZE && col >= 0 && col < Board.SIZE;
    }

    public Position offset(int dRow, int dCol) {
        return new Position(row + dRow, col + dCol);
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
