package com.chesshub.gameservice.games.tactics.domain.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static com.chesshub.gameservice.games.tactics.domain.model.PieceColor.BLACK;
import static com.chesshub.gameservice.games.tactics.domain.model.PieceColor.WHITE;
import static com.chesshub.gameservice.games.tactics.domain.model.PieceKind.*;

/**
 * 战术棋棋盘：8x8 网格，每格为空（null）或一枚棋子。
 * 约定：第 0 行为黑方底线，第 7 行为白方底线，按行优先存储。
 *
 * 棋盘一经发布即不可变：所有“修改”都返回新棋盘，旧快照可被安全地广播/缓存。
 */
@EqualsAndHashCode
public final class Board {
    /** 棋盘尺寸（8x8） */
    public static final int SIZE = 8;

    private final Piece[][] grid;

    private Board(Piece[][] grid) {
        this.grid = grid;
    }

    /** 空棋盘 */
    public static Board empty() {
        return new Board(new Piece[SIZE][SIZE]);
    }

    /**
     * 标准开局：双方镜像摆放，王与辅助棋子在底线，
     * 防御兵在第二线两侧（中间空出 4 格），法师开局冷却 2。
     */
    public static Board initial() {
        Piece[][] g = new Piece[SIZE][SIZE];
        g[0] = new Piece[]{
                Piece.of(ASSASSIN, BLACK), Piece.of(ARCHER, BLACK), Piece.of(KING, BLACK),
                Piece.mage(BLACK, Piece.MAGE_COOLDOWN), Piece.of(SPEARMAN, BLACK), Piece.of(PALADIN, BLACK),
                Piece.of(BARD, BLACK), Piece.warrior(BLACK, Stance.MOBILE)
        };
        g[1] = defenderRow(BLACK);
        g[6] = defenderRow(WHITE);
        g[7] = new Piece[]{
                Piece.warrior(WHITE, Stance.MOBILE), Piece.of(BARD, WHITE), Piece.of(PALADIN, WHITE),
                Piece.of(SPEARMAN, WHITE), Piece.mage(WHITE, Piece.MAGE_COOLDOWN), Piece.of(KING, WHITE),
                Piece.of(ARCHER, WHITE), Piece.of(ASSASSIN, WHITE)
        };
        return new Board(g);
    }

    private static Piece[] defenderRow(PieceColor color) {
        Piece[] row = new Piece[SIZE];
        row[0] = Piece.of(DEFENDER, color);
        row[1] = Piece.of(DEFENDER, color);
        row[6] = Piece.of(DEFENDER, color);
        row[7] = Piece.of(DEFENDER, color);
        return row;
    }

    /** 是否在棋盘内（0 ≤ row,col &lt; 8） */
    public static boolean isOnBoard(Position p) {
        return p != null && p.onBoard();
    }

    /** 读取该点的棋子；空格或越界返回 null */
    public Piece at(Position p) {
        return isOnBoard(p) ? grid[p.row()][p.col()] : null;
    }

    public Piece at(int row, int col) {
        return at(Position.of(row, col));
    }

    /** 棋盘内且无子 */
    public boolean isEmpty(Position p) {
        return isOnBoard(p) && grid[p.row()][p.col()] == null;
    }

    /**
     * 返回在 p 放置 piece（null 表示清空）后的新棋盘。
     *
     * @throws IllegalArgumentException p 越界
     */
    public Board withPiece(Position p, Piece piece) {
        if (!isOnBoard(p)) throw new IllegalArgumentException("OFF_BOARD: " + p);
        Piece[][] g = copyGrid();
        g[p.row()][p.col()] = piece;
        return new Board(g);
    }

    /**
     * 返回 from 上的棋子移到 to 之后的新棋盘：to 原有棋子（若有）被丢弃，from 置空。
     * 普通移动与吃子都走这里。不做合法性校验，由规则层保证。
     */
    public Board withPieceMoved(Position from, Position to) {
        if (!isOnBoard(from) || !isOnBoard(to)) {
            throw new IllegalArgumentException("OFF_BOARD: " + from + " -> " + to);
        }
        Piece[][] g = copyGrid();
        g[to.row()][to.col()] = g[from.row()][from.col()];
        g[from.row()][from.col()] = null;
        return new Board(g);
    }

    /** 对每个非空格应用 fn（返回 null 即移除该子），用于整盘结算 */
    public Board map(UnaryOperator<Piece> fn) {
        Piece[][] g = new Piece[SIZE][SIZE];
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                Piece p = grid[r][c];
                g[r][c] = (p == null) ? null : fn.apply(p);
            }
        }
        return new Board(g);
    }

    /** 所有有子的格子（行优先） */
    public List<Position> occupied() {
        List<Position> out = new ArrayList<>();
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                if (grid[r][c] != null) out.add(Position.of(r, c));
            }
        }
        return out;
    }

    /** 返回一个只读视图副本（用于序列化给前端/日志） */
    public Piece[][] view() {
        return copyGrid();
    }

    /** 从二维数组构造（会复制一份；长度必须为 8x8） */
    public static Board of(Piece[][] cells) {
        if (cells == null || cells.length != SIZE) {
            throw new IllegalArgumentException("board must have " + SIZE + " rows");
        }
        Piece[][] g = new Piece[SIZE][];
        for (int r = 0; r < SIZE; r++) {
            if (cells[r] == null || cells[r].length != SIZE) {
                throw new IllegalArgumentException("row " + r + " must have " + SIZE + " columns");
            }
            g[r] = cells[r].clone();
        }
        return new Board(g);
    }

    private Piece[][] copyGrid() {
        Piece[][] g = new Piece[SIZE][];
        for (int r = 0; r < SIZE; r++) g[r] = grid[r].clone();
        return g;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(SIZE * (SIZE + 1));
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                Piece p = grid[r][c];
                if (p == null) {
                    sb.append('.');
                } else {
                    char ch = p.kind() == ASSASSIN ? 'x' : p.kind().code().charAt(0);
                    sb.append(p.color() == WHITE ? Character.toUpperCase(ch) : ch);
                }
            }
            if (r < SIZE - 1) sb.append('/');
        }
        return sb.toString();
    }
}
