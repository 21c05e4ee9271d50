package com.chesshub.gameservice.games.tactics.domain.dto;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Stance;

import java.util.ArrayList;
import java.util.List;

/**
 * Board ⇄ 传输格式（board[row][col]，空格为 null）的互转。
 * 只校验格式（尺寸、种类、颜色、状态值），不校验局面是否合法。
 */
public final class BoardCodec {

    private BoardCodec() {
    }

    public static List<List<PieceView>> encode(Board b) {
        List<List<PieceView>> rows = new ArrayList<>(Board.SIZE);
        for (int r = 0; r < Board.SIZE; r++) {
            List<PieceView> row = new ArrayList<>(Board.SIZE);
            for (int c = 0; c < Board.SIZE; c++) {
                row.add(encode(b.at(r, c)));
            }
            rows.add(row);
        }
        return rows;
    }

    public static PieceView encode(Piece p) {
        if (p == null) return null;
        Integer state = switch (p.kind()) {
            case WARRIOR -> p.stance().ordinal();
            case MAGE -> p.cooldown();
            default -> null;
        };
        return new PieceView(p.kind().code(), p.color().code(), state);
    }

    /**
     * @throws IllegalArgumentException 尺寸不是 8x8，或棋子字段无法识别
     */
    public static Board decode(List<List<PieceView>> rows) {
        if (rows == null || rows.size() != Board.SIZE) {
            throw new IllegalArgumentException(TacticsMessages.MALFORMED_BOARD);
        }
        Piece[][] cells = new Piece[Board.SIZE][Board.SIZE];
        for (int r = 0; r < Board.SIZE; r++) {
            List<PieceView> row = rows.get(r);
            if (row == null || row.size() != Board.SIZE) {
                throw new IllegalArgumentException(TacticsMessages.MALFORMED_BOARD);
            }
            for (int c = 0; c < Board.SIZE; c++) {
                cells[r][c] = decode(row.get(c));
            }
        }
        return Board.of(cells);
    }

    public static Piece decode(PieceView v) {
        if (v == null) return null;
        PieceKind kind = PieceKind.fromCode(v.getType());
        PieceColor color = PieceColor.fromCode(v.getColor());
        int state = v.getState() == null ? 0 : v.getState();
        return switch (kind) {
            case WARRIOR -> Piece.warrior(color, Stance.ofValue(state));
            case MAGE -> Piece.mage(color, state);
            // 其余种类的 state 无意义，直接忽略
            default -> Piece.of(kind, color);
        };
    }
}
