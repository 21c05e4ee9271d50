package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Position;

/**
 * 吟游诗人光环判定。
 * 以 pos 为中心的 3x3 范围（含 pos 本身）内只要有一个己方吟游诗人，移动半径 +1。
 * 光环只影响移动半径，从不影响攻击半径；多个诗人不叠加。
 */
public final class AuraEvaluator {

    private AuraEvaluator() {
    }

    /**
     * @return 0 或 1
     */
    public static int bardBonus(Board b, Position pos, PieceColor color) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                Piece p = b.at(pos.offset(dr, dc)); // 越界返回 null
                if (p != null && p.is(PieceKind.BARD) && p.color() == color) {
                    return 1;
                }
            }
        }
        return 0;
    }
}
