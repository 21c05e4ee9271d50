package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.ActionType;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;

/**
 * 一次行动的结算结果。
 *
 * @param board    结算后的棋盘（被拒绝时为原棋盘）
 * @param type     MOVE / CAPTURE / REJECTED
 * @param captured 被吃掉的棋子；非吃子为 null
 * @param winner   吃掉对方王时为行动方，否则为 null
 */
public record TurnOutcome(Board board, ActionType type, Piece captured, PieceColor winner) {

    static TurnOutcome rejected(Board board) {
        return new TurnOutcome(board, ActionType.REJECTED, null, null);
    }

    public boolean accepted() {
        return type != ActionType.REJECTED;
    }

    public boolean decisive() {
        return winner != null;
    }
}
