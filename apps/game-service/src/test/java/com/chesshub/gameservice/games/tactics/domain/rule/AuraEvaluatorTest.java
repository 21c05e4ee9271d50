package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import org.junit.jupiter.api.Test;

import static com.chesshub.gameservice.games.tactics.domain.model.PieceColor.BLACK;
import static com.chesshub.gameservice.games.tactics.domain.model.PieceColor.WHITE;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AuraEvaluatorTest {

    @Test
    void shouldGrantBonusFromAdjacentFriendlyBard() {
        Board b = Board.empty().withPiece(Position.of(3, 3), Piece.of(PieceKind.BARD, WHITE));
        assertEquals(1, AuraEvaluator.bardBonus(b, Position.of(4, 4), WHITE));
        assertEquals(1, AuraEvaluator.bardBonus(b, Position.of(2, 2), WHITE));
        assertEquals(0, AuraEvaluator.bardBonus(b, Position.of(5, 5), WHITE));
    }

    @Test
    void shouldCountSquareItselfAndIgnoreEnemyBards() {
        Board b = Board.empty().withPiece(Position.of(0, 0), Piece.of(PieceKind.BARD, BLACK));
        assertEquals(1, AuraEvaluator.bardBonus(b, Position.of(0, 0), BLACK));
        assertEquals(0, AuraEvaluator.bardBonus(b, Position.of(0, 1), WHITE));
    }

    @Test
    void shouldNotStackMultipleBards() {
        Board b = Board.empty()
                .withPiece(Position.of(3, 3), Piece.of(PieceKind.BARD, WHITE))
                .withPiece(Position.of(5, 5), Piece.of(PieceKind.BARD, WHITE));
        assertEquals(1, AuraEvaluator.bardBonus(b, Position.of(4, 4), WHITE));
    }

    @Test
    void shouldIgnoreOtherFriendlyKinds() {
        Board b = Board.initial();
        // (6,3) 周围是白方圣骑士、枪兵、法师，没有诗人
        assertEquals(0, AuraEvaluator.bardBonus(b, Position.of(6, 3), WHITE));
        assertEquals(1, AuraEvaluator.bardBonus(b, Position.of(6, 2), WHITE));
    }
}
