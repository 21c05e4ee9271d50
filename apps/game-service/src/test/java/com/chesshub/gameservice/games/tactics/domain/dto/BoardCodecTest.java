package com.chesshub.gameservice.games.tactics.domain.dto;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Stance;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoardCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldEncodeAuxiliaryStateAsWireInteger() {
        List<List<PieceView>> rows = BoardCodec.encode(Board.initial());

        assertEquals(new PieceView("mage", "black", 2), rows.get(0).get(3));
        assertEquals(new PieceView("warrior", "white", 0), rows.get(7).get(0));
        assertEquals(new PieceView("king", "white", null), rows.get(7).get(5));
        assertNull(rows.get(4).get(4));
    }

    @Test
    void shouldOmitStateForPlainPiecesInJson() throws Exception {
        String json = mapper.writeValueAsString(new PieceView("king", "black", null));
        assertEquals("{\"type\":\"king\",\"color\":\"black\"}", json);
    }

    @Test
    void shouldDecodeBoardSentByClient() throws Exception {
        String json = mapper.writeValueAsString(BoardCodec.encode(Board.initial()));
        List<List<PieceView>> rows = mapper.readValue(json, new TypeReference<>() {});

        assertEquals(Board.initial(), BoardCodec.decode(rows));
    }

    @Test
    void shouldReadStanceAndCooldownFromState() {
        assertEquals(Piece.warrior(PieceColor.BLACK, Stance.STRONG_STRIKE),
                BoardCodec.decode(new PieceView("warrior", "black", 2)));
        assertEquals(Piece.mage(PieceColor.WHITE, 1),
                BoardCodec.decode(new PieceView("mage", "white", 1)));
        assertEquals(Piece.of(PieceKind.ARCHER, PieceColor.WHITE),
                BoardCodec.decode(new PieceView("archer", "white", 5)));
    }

    @Test
    void shouldRejectMalformedBoards() {
        assertThrows(IllegalArgumentException.class, () -> BoardCodec.decode((List<List<PieceView>>) null));
        assertThrows(IllegalArgumentException.class, () -> BoardCodec.decode(new ArrayList<>()));

        List<List<PieceView>> rows = BoardCodec.encode(Board.empty());
        rows.get(3).remove(0);
        assertThrows(IllegalArgumentException.class, () -> BoardCodec.decode(rows));
    }

    @Test
    void shouldDecodeEmptyCellAsNoPiece() {
        assertNull(BoardCodec.decode((PieceView) null));
    }

    @Test
    void shouldRejectUnknownPieceFields() {
        assertThrows(IllegalArgumentException.class,
                () -> BoardCodec.decode(new PieceView("queen", "white", null)));
        assertThrows(IllegalArgumentException.class,
                () -> BoardCodec.decode(new PieceView("king", "red", null)));
        assertThrows(IllegalArgumentException.class,
                () -> BoardCodec.decode(new PieceView("warrior", "white", 3)));
    }

    @Test
    void shouldKeepEmptySquaresEmpty() {
        Board b = BoardCodec.decode(BoardCodec.encode(Board.empty()));
        assertTrue(b.occupied().isEmpty());
    }
}
