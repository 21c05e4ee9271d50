package com.chesshub.gameservice.games.tactics.domain.model;

import com.chesshub.gameservice.games.tactics.domain.dto.BoardCodec;
import com.chesshub.gameservice.games.tactics.domain.dto.PieceView;

import java.util.List;

/**
 * Read-only snapshot of a tactics room (room view / lobby).
 */
public final class TacticsSnapshot {

    public final String roomId;
    public final String mode;
    public final String phase;
    public final String whitePlayer;
    public final String blackPlayer;
    public final long createdAt;
    public final List<List<PieceView>> board;
    public final String currentPlayer;
    /** 胜方颜色；未结束为 null */
    public final String winner;
    public final Action lastAction;

    private TacticsSnapshot(Room room, TacticsState s) {
        this.roomId = room.getId();
        this.mode = room.getMode().name();
        this.phase = room.getPhase().name();
        this.whitePlayer = room.getWhiteParticipant();
        this.blackPlayer = room.getBlackParticipant();
        this.createdAt = room.getCreatedAt();
        this.board = BoardCodec.encode(s.board());
        this.currentPlayer = s.current().code();
        this.winner = s.winner() == null ? null : s.winner().code();
        this.lastAction = s.lastAction();
    }

    /** 调用方需持有 room 的锁 */
    public static TacticsSnapshot of(Room room) {
        return new TacticsSnapshot(room, room.getState().copy());
    }
}
