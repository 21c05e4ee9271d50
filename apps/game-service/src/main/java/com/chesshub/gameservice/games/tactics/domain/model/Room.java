package com.chesshub.gameservice.games.tactics.domain.model;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;
import com.chesshub.gameservice.games.tactics.domain.enums.Mode;
import com.chesshub.gameservice.games.tactics.domain.enums.RoomPhase;
import lombok.Getter;

/**
 *  游戏房间实体：一局对局 + 两个座位。
 *  所有读写都应在 synchronized (room) 内进行，由服务层保证。
 */
@Getter
public class Room {

    // ---- 基本信息 ----
    private final String id;
    private final Mode mode;
    private final long createdAt;

    // ---- 座位（参与者ID） ----
    private final String whiteParticipant;
    private String blackParticipant;

    // ---- 对局 ----
    private final TacticsState state = new TacticsState();
    private RoomPhase phase;

    public Room(String id, Mode mode, String ownerId) {
        this.id = id;
        this.mode = mode;
        this.whiteParticipant = ownerId;
        this.createdAt = System.currentTimeMillis();
        // 本地房间房主一人执双方，创建即开局
        if (mode == Mode.LOCAL) {
            this.blackParticipant = ownerId;
            this.phase = RoomPhase.PLAYING;
        } else {
            this.phase = RoomPhase.WAITING;
        }
    }

    /** 房主（执白） */
    public String getOwnerId() {
        return whiteParticipant;
    }

    public boolean isFull() {
        return blackParticipant != null;
    }

    public boolean isParticipant(String participantId) {
        return participantId != null
                && (participantId.equals(whiteParticipant) || participantId.equals(blackParticipant));
    }

    /** 黑方入座并开局 */
    public void seatBlack(String participantId) {
        this.blackParticipant = participantId;
        this.phase = RoomPhase.PLAYING;
    }

    /**
     * 参与者可操作的颜色；本地房间返回 null 表示双方皆可。
     *
     * @throws IllegalStateException 不是该房间的参与者
     */
    public PieceColor sideOf(String participantId) {
        if (!isParticipant(participantId)) {
            throw new IllegalStateException(TacticsMessages.NOT_A_PARTICIPANT);
        }
        if (mode == Mode.LOCAL) return null;
        return participantId.equals(whiteParticipant) ? PieceColor.WHITE : PieceColor.BLACK;
    }

    /** 对方参与者；本地房间或对方未入座时为 null */
    public String opponentOf(String participantId) {
        if (mode == Mode.LOCAL) return null;
        return participantId.equals(whiteParticipant) ? blackParticipant : whiteParticipant;
    }

    public void markEnded() {
        this.phase = RoomPhase.ENDED;
    }

    public void markPlaying() {
        this.phase = RoomPhase.PLAYING;
    }

    public void markWaiting() {
        this.phase = RoomPhase.WAITING;
    }
}
