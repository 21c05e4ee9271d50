package com.chesshub.gameservice.games.tactics.interfaces.http.dto;

import com.chesshub.gameservice.games.tactics.domain.model.TacticsSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 大厅房间列表的单行摘要。
 * HTTP 层专用 DTO，从 TacticsSnapshot 映射而来（不带棋盘）。
 */
@Data
@AllArgsConstructor
public class RoomSummary {
    private String roomId;
    private String ownerId;
    private String phase;
    private long createdAt;

    public static RoomSummary from(TacticsSnapshot snap) {
        return new RoomSummary(snap.roomId, snap.whitePlayer, snap.phase, snap.createdAt);
    }
}
