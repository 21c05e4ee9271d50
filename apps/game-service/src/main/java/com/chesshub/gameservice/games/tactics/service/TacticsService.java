package com.chesshub.gameservice.games.tactics.service;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.ClickResult;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsSnapshot;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsState;

import java.util.List;

public interface TacticsService {

    /** createSession()：新建联机房间，调用方执白 */
    SeatGrant createRoom(String participantId);

    /** 新建本地房间：调用方一人执双方，创建即开局 */
    SeatGrant createLocalRoom(String participantId);

    /**
     * joinSession(id)：调用方执黑入座并开局。
     * @throws IllegalStateException 房间不存在、已满或不是联机房间
     */
    JoinResult joinRoom(String roomId, String participantId);

    /**
     * submitAction：用调用方上报的整盘快照替换房间棋盘（不校验合法性、不合并），
     * 并告知应转发给谁。对局已结束时不生效。
     */
    RelayResult submitAction(String roomId, String participantId, Board board, PieceColor nextToMove);

    /**
     * announceResult：记录胜方并结束对局。
     * @return 最终胜方（已有胜方时保持原值）
     */
    PieceColor announceResult(String roomId, String participantId, PieceColor winner);

    /**
     * 由服务端规则引擎处理一次点击（选中 / 移动 / 吃子）。
     * 非当前执子方的点击静默忽略。
     */
    ClickReport click(String roomId, String participantId, Position pos);

    /** 重置为标准开局 */
    TacticsState reset(String roomId, String participantId);

    /** 只读查询某格棋子的可移动/可攻击集合，不改变选中状态 */
    Selection reach(String roomId, Position pos);

    /** 只读获取当前对局状态（副本） */
    TacticsState getState(String roomId);

    /** 房间的只读快照 */
    TacticsSnapshot snapshot(String roomId);

    /** 大厅：等待黑方加入的联机房间，按创建时间倒序 */
    List<TacticsSnapshot> openRooms(int limit);

    /**
     * participantLeft：参与者断线，丢弃其所在的全部房间。
     * @return 被丢弃的房间ID
     */
    List<String> leaveAll(String participantId);

    record SeatGrant(String roomId, PieceColor color) {}

    record JoinResult(String roomId, PieceColor color, String whitePlayer, String blackPlayer) {}

    /** applied=false 表示对局已结束、快照被丢弃；forwardTo 为对方参与者（可能为 null） */
    record RelayResult(boolean applied, String forwardTo) {}

    record ClickReport(ClickResult result, TacticsState state) {}
}
