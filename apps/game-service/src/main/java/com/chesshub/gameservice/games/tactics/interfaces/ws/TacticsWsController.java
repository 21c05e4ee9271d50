package com.chesshub.gameservice.games.tactics.interfaces.ws;

import com.chesshub.gameservice.games.tactics.domain.dto.BoardCodec;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsState;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.*;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import com.chesshub.gameservice.games.tactics.service.TacticsService.ClickReport;
import com.chesshub.gameservice.games.tactics.service.TacticsService.JoinResult;
import com.chesshub.gameservice.games.tactics.service.TacticsService.RelayResult;
import com.chesshub.gameservice.games.tactics.service.TacticsService.SeatGrant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages.*;

/**
 * 战术棋 WebSocket 控制器
 * ----------------------------------------
 * 负责接收前端通过 STOMP 发送的指令（/app/tactics.*），
 * 并通过 SimpMessagingTemplate 回复调用方或广播到 /topic/room.{roomId}。
 *
 * 两条路径并存：
 *   1. 中继：submit / result 信任发送方，整盘快照原样转发给对手；
 *   2. 服务端规则：click / reset 由服务端 TacticsState 计算并广播。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class TacticsWsController {

    /** 点对点回复目的地（前端订阅 /user/queue/...） */
    static final String Q_CREATED = "/queue/tactics.created";
    static final String Q_JOINED = "/queue/tactics.joined";
    static final String Q_EVENTS = "/queue/tactics.events";
    static final String Q_ERROR = "/queue/tactics.error";

    private final TacticsService tacticsService;
    private final SimpMessagingTemplate messaging;

    /** 新建联机房间，调用方执白 */
    @MessageMapping("/tactics.create")
    public void create(SimpMessageHeaderAccessor sha) {
        final String userId = userOf(sha);
        SeatGrant grant = tacticsService.createRoom(userId);
        messaging.convertAndSendToUser(userId, Q_CREATED, new SeatReply(grant.roomId(), grant.color().code()));
    }

    /** 新建本地（同屏）房间 */
    @MessageMapping("/tactics.local")
    public void local(SimpMessageHeaderAccessor sha) {
        final String userId = userOf(sha);
        SeatGrant grant = tacticsService.createLocalRoom(userId);
        messaging.convertAndSendToUser(userId, Q_CREATED, new SeatReply(grant.roomId(), grant.color().code()));
    }

    /**
     * 加入房间：调用方执黑，成功后广播 GAME_START。
     * 失败只通知加入者本人。
     */
    @MessageMapping("/tactics.join")
    public void join(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userOf(sha);
        try {
            JoinResult jr = tacticsService.joinRoom(cmd.getRoomId(), userId);
            messaging.convertAndSendToUser(userId, Q_JOINED, new SeatReply(jr.roomId(), jr.color().code()));
            broadcast(jr.roomId(), GAME_START, new GameStart(jr.whitePlayer(), jr.blackPlayer()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(userId, cmd.getRoomId(), e.getMessage());
        }
    }

    /**
     * 中继一步：用上报的整盘快照替换房间棋盘，并转发 OPPONENT_MOVE 给对手。
     * 对局已结束时静默丢弃。
     */
    @MessageMapping("/tactics.submit")
    public void submit(SubmitCmd cmd, SimpMessageHeaderAccessor sha) {
        final String roomId = cmd.getRoomId();
        final String userId = userOf(sha);
        try {
            Board board = BoardCodec.decode(cmd.getBoard());
            PieceColor next = PieceColor.fromCode(cmd.getCurrentPlayer());
            RelayResult relay = tacticsService.submitAction(roomId, userId, board, next);
            if (!relay.applied() || relay.forwardTo() == null) {
                return;
            }
            BroadcastEvent evt = new BroadcastEvent(roomId, OPPONENT_MOVE,
                    new OpponentMove(BoardCodec.encode(board), next.code()));
            messaging.convertAndSendToUser(relay.forwardTo(), Q_EVENTS, evt);
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(userId, roomId, e.getMessage());
        }
    }

    /** 上报胜负并广播 GAME_OVER */
    @MessageMapping("/tactics.result")
    public void result(ResultCmd cmd, SimpMessageHeaderAccessor sha) {
        final String roomId = cmd.getRoomId();
        final String userId = userOf(sha);
        try {
            PieceColor winner = tacticsService.announceResult(roomId, userId, PieceColor.fromCode(cmd.getWinner()));
            broadcast(roomId, GAME_OVER, new GameOver(winner.code()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(userId, roomId, e.getMessage());
        }
    }

    /**
     * 服务端规则引擎点击：
     *   - 选中 / 取消选中 → SELECTION；
     *   - 完成一步 → STATE，吃王时追加 GAME_OVER；
     *   - 无效点击不推送。
     */
    @MessageMapping("/tactics.click")
    public void click(ClickCmd cmd, SimpMessageHeaderAccessor sha) {
        final String roomId = cmd.getRoomId();
        final String userId = userOf(sha);
        try {
            ClickReport report = tacticsService.click(roomId, userId, Position.of(cmd.getRow(), cmd.getCol()));
            TacticsState s = report.state();
            switch (report.result()) {
                case SELECTED -> broadcast(roomId, SELECTION, toSelectionPayload(s.selection()));
                case CLEARED -> broadcast(roomId, SELECTION, new SelectionPayload(null, List.of(), List.of()));
                case MOVED, CAPTURED -> {
                    broadcast(roomId, STATE, toStatePayload(s));
                    if (s.over()) {
                        broadcast(roomId, GAME_OVER, new GameOver(s.winner().code()));
                    }
                }
                case IGNORED -> log.debug("忽略点击: roomId={}, user={}, pos=({},{})",
                        roomId, userId, cmd.getRow(), cmd.getCol());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(userId, roomId, e.getMessage());
        }
    }

    /** 重置为标准开局并广播 STATE */
    @MessageMapping("/tactics.reset")
    public void reset(RoomCmd cmd, SimpMessageHeaderAccessor sha) {
        final String roomId = cmd.getRoomId();
        final String userId = userOf(sha);
        try {
            TacticsState s = tacticsService.reset(roomId, userId);
            broadcast(roomId, STATE, toStatePayload(s));
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(userId, roomId, e.getMessage());
        }
    }

    // ----------- helpers -----------

    static StatePayload toStatePayload(TacticsState s) {
        return new StatePayload(
                BoardCodec.encode(s.board()),
                s.current().code(),
                s.winner() == null ? null : s.winner().code(),
                s.lastAction());
    }

    static SelectionPayload toSelectionPayload(Selection sel) {
        return new SelectionPayload(sel.origin(), sorted(sel.moves()), sorted(sel.attacks()));
    }

    /** 行优先排序，保证推送顺序稳定 */
    private static List<Position> sorted(Iterable<Position> ps) {
        List<Position> out = new ArrayList<>();
        ps.forEach(out::add);
        out.sort(Comparator.comparingInt(Position::row).thenComparingInt(Position::col));
        return out;
    }

    private static String userOf(SimpMessageHeaderAccessor sha) {
        return Objects.requireNonNull(sha.getUser(), "user is null").getName();
    }

    private static String topic(String roomId) {
        return "/topic/room." + roomId;
    }

    private void broadcast(String roomId, String type, Object payload) {
        messaging.convertAndSend(topic(roomId), new BroadcastEvent(roomId, type, payload));
    }

    private void sendError(String userId, String roomId, String msg) {
        log.warn("请求被拒绝: roomId={}, user={}, reason={}", roomId, userId, msg);
        messaging.convertAndSendToUser(userId, Q_ERROR, new BroadcastEvent(roomId, ERROR, msg));
    }
}
