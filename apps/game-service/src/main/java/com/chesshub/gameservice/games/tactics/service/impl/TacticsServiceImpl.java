package com.chesshub.gameservice.games.tactics.service.impl;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;
import com.chesshub.gameservice.games.tactics.domain.enums.Mode;
import com.chesshub.gameservice.games.tactics.domain.enums.RoomPhase;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.ClickResult;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Room;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsSnapshot;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsState;
import com.chesshub.gameservice.games.tactics.domain.rule.Reachability;
import com.chesshub.gameservice.games.tactics.service.RoomNotFoundException;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;


@Slf4j
@Service
public class TacticsServiceImpl implements TacticsService {

    // ====== 内存房间表（不持久化，进程内有效） ======
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    /** 房间ID长度 */
    private final int idLength;

    public TacticsServiceImpl(@Value("${tactics.room.id-length:8}") int idLength) {
        this.idLength = Math.max(4, idLength);
    }

    @Override
    public SeatGrant createRoom(String participantId) {
        Room r = register(Mode.ONLINE, participantId);
        log.info("创建联机房间: roomId={}, white={}", r.getId(), participantId);
        return new SeatGrant(r.getId(), PieceColor.WHITE);
    }

    @Override
    public SeatGrant createLocalRoom(String participantId) {
        Room r = register(Mode.LOCAL, participantId);
        log.info("创建本地房间: roomId={}, owner={}", r.getId(), participantId);
        return new SeatGrant(r.getId(), PieceColor.WHITE);
    }

    @Override
    public JoinResult joinRoom(String roomId, String participantId) {
        Room r = roomId == null ? null : rooms.get(roomId);
        if (r == null || r.getMode() != Mode.ONLINE) {
            log.warn("加入房间失败（不存在）: roomId={}, participant={}", roomId, participantId);
            throw new IllegalStateException(TacticsMessages.ROOM_NOT_FOUND_OR_FULL);
        }
        synchronized (r) {
            // 房间须仍在登记表中且处于等待阶段
            if (rooms.get(roomId) != r || r.getPhase() != RoomPhase.WAITING || r.getState().over()
                    || r.isFull() || r.getOwnerId().equals(participantId)) {
                log.warn("加入房间失败（不可加入）: roomId={}, participant={}", roomId, participantId);
                throw new IllegalStateException(TacticsMessages.ROOM_NOT_FOUND_OR_FULL);
            }
            r.seatBlack(participantId);
            log.info("玩家加入房间: roomId={}, black={}", roomId, participantId);
            return new JoinResult(roomId, PieceColor.BLACK, r.getWhiteParticipant(), r.getBlackParticipant());
        }
    }

    @Override
    public RelayResult submitAction(String roomId, String participantId, Board board, PieceColor nextToMove) {
        Room r = room(roomId);
        synchronized (r) {
            r.sideOf(participantId); // 仅校验身份
            boolean applied = r.getState().replaceFromRemote(board, nextToMove);
            if (!applied) {
                log.warn("对局已结束，丢弃上报的棋盘: roomId={}, participant={}", roomId, participantId);
                return new RelayResult(false, null);
            }
            log.debug("转发棋盘: roomId={}, from={}, next={}", roomId, participantId, nextToMove);
            return new RelayResult(true, r.opponentOf(participantId));
        }
    }

    @Override
    public PieceColor announceResult(String roomId, String participantId, PieceColor winner) {
        Room r = room(roomId);
        synchronized (r) {
            r.sideOf(participantId);
            TacticsState s = r.getState();
            s.declareWinner(winner);
            r.markEnded();
            log.info("对局结束（上报）: roomId={}, winner={}", roomId, s.winner());
            return s.winner();
        }
    }

    @Override
    public ClickReport click(String roomId, String participantId, Position pos) {
        Room r = room(roomId);
        synchronized (r) {
            PieceColor side = r.sideOf(participantId);
            TacticsState s = r.getState();
            if (r.getPhase() == RoomPhase.WAITING) {
                throw new IllegalStateException(TacticsMessages.WAITING_FOR_OPPONENT);
            }
            // 本地房间 side 为 null：双方皆可操作
            if (side != null && side != s.current()) {
                return new ClickReport(ClickResult.IGNORED, s.copy());
            }
            ClickResult result = s.click(pos);
            if (s.over() && r.getPhase() != RoomPhase.ENDED) {
                r.markEnded();
                log.info("对局结束（吃王）: roomId={}, winner={}", roomId, s.winner());
            }
            return new ClickReport(result, s.copy());
        }
    }

    @Override
    public TacticsState reset(String roomId, String participantId) {
        Room r = room(roomId);
        synchronized (r) {
            r.sideOf(participantId);
            r.getState().reset();
            // 未满员的房间重置后重新开放加入
            if (r.isFull()) r.markPlaying();
            else r.markWaiting();
            log.info("重置对局: roomId={}, by={}", roomId, participantId);
            return r.getState().copy();
        }
    }

    @Override
    public Selection reach(String roomId, Position pos) {
        if (!Board.isOnBoard(pos)) {
            throw new IllegalArgumentException(TacticsMessages.OFF_BOARD);
        }
        Room r = room(roomId);
        Board b;
        synchronized (r) {
            b = r.getState().board();
        }
        // Board 不可变，出锁后计算即可
        return Reachability.select(b, pos);
    }

    @Override
    public TacticsState getState(String roomId) {
        Room r = room(roomId);
        synchronized (r) {
            return r.getState().copy();
        }
    }

    @Override
    public TacticsSnapshot snapshot(String roomId) {
        Room r = room(roomId);
        synchronized (r) {
            return TacticsSnapshot.of(r);
        }
    }

    @Override
    public List<TacticsSnapshot> openRooms(int limit) {
        List<Room> open = new ArrayList<>();
        for (Room r : rooms.values()) {
            synchronized (r) {
                if (r.getMode() == Mode.ONLINE && r.getPhase() == RoomPhase.WAITING && !r.isFull()) open.add(r);
            }
        }
        open.sort(Comparator.comparingLong(Room::getCreatedAt).reversed());
        List<TacticsSnapshot> out = new ArrayList<>();
        for (Room r : open.subList(0, Math.min(Math.max(limit, 0), open.size()))) {
            synchronized (r) {
                out.add(TacticsSnapshot.of(r));
            }
        }
        return out;
    }

    @Override
    public List<String> leaveAll(String participantId) {
        List<String> discarded = new ArrayList<>();
        if (participantId == null) return discarded;
        rooms.forEach((id, r) -> {
            synchronized (r) {
                if (r.isParticipant(participantId) && rooms.remove(id, r)) {
                    discarded.add(id);
                    log.info("参与者断开，丢弃房间: roomId={}, participant={}", id, participantId);
                }
            }
        });
        return discarded;
    }

    // ----------- private helpers -----------

    /**
     * 获取房间，未命中抛 {@link RoomNotFoundException}
     */
    private Room room(String roomId) {
        Room r = roomId == null ? null : rooms.get(roomId);
        if (r == null) throw new RoomNotFoundException(roomId);
        return r;
    }

    /** 生成不重复的短 ID 并登记房间 */
    private Room register(Mode mode, String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalStateException(TacticsMessages.NOT_A_PARTICIPANT);
        }
        while (true) {
            String id = RandomStringUtils.randomAlphanumeric(idLength).toLowerCase(Locale.ROOT);
            Room r = new Room(id, mode, ownerId);
            if (rooms.putIfAbsent(id, r) == null) return r;
        }
    }
}
