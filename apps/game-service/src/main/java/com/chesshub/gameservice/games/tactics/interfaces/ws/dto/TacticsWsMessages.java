package com.chesshub.gameservice.games.tactics.interfaces.ws.dto;

import com.chesshub.gameservice.games.tactics.domain.dto.PieceView;
import com.chesshub.gameservice.games.tactics.domain.model.Action;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 -> 后端：*Cmd（发往 /app/tactics.*）
 * 后端 -> 前端：BroadcastEvent（/topic/room.{roomId}）及点对点回复（/user/queue/tactics.*）
 */
public class TacticsWsMessages {

    /** 事件类型 */
    public static final String GAME_START = "GAME_START";
    public static final String OPPONENT_MOVE = "OPPONENT_MOVE";
    public static final String GAME_OVER = "GAME_OVER";
    public static final String PLAYER_LEFT = "PLAYER_LEFT";
    public static final String SELECTION = "SELECTION";
    public static final String STATE = "STATE";
    public static final String ERROR = "ERROR";

    /**
     * 只带房间号的命令：join / reset
     */
    @Data
    public static class RoomCmd {
        private String roomId;
    }

    /**
     * 上报整盘快照（信任发送方，不做合法性校验）。
     *   - board        ：board[row][col]，空格为 null；
     *   - currentPlayer：下一手执子方 "white" / "black"。
     */
    @Data
    public static class SubmitCmd {
        private String roomId;
        private List<List<PieceView>> board;
        private String currentPlayer;
    }

    /** 上报胜负 */
    @Data
    public static class ResultCmd {
        private String roomId;
        private String winner;
    }

    /** 服务端规则引擎的点击 */
    @Data
    public static class ClickCmd {
        private String roomId;
        private int row;
        private int col;
    }

    /**
     * 广播事件（服务端 → 客户端）
     *   - type   ：GAME_START / OPPONENT_MOVE / GAME_OVER / PLAYER_LEFT / SELECTION / STATE / ERROR；
     *   - payload：事件内容。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String roomId;
        private String type;
        private Object payload;
    }

    /** 创建 / 加入成功后的点对点回复 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeatReply {
        private String roomId;
        private String color;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameStart {
        private String whitePlayer;
        private String blackPlayer;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OpponentMove {
        private List<List<PieceView>> board;
        private String currentPlayer;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameOver {
        private String winner;
    }

    /** 选中后的可移动 / 可攻击格子，供前端高亮 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SelectionPayload {
        private Position origin;
        private List<Position> moves;
        private List<Position> attacks;
    }

    /**
     * 完整对局状态（点击完成一步或重置后广播）
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StatePayload {
        private List<List<PieceView>> board;
        private String currentPlayer;
        private String winner;
        private Action lastAction;
    }
}
