package com.chesshub.gameservice.games.tactics.domain.constants;

/**
 * 战术棋相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class TacticsMessages {

    private TacticsMessages() {
        // 工具类，禁止实例化
    }

    // ========== 房间相关消息 ==========

    /** 加入失败：房间不存在或已满 */
    public static final String ROOM_NOT_FOUND_OR_FULL = "房间不存在或已满";

    /** 房间不存在 */
    public static final String ROOM_NOT_FOUND = "房间不存在";

    /** 不是房间内的玩家 */
    public static final String NOT_A_PARTICIPANT = "你不是该房间的玩家";

    /** 对手断开连接 */
    public static final String OPPONENT_LEFT = "对方已断开连接";

    // ========== 对局状态消息 ==========

    /** 等待对手加入 */
    public static final String WAITING_FOR_OPPONENT = "等待对手加入";

    // ========== 错误消息 ==========

    /** 棋盘数据格式错误 */
    public static final String MALFORMED_BOARD = "棋盘数据格式错误";

    /** 坐标越界 */
    public static final String OFF_BOARD = "坐标超出棋盘范围";
}
