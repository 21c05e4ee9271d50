package com.chesshub.gameservice.games.tactics.interfaces.http;

import com.chesshub.gameservice.games.tactics.domain.model.TacticsSnapshot;
import com.chesshub.gameservice.games.tactics.interfaces.http.dto.RoomSummary;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import com.chesshub.web.common.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 战术棋大厅 - 等待加入的联机房间列表（仅用于大厅展示）
 *
 * 暂不做鉴权，前端可直接调用。
 */
@RestController
@RequestMapping("/api/tactics/rooms")
public class RoomListController {

    private final TacticsService svc;
    private final int maxLimit;

    public RoomListController(TacticsService svc,
                              @Value("${tactics.lobby.limit:20}") int maxLimit) {
        this.svc = svc;
        this.maxLimit = maxLimit;
    }

    /**
     * @param limit 返回数量，超过配置上限时按上限截断
     * @return 按创建时间倒序的房间列表
     */
    @GetMapping
    public ApiResponse<List<RoomSummary>> list(@RequestParam(value = "limit", required = false) Integer limit) {
        int n = (limit == null || limit <= 0) ? maxLimit : Math.min(limit, maxLimit);
        List<TacticsSnapshot> open = svc.openRooms(n);
        return ApiResponse.success(open.stream().map(RoomSummary::from).toList());
    }
}
