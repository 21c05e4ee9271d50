package com.chesshub.gameservice.games.tactics.interfaces.http;

import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;
import com.chesshub.gameservice.games.tactics.domain.model.TacticsSnapshot;
import com.chesshub.gameservice.games.tactics.interfaces.http.dto.ReachView;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import com.chesshub.web.common.ApiResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 战术棋 http 只读查询接口
 */
@Validated
@RestController
@RequestMapping("/api/tactics/rooms/{roomId}")
@RequiredArgsConstructor
public class TacticsRestController {

    private final TacticsService svc;

    /** 房间快照：棋盘、执子方、胜方、座位、模式 */
    @GetMapping("/view")
    public ApiResponse<TacticsSnapshot> view(@PathVariable("roomId") String roomId) {
        return ApiResponse.success(svc.snapshot(roomId));
    }

    /**
     * 查询某格棋子的可移动 / 可攻击格子，不影响房间内的选中状态。
     * 空格返回两个空集合。
     */
    @GetMapping("/reach")
    public ApiResponse<ReachView> reach(@PathVariable("roomId") String roomId,
                                        @RequestParam("row") @Min(0) @Max(7) int row,
                                        @RequestParam("col") @Min(0) @Max(7) int col) {
        Selection sel = svc.reach(roomId, Position.of(row, col));
        return ApiResponse.success(ReachView.from(sel));
    }
}
