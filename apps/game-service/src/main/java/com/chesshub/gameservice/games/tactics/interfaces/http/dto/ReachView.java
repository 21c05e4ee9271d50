package com.chesshub.gameservice.games.tactics.interfaces.http.dto;

import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 可达查询结果（行优先排序）
 */
public record ReachView(Position origin, List<Position> moves, List<Position> attacks) {

    private static final Comparator<Position> ROW_MAJOR =
            Comparator.comparingInt(Position::row).thenComparingInt(Position::col);

    public static ReachView from(Selection sel) {
        return new ReachView(sel.origin(), sort(sel.moves()), sort(sel.attacks()));
    }

    private static List<Position> sort(Set<Position> ps) {
        return ps.stream().sorted(ROW_MAJOR).toList();
    }
}
