package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.ActionType;
import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;

/**
 * 回合结算：执行一次移动/吃子并完成回合末的状态更新。
 *
 * 结算顺序固定：
 * 1. 棋子从 from 移到 to（吃子时目标被丢弃）；
 * 2. 行动棋子的自身状态：勇士姿态 +1（mod 3）；法师吃子后冷却置 2（普通移动不改冷却）；
 * 3. 全盘冷却衰减：双方所有冷却 &gt; 0 的法师各减 1（含刚刚攻击的法师）；
 * 4. 若被吃的是王，记录行动方为胜者。
 * 换手由上层（TacticsState）负责，对局结束时不换手。
 */
public final class TurnController {

    private TurnController() {
    }

    /**
     * 按显式意图 (from, to) 结算；to 不在可达集合内则返回 REJECTED 与原棋盘。
     */
    public static TurnOutcome resolve(Board b, Position from, Position to) {
        if (b.at(from) == null) return TurnOutcome.rejected(b);
        return perform(b, Reachability.select(b, from), to);
    }

    /**
     * 用选中时缓存的可达集合结算。攻击集合优先于移动集合判断
     * （王的移动集合也包含敌子格，此时按吃子处理）。
     */
    public static TurnOutcome perform(Board b, Selection sel, Position to) {
        Position from = sel.origin();
        Piece actor = b.at(from);
        if (actor == null) return TurnOutcome.rejected(b);

        if (sel.canAttack(to)) {
            Piece target = b.at(to);
            if (target == null || !target.isEnemyOf(actor.color())) {
                return TurnOutcome.rejected(b);
            }
            Board next = settle(b.withPieceMoved(from, to), to, afterCapture(actor));
            return new TurnOutcome(next, ActionType.CAPTURE, target,
                    target.is(PieceKind.KING) ? actor.color() : null);
        }
        if (sel.canMoveTo(to)) {
            Board next = settle(b.withPieceMoved(from, to), to, afterMove(actor));
            return new TurnOutcome(next, ActionType.MOVE, null, null);
        }
        return TurnOutcome.rejected(b);
    }

    /**
     * 全盘冷却衰减：每个冷却中的法师（不分颜色）冷却 -1。
     */
    public static Board decayCooldowns(Board b) {
        return b.map(p -> p.recovering() ? p.withCooldown(p.cooldown() - 1) : p);
    }

    // ----------- private helpers -----------

    private static Board settle(Board moved, Position landing, Piece updatedActor) {
        return decayCooldowns(moved.withPiece(landing, updatedActor));
    }

    private static Piece afterMove(Piece actor) {
        return actor.is(PieceKind.WARRIOR) ? actor.withStance(actor.stance().next()) : actor;
    }

    private static Piece afterCapture(Piece actor) {
        if (actor.is(PieceKind.MAGE)) return actor.withCooldown(Piece.MAGE_COOLDOWN);
        return afterMove(actor);
    }
}
