package com.chesshub.gameservice.games.tactics.domain.rule;

import com.chesshub.gameservice.games.tactics.domain.model.Board;
import com.chesshub.gameservice.games.tactics.domain.model.Piece;
import com.chesshub.gameservice.games.tactics.domain.model.PieceColor;
import com.chesshub.gameservice.games.tactics.domain.model.PieceKind;
import com.chesshub.gameservice.games.tactics.domain.model.Position;
import com.chesshub.gameservice.games.tactics.domain.model.Selection;
import com.chesshub.gameservice.games.tactics.domain.model.Stance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import static com.chesshub.gameservice.games.tactics.domain.model.PieceKind.*;

/**
 * 核心规则：各棋子的可移动 / 可攻击格子计算。
 * 只包含纯判断逻辑，不修改棋盘。
 *
 * 通用约定：
 * - 移动目标必须为空格（王例外：空格或敌子均可）；
 * - 攻击目标必须是敌方棋子；
 * - 结果从不包含起点，从不越界；
 * - 范围类规则（王/勇士/圣骑士/诗人/法师移动）按切比雪夫距离枚举，中间有子不阻挡。
 */
public final class Reachability {

    /** 枪兵移动基础距离，也是其唯一的攻击距离 */
    private static final int SPEAR_REACH = 3;
    /** 弓兵攻击的欧氏距离上限（平方比较，避免浮点） */
    private static final int ARCHER_RANGE_SQ = 4 * 4;
    /** 圣骑士移动基础半径 / 攻击半径 */
    private static final int PALADIN_RADIUS = 2;

    private static final Map<PieceKind, PieceRule> RULES = new EnumMap<>(PieceKind.class);

    static {
        RULES.put(KING, new PieceRule(
                (b, from, p) -> area(b, from, 1, emptyOrEnemyOf(p.color())),
                (b, from, p) -> area(b, from, 1, enemyOf(p.color()))));
        RULES.put(DEFENDER, new PieceRule(
                (b, from, p) -> frontThree(b, from, p.color(), Objects::isNull),
                (b, from, p) -> frontThree(b, from, p.color(), enemyOf(p.color()))));
        RULES.put(WARRIOR, new PieceRule(
                Reachability::warriorMoves,
                Reachability::warriorAttacks));
        RULES.put(PALADIN, new PieceRule(
                (b, from, p) -> area(b, from, PALADIN_RADIUS + aura(b, from, p), Objects::isNull),
                (b, from, p) -> area(b, from, PALADIN_RADIUS, enemyOf(p.color()))));
        RULES.put(MAGE, new PieceRule(
                Reachability::mageMoves,
                Reachability::mageAttacks));
        RULES.put(SPEARMAN, new PieceRule(
                Reachability::spearmanMoves,
                Reachability::spearmanAttacks));
        RULES.put(ARCHER, new PieceRule(
                PieceRule.Reach.NONE,
                Reachability::archerAttacks));
        RULES.put(BARD, new PieceRule(
                (b, from, p) -> area(b, from, 1 + aura(b, from, p), Objects::isNull),
                PieceRule.Reach.NONE));
        RULES.put(ASSASSIN, new PieceRule(
                (b, from, p) -> nextQuadrant(b, from, Objects::isNull),
                (b, from, p) -> nextQuadrant(b, from, enemyOf(p.color()))));
    }

    private Reachability() {
    }

    /** 分派表查询 */
    public static PieceRule ruleOf(PieceKind kind) {
        return RULES.get(kind);
    }

    /** 起点棋子的可移动格子；起点为空或越界时返回空集 */
    public static Set<Position> legalMoves(Board b, Position pos) {
        Piece p = b.at(pos);
        return p == null ? Set.of() : RULES.get(p.kind()).move().apply(b, pos, p);
    }

    /** 起点棋子的可攻击格子；起点为空或越界时返回空集 */
    public static Set<Position> legalAttacks(Board b, Position pos) {
        Piece p = b.at(pos);
        return p == null ? Set.of() : RULES.get(p.kind()).attack().apply(b, pos, p);
    }

    /** 一次性计算移动与攻击集合（选中棋子时使用） */
    public static Selection select(Board b, Position pos) {
        return new Selection(pos, legalMoves(b, pos), legalAttacks(b, pos));
    }

    // ----------- per-kind rules -----------

    private static Set<Position> warriorMoves(Board b, Position from, Piece p) {
        if (p.stance() != Stance.MOBILE) return Set.of();
        return area(b, from, 1 + aura(b, from, p), Objects::isNull);
    }

    private static Set<Position> warriorAttacks(Board b, Position from, Piece p) {
        return switch (p.stance()) {
            case MOBILE -> Set.of();
            case WEAK_STRIKE -> area(b, from, 1, enemyOf(p.color()));
            case STRONG_STRIKE -> area(b, from, 2, enemyOf(p.color()));
        };
    }

    /** 法师仅在冷却中可以移动 */
    private static Set<Position> mageMoves(Board b, Position from, Piece p) {
        if (!p.recovering()) return Set.of();
        return area(b, from, 1 + aura(b, from, p), Objects::isNull);
    }

    /** 冷却为 0 时：同行、同列的所有敌子（无距离限制、不被阻挡） */
    private static Set<Position> mageAttacks(Board b, Position from, Piece p) {
        if (p.recovering()) return Set.of();
        Predicate<Piece> enemy = enemyOf(p.color());
        Set<Position> out = new LinkedHashSet<>();
        for (int i = 0; i < Board.SIZE; i++) {
            Position inRow = Position.of(from.row(), i);
            Position inCol = Position.of(i, from.col());
            if (i != from.col() && enemy.test(b.at(inRow))) out.add(inRow);
            if (i != from.row() && enemy.test(b.at(inCol))) out.add(inCol);
        }
        return Collections.unmodifiableSet(out);
    }

    /** 直线前进 3+光环 格，遇到第一个有子的格子即停止（该格不可达） */
    private static Set<Position> spearmanMoves(Board b, Position from, Piece p) {
        int fwd = p.color().forward();
        int reach = SPEAR_REACH + aura(b, from, p);
        Set<Position> out = new LinkedHashSet<>();
        for (int i = 1; i <= reach; i++) {
            Position next = from.offset(fwd * i, 0);
            if (!next.onBoard() || b.at(next) != null) break;
            out.add(next);
        }
        return Collections.unmodifiableSet(out);
    }

    /** 只攻击正前方第 3 格，中间有无棋子都不影响，光环不生效 */
    private static Set<Position> spearmanAttacks(Board b, Position from, Piece p) {
        Position target = from.offset(p.color().forward() * SPEAR_REACH, 0);
        return enemyOf(p.color()).test(b.at(target)) ? Set.of(target) : Set.of();
    }

    /** 前方半平面（前进方向行差 &gt; 0）内欧氏距离 ≤ 4 的敌子 */
    private static Set<Position> archerAttacks(Board b, Position from, Piece p) {
        int fwd = p.color().forward();
        Predicate<Piece> enemy = enemyOf(p.color());
        Set<Position> out = new LinkedHashSet<>();
        for (int r = 0; r < Board.SIZE; r++) {
            int rowDiff = (r - from.row()) * fwd;
            if (rowDiff <= 0) continue;
            for (int c = 0; c < Board.SIZE; c++) {
                int colDiff = c - from.col();
                if (rowDiff * rowDiff + colDiff * colDiff > ARCHER_RANGE_SQ) continue;
                Position t = Position.of(r, c);
                if (enemy.test(b.at(t))) out.add(t);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    // ----------- private helpers -----------

    private static int aura(Board b, Position from, Piece p) {
        return AuraEvaluator.bardBonus(b, from, p.color());
    }

    /**
     * 以 from 为中心、切比雪夫半径 radius 内（不含 from）满足 accept 的格子。
     * accept 的入参为目标格上的棋子，空格为 null。
     */
    private static Set<Position> area(Board b, Position from, int radius, Predicate<Piece> accept) {
        Set<Position> out = new LinkedHashSet<>();
        for (int dr = -radius; dr <= radius; dr++) {
            for (int dc = -radius; dc <= radius; dc++) {
                if (dr == 0 && dc == 0) continue;
                Position t = from.offset(dr, dc);
                if (t.onBoard() && accept.test(b.at(t))) out.add(t);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    /** 前进一行的左前/正前/右前三格 */
    private static Set<Position> frontThree(Board b, Position from, PieceColor color, Predicate<Piece> accept) {
        Set<Position> out = new LinkedHashSet<>();
        for (int dc = -1; dc <= 1; dc++) {
            Position t = from.offset(color.forward(), dc);
            if (t.onBoard() && accept.test(b.at(t))) out.add(t);
        }
        return Collections.unmodifiableSet(out);
    }

    /** 顺时针下一个象限内满足 accept 的所有格子 */
    private static Set<Position> nextQuadrant(Board b, Position from, Predicate<Piece> accept) {
        Quadrant target = Quadrant.of(from).clockwise();
        Set<Position> out = new LinkedHashSet<>();
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                Position t = Position.of(r, c);
                if (target.contains(t) && accept.test(b.at(t))) out.add(t);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    private static Predicate<Piece> enemyOf(PieceColor side) {
        return t -> t != null && t.isEnemyOf(side);
    }

    private static Predicate<Piece> emptyOrEnemyOf(PieceColor side) {
        return t -> t == null || t.isEnemyOf(side);
    }
}
