package com.chesshub.gameservice.games.tactics.domain.model;

import com.chesshub.gameservice.engine.core.GameState;
import com.chesshub.gameservice.games.tactics.domain.rule.Reachability;
import com.chesshub.gameservice.games.tactics.domain.rule.TurnController;
import com.chesshub.gameservice.games.tactics.domain.rule.TurnOutcome;

/**
 * 对局状态（单一事实来源）：棋盘、轮到谁、当前选中、胜者、上一手。
 *
 * 半回合状态机：Idle →（点己方棋子）→ Selected →（点任意格）→ Idle
 * - 只有完成一次移动/吃子才会换手，单纯选中不会；
 * - 胜者一旦产生，对局冻结，之后的点击和远端同步全部忽略。
 */
public class TacticsState implements GameState {

    private Board board = Board.initial();
    private PieceColor current = PieceColor.WHITE;
    /** 当前选中及其缓存的可达集合；Idle 时为 null */
    private Selection selection;
    /** 胜者；未结束为 null */
    private PieceColor winner;
    /** 上一手，便于前端高亮 */
    private Action lastAction;

    // --------- 读方法（暴露给外部） ----------
    public Board board() { return board; }
    public PieceColor current() { return current; }
    public Selection selection() { return selection; }
    public PieceColor winner() { return winner; }
    public Action lastAction() { return lastAction; }
    public boolean over() { return winner != null; }

    // --------- 状态变更（由上层用例调用） ----------

    /**
     * 处理一次棋盘点击。非法输入一律静默处理，不抛异常。
     */
    public ClickResult click(Position pos) {
        if (pos == null || over()) return ClickResult.IGNORED;

        if (selection == null) {
            Piece p = board.at(pos);
            if (p == null || p.color() != current) return ClickResult.IGNORED;
            selection = Reachability.select(board, pos);
            return ClickResult.SELECTED;
        }

        Selection sel = selection;
        selection = null;
        Piece actor = board.at(sel.origin());
        if (actor == null || actor.color() != current) return ClickResult.CLEARED;

        TurnOutcome out = TurnController.perform(board, sel, pos);
        if (!out.accepted()) return ClickResult.CLEARED;

        board = out.board();
        lastAction = new Action(sel.origin(), pos, out.type());
        if (out.decisive()) {
            winner = out.winner();
        } else {
            current = current.opponent();
        }
        return out.type() == ActionType.CAPTURE ? ClickResult.CAPTURED : ClickResult.MOVED;
    }

    /**
     * 远端同步：整盘替换棋盘与执子方，不做任何合法性校验也不合并。
     *
     * @return 是否生效（对局已结束则不生效）
     */
    public boolean replaceFromRemote(Board remote, PieceColor nextToMove) {
        if (over()) return false;
        board = remote;
        current = nextToMove;
        selection = null;
        lastAction = null;
        return true;
    }

    /** 记录胜者并冻结对局（已结束时保持原胜者） */
    public void declareWinner(PieceColor side) {
        if (winner == null) {
            winner = side;
            selection = null;
        }
    }

    /** 重置为标准开局：白先、无选中、无胜者 */
    public void reset() {
        board = Board.initial();
        current = PieceColor.WHITE;
        selection = null;
        winner = null;
        lastAction = null;
    }

    /** 深拷贝：Board / Selection / Action 均不可变，引用即可 */
    @Override
    public TacticsState copy() {
        TacticsState s = new TacticsState();
        s.board = this.board;
        s.current = this.current;
        s.selection = this.selection;
        s.winner = this.winner;
        s.lastAction = this.lastAction;
        return s;
    }
}
