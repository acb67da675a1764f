package com.reversihub.gameservice.games.reversi.domain.model;

import com.reversihub.gameservice.engine.core.GameState;
import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;
import com.reversihub.gameservice.games.reversi.domain.enums.GamePhase;
import com.reversihub.gameservice.games.reversi.domain.rule.MoveFinder;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对局状态：整盘对局的“单一事实来源”。
 * - 持有棋盘 Board 与两名 Player（固定顺序的列表 + 当前执子下标）
 * - 记录阶段 phase、上一手 lastMove、已落子手数
 * - 合法着法按 (version, 棋盘写入计数) 缓存：换手或任何棋盘写入都会使缓存失效
 * 设计说明
 * - 本类不做规则校验，只做状态变更（apply / pass），校验在 service 层按 MoveFinder 结果完成。
 * - copy() 走深拷贝，便于调用方保留对照快照。
 */
@Getter
@EqualsAndHashCode
public class ReversiState implements GameState {

    private final Board board;

    @Getter(AccessLevel.NONE)
    private final List<Player> players;

    /** 当前执子方在 players 中的下标（0/1） */
    private int currentIndex;

    private GamePhase phase = GamePhase.IN_PROGRESS;

    /** 状态版本号：每次落子/跳过自增 */
    private long version;

    /** 已执行的落子数（不含跳过） */
    private int moveCount;

    /** 上一手，便于回放与日志 */
    private Move lastMove;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private Map<Coord, List<Coord>> cachedMoves;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private long cachedVersion = -1;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private long cachedBoardMods = -1;

    public ReversiState(Board board, Player first, Player second) {
        if (first.getId() == second.getId()) {
            throw new IllegalArgumentException(GameMessages.ERR_BAD_CONFIG + ": duplicate player id " + first.getId());
        }
        this.board = board;
        List<Player> ps = new ArrayList<>(2);
        ps.add(first);
        ps.add(second);
        this.players = Collections.unmodifiableList(ps);
    }

    /**
     * 标准开局：中心四格对角分布，first 先手。
     * first 持有 (cx-1,cy) 与 (cx,cy-1)，对手持有 (cx-1,cy-1) 与 (cx,cy)。
     */
    public static ReversiState standard(int width, int height, char first) {
        if (width < 4 || height < 4 || width % 2 != 0 || height % 2 != 0) {
            throw new IllegalArgumentException(GameMessages.ERR_BAD_CONFIG
                    + ": board must be even-sized and at least 4x4, got " + width + "x" + height);
        }
        Player mover = new Player(checkSide(first));
        Player opponent = new Player(opponentOf(first));
        Board b = new Board(width, height);
        int cx = width / 2, cy = height / 2;
        put(b, mover, Coord.of(cx - 1, cy));
        put(b, mover, Coord.of(cx, cy - 1));
        put(b, opponent, Coord.of(cx - 1, cy - 1));
        put(b, opponent, Coord.of(cx, cy));
        return new ReversiState(b, mover, opponent);
    }

    /**
     * 由任意局面构造状态（双方持子集合从棋盘推导），mover 为当前执子方。
     * 棋盘会被复制，之后的落子不影响调用方持有的 board。
     */
    public static ReversiState fromBoard(Board source, char mover) {
        Board board = source.copy();
        Player me = new Player(checkSide(mover));
        Player opp = new Player(opponentOf(mover));
        for (int y = 0; y < board.getHeight(); y++) {
            for (int x = 0; x < board.getWidth(); x++) {
                char p = board.get(x, y);
                if (p == me.getId()) me.addPiece(Coord.of(x, y));
                else if (p == opp.getId()) opp.addPiece(Coord.of(x, y));
                else if (p != Board.EMPTY) {
                    throw new IllegalArgumentException(GameMessages.ERR_BAD_CONFIG + ": unknown piece '" + p + "' at " + Coord.of(x, y));
                }
            }
        }
        return new ReversiState(board, me, opp);
    }

    // --------- 读方法 ----------

    public Player mover() {
        return players.get(currentIndex);
    }

    public Player opponent() {
        return players.get(1 - currentIndex);
    }

    /** 按开局顺序返回双方（先手在前） */
    public List<Player> players() {
        return players;
    }

    public boolean isFinished() {
        return phase == GamePhase.FINISHED;
    }

    /**
     * 当前执子方的合法着法（只读）。version 与棋盘均未变化时重复调用返回同一结果。
     */
    public Map<Coord, List<Coord>> legalMoves() {
        if (cachedMoves == null || cachedVersion != version || cachedBoardMods != board.getModCount()) {
            cachedMoves = MoveFinder.find(board, mover(), opponent());
            cachedVersion = version;
            cachedBoardMods = board.getModCount();
        }
        return cachedMoves;
    }

    /** 按棋盘统计的双方子数（先手在前），空格不计 */
    public Map<Character, Integer> scores() {
        Map<Character, Integer> m = new LinkedHashMap<>();
        for (Player p : players) m.put(p.getId(), board.count(p.getId()));
        return m;
    }

    // --------- 状态变更（由 service 调用） ----------

    /** 应用一次落子：放子、吃子改色并同步双方持子集合，然后换手（不做合法性判断） */
    public void apply(Move m) {
        Player me = mover();
        Player opp = opponent();
        board.place(me, m.target());
        me.addPiece(m.target());
        for (Coord c : m.captures()) {
            opp.removePiece(c);
            board.place(me, c);
            me.addPiece(c);
        }
        me.setSkippedLastTurn(false);
        lastMove = m;
        moveCount++;
        advance();
    }

    /** 当前方无子可下：记为跳过并换手；若对手上一回合也跳过则结束 */
    public void pass() {
        mover().setSkippedLastTurn(true);
        boolean bothSkipped = opponent().isSkippedLastTurn();
        advance();
        if (bothSkipped) {
            phase = GamePhase.FINISHED;
        }
    }

    /** 深拷贝：复制棋盘、双方与对局元信息 */
    @Override
    public ReversiState copy() {
        ReversiState s = new ReversiState(board.copy(), players.get(0).copy(), players.get(1).copy());
        s.currentIndex = currentIndex;
        s.phase = phase;
        s.version = version;
        s.moveCount = moveCount;
        s.lastMove = lastMove; // Move 是不可变 record，引用即可
        return s;
    }

    public static char opponentOf(char side) {
        return checkSide(side) == Board.BLACK ? Board.WHITE : Board.BLACK;
    }

    // ----------- private helpers -----------

    private void advance() {
        currentIndex = 1 - currentIndex;
        version++;
    }

    private static void put(Board b, Player p, Coord c) {
        b.place(p, c);
        p.addPiece(c);
    }

    private static char checkSide(char side) {
        if (side != Board.BLACK && side != Board.WHITE) {
            throw new IllegalArgumentException(GameMessages.ERR_BAD_CONFIG + ": side must be 'X' or 'O', got '" + side + "'");
        }
        return side;
    }
}
