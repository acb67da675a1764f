package com.reversihub.gameservice.games.reversi.service;

import com.reversihub.gameservice.games.reversi.domain.model.BoardView;
import com.reversihub.gameservice.games.reversi.domain.model.Coord;
import com.reversihub.gameservice.games.reversi.domain.model.ReversiState;
import com.reversihub.gameservice.games.reversi.domain.rule.Outcome;

import java.util.List;
import java.util.Map;

/**
 * 黑白棋对局用例。所有方法同步执行，state 由调用方持有并顺序驱动。
 */
public interface ReversiService {

    /** 新开一局：按配置的尺寸与先手摆好标准开局 */
    ReversiState newGame();

    /**
     * 当前执子方的合法着法：落点 -> 吃子链。
     * 空表表示必须调用 {@link #skipTurn}；已结束的对局恒为空表。
     */
    Map<Coord, List<Coord>> legalMoves(ReversiState state);

    /**
     * 在 target 落子并吃子，然后换手。
     *
     * @throws com.reversihub.gameservice.games.reversi.domain.exception.InvalidMoveException
     *         target 不在合法着法表中，或对局已结束（状态不变）
     */
    ReversiState applyMove(ReversiState state, Coord target);

    ReversiState applyMove(ReversiState state, int x, int y);

    /**
     * 无子可下时跳过本回合；连续两次跳过则对局结束。
     *
     * @throws IllegalStateException 仍有合法着法，或对局已结束
     */
    ReversiState skipTurn(ReversiState state);

    boolean isFinished(ReversiState state);

    /** 双方子数（先手在前），两者之和等于棋盘非空格数 */
    Map<Character, Integer> scores(ReversiState state);

    /** 当前执子方标记 */
    char currentPlayer(ReversiState state);

    /** 对局结果；未结束返回 ONGOING */
    Outcome outcome(ReversiState state);

    /** 渲染用只读快照（带合法落点标记） */
    BoardView view(ReversiState state);
}
