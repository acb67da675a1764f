package com.reversihub.gameservice.games.reversi.domain.rule;

import com.reversihub.gameservice.games.reversi.domain.model.Board;

/** 对局结果：未结束 / 黑胜 / 白胜 / 和棋 */
public enum Outcome {
    /** 对局进行中 */
    ONGOING,
    /** 黑方子多 */
    BLACK_WIN,
    /** 白方子多 */
    WHITE_WIN,
    /** 子数相同 */
    DRAW;

    /**
     * 按终局子数判定。
     *
     * @param black 黑子数
     * @param white 白子数
     */
    public static Outcome byCount(int black, int white) {
        if (black == white) return DRAW;
        return black > white ? BLACK_WIN : WHITE_WIN;
    }

    /** 胜方棋子标记；进行中或和棋返回 null */
    public Character winner() {
        switch (this) {
            case BLACK_WIN:
                return Board.BLACK;
            case WHITE_WIN:
                return Board.WHITE;
            default:
                return null;
        }
    }
}
