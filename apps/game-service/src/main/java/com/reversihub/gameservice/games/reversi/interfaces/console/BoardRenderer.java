package com.reversihub.gameservice.games.reversi.interfaces.console;

import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;
import com.reversihub.gameservice.games.reversi.domain.model.BoardView;

import java.util.StringJoiner;

/**
 * 文本棋盘：首行列号，之后每行 "行号 格子 格子 ..."；合法落点显示为 '?'。
 * 末行为双方当前子数与执子方，如 "X=2 O=2  X to move"。
 */
public final class BoardRenderer {

    /** 合法落点标记 */
    public static final char MARKER = '?';

    private BoardRenderer() {
    }

    public static String render(BoardView view) {
        StringBuilder sb = new StringBuilder("  ");
        for (int x = 0; x < view.width; x++) {
            if (x > 0) sb.append(' ');
            sb.append(x);
        }
        sb.append('\n');
        for (int y = 0; y < view.height; y++) {
            sb.append(y);
            for (int x = 0; x < view.width; x++) {
                sb.append(' ').append(view.isMarked(x, y) ? MARKER : view.cells[y][x]);
            }
            sb.append('\n');
        }
        StringJoiner score = new StringJoiner(" ");
        view.scores.forEach((side, count) -> score.add(GameMessages.formatBoardScore(side, count)));
        sb.append(score).append("  ").append(GameMessages.formatToMove(view.sideToMove)).append('\n');
        return sb.toString();
    }
}
