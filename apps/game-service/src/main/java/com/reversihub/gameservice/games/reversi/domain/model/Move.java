package com.reversihub.gameservice.games.reversi.domain.model;

import java.util.List;

/**
 * 一步棋：在 target 落子，并翻转 captures 中的全部对方棋子。
 * captures 为合并去重后的吃子链，合法着法至少包含一个坐标。
 */
public record Move(Coord target, List<Coord> captures) {

    public Move {
        captures = List.copyOf(captures);
    }
}
