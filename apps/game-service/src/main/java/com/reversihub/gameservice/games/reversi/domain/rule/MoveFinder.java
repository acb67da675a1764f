package com.reversihub.gameservice.games.reversi.domain.rule;

import com.reversihub.gameservice.games.reversi.domain.model.Board;
import com.reversihub.gameservice.games.reversi.domain.model.Coord;
import com.reversihub.gameservice.games.reversi.domain.model.Player;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 核心规则：合法着法生成（纯函数，不修改棋盘）。
 * 从对方每枚棋子出发，取其 8 邻域中的空位作为候选落点，
 * 再从落点穿过该棋子一路走下去，遇到己方棋子即形成夹击。
 */
public final class MoveFinder {

    // 8 个邻域偏移：横、竖、两条对角线的正反方向
    private static final int[][] DIRS = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1,  0},          {1,  0},
            {-1,  1}, {0,  1}, {1,  1}
    };

    private MoveFinder() {
    }

    /**
     * 计算 mover 的全部合法着法。
     *
     * @return 落点 -> 合并去重后的吃子链；按行优先排序，空表表示必须跳过
     */
    public static Map<Coord, List<Coord>> find(Board b, Player mover, Player opponent) {
        Map<Coord, Set<Coord>> merged = new TreeMap<>();
        for (Coord p : opponent.pieces()) {
            for (int[] d : DIRS) {
                Coord t = p.offset(d[0], d[1]);
                if (t.equals(p) || !b.isEmpty(t)) continue; // 越界/已占都不是空位
                // 从落点朝对方棋子方向走：第一步就落在 p 上
                List<Coord> chain = walk(b, t, -d[0], -d[1], mover.getId(), opponent.getId());
                if (chain.isEmpty()) continue;
                merged.computeIfAbsent(t, k -> new LinkedHashSet<>()).addAll(chain);
            }
        }
        Map<Coord, List<Coord>> moves = new LinkedHashMap<>();
        merged.forEach((t, chain) -> moves.put(t, List.copyOf(chain)));
        return Collections.unmodifiableMap(moves);
    }

    // ----------- private helpers -----------

    /**
     * 从 from（不含）沿 (dx,dy) 收集连续的对方棋子，直到遇到己方棋子。
     * 越界或遇到空位则该方向不成立，返回空表。
     */
    private static List<Coord> walk(Board b, Coord from, int dx, int dy, char me, char opp) {
        List<Coord> chain = new ArrayList<>();
        Coord c = from.offset(dx, dy);
        while (true) {
            char owner = b.ownerAt(c);
            if (owner == opp) {
                chain.add(c);
                c = c.offset(dx, dy);
            } else if (owner == me) {
                return chain;
            } else {
                return Collections.emptyList(); // EMPTY / OFF_BOARD
            }
        }
    }
}
