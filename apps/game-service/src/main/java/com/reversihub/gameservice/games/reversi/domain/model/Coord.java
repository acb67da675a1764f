package com.reversihub.gameservice.games.reversi.domain.model;

/**
 * 棋盘坐标：(列 x, 行 y)，(0,0) 为左上角，y 向下递增。
 * 不做越界校验，越界由 Board 以 OFF_BOARD 值表达。
 */
public record Coord(int x, int y) implements Comparable<Coord> {

    public static Coord of(int x, int y) {
        return new Coord(x, y);
    }

    /** 沿 (dx,dy) 平移一步 */
    public Coord offset(int dx, int dy) {
        return new Coord(x + dx, y + dy);
    }

    /** 行优先排序（先 y 后 x），与渲染顺序一致 */
    @Override
    public int compareTo(Coord o) {
        return (y != o.y) ? Integer.compare(y, o.y) : Integer.compare(x, o.x);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
