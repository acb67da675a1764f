package com.reversihub.gameservice.games.reversi.domain.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * 黑白棋棋盘：width x height 网格，尺寸在构造时固定。
 * 约定：EMPTY='.', BLACK='X', WHITE='O'；越界读取返回 OFF_BOARD。
 */
@Getter
@EqualsAndHashCode
public class Board {
    /** 标准棋盘边长 */
    public static final int DEFAULT_SIZE = 8;
    /** 空位标记 */
    public static final char EMPTY = '.';
    /** 黑子标记（默认先手） */
    public static final char BLACK = 'X';
    /** 白子标记 */
    public static final char WHITE = 'O';
    /** 越界标记：只作为读取结果出现，从不写入格子 */
    public static final char OFF_BOARD = '#';

    private final int width;
    private final int height;

    /** grid[y][x]，按行存放 */
    @Getter(AccessLevel.NONE)
    private final char[][] grid;

    /** 写入计数：每次 place/clear 自增，供上层缓存判断棋盘是否变更 */
    @EqualsAndHashCode.Exclude
    private long modCount;

    public Board(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("BOARD_SIZE_INVALID: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.grid = new char[height][width];
        for (int y = 0; y < height; y++) Arrays.fill(grid[y], EMPTY);
    }

    /** 是否在棋盘内 */
    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean inBounds(Coord c) {
        return inBounds(c.x(), c.y());
    }

    /** 读取 (x,y) 的归属：EMPTY / 玩家标记 / OFF_BOARD，越界不抛异常 */
    public char get(int x, int y) {
        return inBounds(x, y) ? grid[y][x] : OFF_BOARD;
    }

    public char ownerAt(Coord c) {
        return get(c.x(), c.y());
    }

    /** 该点是否为空（越界视为非空） */
    public boolean isEmpty(Coord c) {
        return ownerAt(c) == EMPTY;
    }

    /**
     * 在 c 处放下 piece。
     * 不判断合法性，由规则层（MoveFinder）负责，越界属于调用方 bug。
     */
    public void place(Coord c, char piece) {
        requireOnBoard(c);
        grid[c.y()][c.x()] = piece;
        modCount++;
    }

    public void place(Player player, Coord c) {
        place(c, player.getId());
    }

    /** 清空某格；吃子是改色，不走这里 */
    public void clear(Coord c) {
        requireOnBoard(c);
        grid[c.y()][c.x()] = EMPTY;
        modCount++;
    }

    /** 统计 piece 的格子数 */
    public int count(char piece) {
        int n = 0;
        for (char[] row : grid)
            for (char p : row)
                if (p == piece) n++;
        return n;
    }

    /** 非空格子数 */
    public int occupied() {
        return width * height - count(EMPTY);
    }

    /** 深拷贝棋盘 */
    public Board copy() {
        Board b = new Board(width, height);
        for (int y = 0; y < height; y++) b.grid[y] = grid[y].clone();
        return b;
    }

    /** 返回一个只读视图副本（行优先，供渲染/日志） */
    public char[][] view() {
        char[][] v = new char[height][];
        for (int y = 0; y < height; y++) v[y] = grid[y].clone();
        return v;
    }

    private void requireOnBoard(Coord c) {
        if (!inBounds(c)) {
            throw new IndexOutOfBoundsException("OFF_BOARD: " + c + " on " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (char[] row : grid) sb.append(row).append('\n');
        return sb.toString();
    }
}
