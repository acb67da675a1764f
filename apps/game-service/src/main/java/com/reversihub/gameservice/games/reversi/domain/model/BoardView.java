package com.reversihub.gameservice.games.reversi.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only snapshot of a Reversi position for rendering layers: cells, side to move, scores.
 * Legal targets travel as a separate overlay; the board itself is never marked.
 */
public final class BoardView {

    public final int width;
    public final int height;
    /** cells[y][x] */
    public final char[][] cells;
    public final char sideToMove;
    public final Set<Coord> markers;
    public final Map<Character, Integer> scores;

    public BoardView(int width,
                     int height,
                     char[][] cells,
                     char sideToMove,
                     Set<Coord> markers,
                     Map<Character, Integer> scores) {
        this.width = width;
        this.height = height;
        this.cells = cells;
        this.sideToMove = sideToMove;
        this.markers = markers == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(markers));
        this.scores = scores == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static BoardView of(ReversiState s) {
        Set<Coord> markers = s.isFinished() ? Collections.emptySet() : s.legalMoves().keySet();
        return new BoardView(s.getBoard().getWidth(), s.getBoard().getHeight(), s.getBoard().view(),
                s.mover().getId(), markers, s.scores());
    }

    public boolean isMarked(int x, int y) {
        return markers.contains(Coord.of(x, y));
    }
}
