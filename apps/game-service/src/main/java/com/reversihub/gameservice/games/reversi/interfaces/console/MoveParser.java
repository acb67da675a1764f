package com.reversihub.gameservice.games.reversi.interfaces.console;

import com.reversihub.gameservice.games.reversi.domain.model.Coord;

import java.util.Optional;

/**
 * 解析控制台输入："列 行"，两个以空白分隔的整数。
 */
public final class MoveParser {

    private MoveParser() {
    }

    /** 格式不对返回 empty，不抛异常；是否越界/合法交给规则层 */
    public static Optional<Coord> parse(String line) {
        if (line == null) return Optional.empty();
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 2) return Optional.empty();
        try {
            return Optional.of(Coord.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
