package com.reversihub.gameservice.games.reversi.config;

import com.reversihub.gameservice.games.reversi.domain.model.Board;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 黑白棋对局配置。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如 REVERSI_BOARD_WIDTH=10。
 */
@Data
@Component
@ConfigurationProperties(prefix = "reversi")
public class ReversiProperties {

    /** 棋盘尺寸 */
    private BoardSize board = new BoardSize();

    /** 先手方标记：'X'（黑，默认）或 'O' */
    private char firstPlayer = Board.BLACK;

    /** 控制台对局 */
    private Console console = new Console();

    @Data
    public static class BoardSize {
        /** 列数，需为偶数且 ≥ 4 */
        private int width = Board.DEFAULT_SIZE;
        /** 行数，需为偶数且 ≥ 4 */
        private int height = Board.DEFAULT_SIZE;
    }

    @Data
    public static class Console {
        /** 是否在启动后运行控制台对局 */
        private boolean enabled = false;
        /** 每回合前是否用 ANSI 序列清屏 */
        private boolean clearScreen = true;
    }
}
