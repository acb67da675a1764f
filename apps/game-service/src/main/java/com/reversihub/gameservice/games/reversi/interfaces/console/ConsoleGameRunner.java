package com.reversihub.gameservice.games.reversi.interfaces.console;

import com.reversihub.gameservice.games.reversi.config.ReversiProperties;
import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;
import com.reversihub.gameservice.games.reversi.domain.exception.InvalidMoveException;
import com.reversihub.gameservice.games.reversi.domain.model.Coord;
import com.reversihub.gameservice.games.reversi.domain.model.ReversiState;
import com.reversihub.gameservice.games.reversi.service.ReversiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 控制台双人对局（同一终端轮流输入）。
 * 循环：无子可下则跳过；否则渲染带标记的棋盘、读入一步、非法则重试；结束后打印比分。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reversi.console", name = "enabled", havingValue = "true")
public class ConsoleGameRunner implements CommandLineRunner {

    private static final String CLEAR_SCREEN = "\033[H\033[2J";

    private final ReversiService reversiService;
    private final ReversiProperties properties;

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true);
        play(in, out);
    }

    /**
     * 跑完一整局（或直到输入结束），返回最终状态。
     */
    public ReversiState play(BufferedReader in, PrintWriter out) throws IOException {
        ReversiState state = reversiService.newGame();

        while (!reversiService.isFinished(state)) {
            clear(out);

            if (reversiService.legalMoves(state).isEmpty()) {
                out.println(GameMessages.CANNOT_MOVE);
                reversiService.skipTurn(state);
                continue;
            }

            out.print(BoardRenderer.render(reversiService.view(state)));
            out.println(GameMessages.formatEnterMove(reversiService.currentPlayer(state)));
            out.print(GameMessages.INPUT_CURSOR);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                log.info("输入结束，对局中止: version={}", state.getVersion());
                return state;
            }

            Optional<Coord> target = MoveParser.parse(line);
            if (target.isEmpty()) {
                out.println(GameMessages.INVALID_MOVE);
                continue;
            }
            try {
                reversiService.applyMove(state, target.get());
            } catch (InvalidMoveException e) {
                out.println(GameMessages.INVALID_MOVE);
            }
        }

        printScores(state, out);
        return state;
    }

    private void printScores(ReversiState state, PrintWriter out) {
        out.println();
        out.println(GameMessages.GAME_OVER);
        out.println();
        out.println(GameMessages.FINAL_SCORES);
        out.println("=".repeat(GameMessages.FINAL_SCORES.length()));
        out.println();
        List<Map.Entry<Character, Integer>> entries = new ArrayList<>(reversiService.scores(state).entrySet());
        entries.sort(Map.Entry.<Character, Integer>comparingByValue().reversed());
        for (Map.Entry<Character, Integer> e : entries) {
            out.println(GameMessages.formatScoreLine(e.getKey(), e.getValue()));
        }
        out.flush();
    }

    private void clear(PrintWriter out) {
        if (properties.getConsole().isClearScreen()) {
            out.print(CLEAR_SCREEN);
        }
    }
}
