package com.reversihub.gameservice.games.reversi.service.impl;

import com.reversihub.gameservice.games.reversi.config.ReversiProperties;
import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;
import com.reversihub.gameservice.games.reversi.domain.exception.InvalidMoveException;
import com.reversihub.gameservice.games.reversi.domain.model.Board;
import com.reversihub.gameservice.games.reversi.domain.model.BoardView;
import com.reversihub.gameservice.games.reversi.domain.model.Coord;
import com.reversihub.gameservice.games.reversi.domain.model.Move;
import com.reversihub.gameservice.games.reversi.domain.model.ReversiState;
import com.reversihub.gameservice.games.reversi.domain.rule.Outcome;
import com.reversihub.gameservice.games.reversi.service.ReversiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;


@Slf4j
@Service
@RequiredArgsConstructor
public class ReversiServiceImpl implements ReversiService {

    private final ReversiProperties properties;

    /**
     * 创建新对局
     */
    @Override
    public ReversiState newGame() {
        ReversiProperties.BoardSize size = properties.getBoard();
        ReversiState state = ReversiState.standard(size.getWidth(), size.getHeight(), properties.getFirstPlayer());
        log.info("新对局: {}x{}, 先手={}", size.getWidth(), size.getHeight(), state.mover().getId());
        return state;
    }

    @Override
    public Map<Coord, List<Coord>> legalMoves(ReversiState state) {
        if (state.isFinished()) return Collections.emptyMap();
        return state.legalMoves();
    }

    /**
     * 落子：先校验落点在合法着法表中，再交给状态对象执行
     */
    @Override
    public ReversiState applyMove(ReversiState state, Coord target) {
        if (state.isFinished()) {
            // 已结束的对局合法着法表为空，任何落点都按非法落子处理
            log.warn("对局已结束，拒绝落子: target={}", target);
            throw new InvalidMoveException(target, GameMessages.ERR_GAME_FINISHED);
        }
        List<Coord> chain = state.legalMoves().get(target);
        if (chain == null) {
            log.warn("非法落子: side={}, target={}", state.mover().getId(), target);
            throw new InvalidMoveException(target);
        }
        char side = state.mover().getId();
        state.apply(new Move(target, chain));
        log.debug("落子: side={}, target={}, captured={}, version={}", side, target, chain.size(), state.getVersion());
        return state;
    }

    @Override
    public ReversiState applyMove(ReversiState state, int x, int y) {
        return applyMove(state, Coord.of(x, y));
    }

    @Override
    public ReversiState skipTurn(ReversiState state) {
        ensureInProgress(state);
        if (!state.legalMoves().isEmpty()) {
            throw new IllegalStateException(GameMessages.ERR_PASS_NOT_ALLOWED + ": "
                    + state.mover().getId() + " has " + state.legalMoves().size() + " legal moves");
        }
        char side = state.mover().getId();
        state.pass();
        log.debug("跳过: side={}, version={}", side, state.getVersion());
        if (state.isFinished()) {
            log.info("对局结束: scores={}, outcome={}", state.scores(), outcome(state));
        }
        return state;
    }

    @Override
    public boolean isFinished(ReversiState state) {
        return state.isFinished();
    }

    @Override
    public Map<Character, Integer> scores(ReversiState state) {
        return state.scores();
    }

    @Override
    public char currentPlayer(ReversiState state) {
        return state.mover().getId();
    }

    @Override
    public Outcome outcome(ReversiState state) {
        if (!state.isFinished()) return Outcome.ONGOING;
        Board b = state.getBoard();
        return Outcome.byCount(b.count(Board.BLACK), b.count(Board.WHITE));
    }

    @Override
    public BoardView view(ReversiState state) {
        return BoardView.of(state);
    }

    // ----------- private helpers -----------

    private void ensureInProgress(ReversiState state) {
        if (state.isFinished()) {
            throw new IllegalStateException(GameMessages.ERR_GAME_FINISHED);
        }
    }
}
