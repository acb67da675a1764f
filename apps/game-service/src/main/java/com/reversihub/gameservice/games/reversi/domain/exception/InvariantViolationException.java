package com.reversihub.gameservice.games.reversi.domain.exception;

import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;

/**
 * 内部一致性被破坏（棋盘与玩家持子集合不同步）。正常使用下不应出现。
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String detail) {
        super(GameMessages.ERR_INVARIANT_VIOLATION + ": " + detail);
    }
}
