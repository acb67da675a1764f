package com.reversihub.gameservice.games.reversi.domain.exception;

import com.reversihub.gameservice.games.reversi.domain.constants.GameMessages;
import com.reversihub.gameservice.games.reversi.domain.model.Coord;
import lombok.Getter;

/**
 * 落点不在当前合法着法表中（包括对局已结束、合法着法表为空的情况）。
 * 状态保持不变，调用方应重新输入。
 */
@Getter
public class InvalidMoveException extends IllegalArgumentException {

    private final Coord target;

    public InvalidMoveException(Coord target) {
        super(GameMessages.ERR_INVALID_MOVE + ": " + target);
        this.target = target;
    }

    /** 附带原因码，例如 GAME_FINISHED */
    public InvalidMoveException(Coord target, String reason) {
        super(GameMessages.ERR_INVALID_MOVE + ": " + target + " (" + reason + ")");
        this.target = target;
    }
}
