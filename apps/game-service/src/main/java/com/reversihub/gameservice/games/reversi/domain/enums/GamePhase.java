package com.reversihub.gameservice.games.reversi.domain.enums;

public enum GamePhase {

    IN_PROGRESS,   // 对局中（接受落子/跳过）
    FINISHED       // 连续两次跳过后结束，不再接受任何着法
}
