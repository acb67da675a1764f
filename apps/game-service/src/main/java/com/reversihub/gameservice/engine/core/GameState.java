package com.reversihub.gameservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：便于回放、调试、保存前的只读复制等。
 * - 具体游戏（如 ReversiState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
