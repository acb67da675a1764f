package com.reversihub.gameservice.games.reversi.domain.model;

import com.reversihub.gameservice.games.reversi.domain.exception.InvariantViolationException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * 对局一方：标记、当前持有的棋子坐标、上一回合是否被迫跳过。
 * owned 必须与 Board 上等于 id 的格子完全一致，由 ReversiState 维护。
 */
@Getter
@EqualsAndHashCode
public class Player {

    /** 'X' 或 'O' */
    private final char id;

    @Getter(AccessLevel.NONE)
    private final Set<Coord> owned = new HashSet<>();

    /** 上一回合因无子可下而跳过 */
    @Setter
    private boolean skippedLastTurn;

    public Player(char id) {
        this.id = id;
    }

    /** 幂等添加 */
    public void addPiece(Coord c) {
        owned.add(c);
    }

    /** 移除一枚棋子；未持有说明吃子记账出错，直接失败 */
    public void removePiece(Coord c) {
        if (!owned.remove(c)) {
            throw new InvariantViolationException(id + " does not own " + c);
        }
    }

    public boolean owns(Coord c) {
        return owned.contains(c);
    }

    public int pieceCount() {
        return owned.size();
    }

    /** 只读视图 */
    public Set<Coord> pieces() {
        return Collections.unmodifiableSet(owned);
    }

    public Player copy() {
        Player p = new Player(id);
        p.owned.addAll(owned);
        p.skippedLastTurn = skippedLastTurn;
        return p;
    }

    @Override
    public String toString() {
        return "Player(" + id + ", pieces=" + owned.size() + ", skipped=" + skippedLastTurn + ")";
    }
}
