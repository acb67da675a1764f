package com.reversihub.gameservice.games.reversi.domain.model;

import com.reversihub.gameservice.games.reversi.domain.enums.GamePhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class ReversiStateTest {

    @Test
    void standardOpeningSplitsCentreDiagonally() {
        ReversiState s = ReversiState.standard(8, 8, Board.BLACK);
        Board b = s.getBoard();

        assertThat(s.mover().getId()).isEqualTo(Board.BLACK);
        assertThat(s.opponent().getId()).isEqualTo(Board.WHITE);
        assertThat(s.mover().pieces()).containsExactlyInAnyOrder(Coord.of(3, 4), Coord.of(4, 3));
        assertThat(s.opponent().pieces()).containsExactlyInAnyOrder(Coord.of(3, 3), Coord.of(4, 4));
        assertThat(b.get(3, 3)).isEqualTo(Board.WHITE);
        assertThat(b.get(4, 3)).isEqualTo(Board.BLACK);
        assertThat(b.occupied()).isEqualTo(4);
        assertThat(s.getPhase()).isEqualTo(GamePhase.IN_PROGRESS);
        assertThat(s.scores()).containsExactly(entry(Board.BLACK, 2), entry(Board.WHITE, 2));
    }

    @ParameterizedTest
    @CsvSource({"3,8", "8,5", "2,2", "0,8", "7,7"})
    void standardRejectsUnusableSizes(int width, int height) {
        assertThatThrownBy(() -> ReversiState.standard(width, height, Board.BLACK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("BAD_CONFIG");
    }

    @Test
    void standardRejectsUnknownSide() {
        assertThatThrownBy(() -> ReversiState.standard(8, 8, 'Z'))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromBoardDerivesOwnership() {
        ReversiState s = TestBoards.state(Board.WHITE,
                "X O .",
                ". X .");
        assertThat(s.mover().getId()).isEqualTo(Board.WHITE);
        assertThat(s.mover().pieces()).containsExactly(Coord.of(1, 0));
        assertThat(s.opponent().pieces()).containsExactlyInAnyOrder(Coord.of(0, 0), Coord.of(1, 1));
    }

    @Test
    void fromBoardRejectsForeignPieces() {
        Board b = new Board(2, 2);
        b.place(Coord.of(0, 0), '?');
        assertThatThrownBy(() -> ReversiState.fromBoard(b, Board.BLACK))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void applyPlacesCapturesAndSwapsRoles() {
        ReversiState s = ReversiState.standard(8, 8, Board.BLACK);
        Player black = s.mover();
        Player white = s.opponent();

        s.apply(new Move(Coord.of(2, 3), List.of(Coord.of(3, 3))));

        assertThat(s.getBoard().get(2, 3)).isEqualTo(Board.BLACK);
        assertThat(s.getBoard().get(3, 3)).isEqualTo(Board.BLACK);
        assertThat(black.pieceCount()).isEqualTo(4);
        assertThat(white.pieceCount()).isEqualTo(1);
        assertThat(white.owns(Coord.of(3, 3))).isFalse();
        assertThat(s.mover()).isSameAs(white);
        assertThat(s.opponent()).isSameAs(black);
        assertThat(s.getMoveCount()).isEqualTo(1);
        assertThat(s.getLastMove().target()).isEqualTo(Coord.of(2, 3));
    }

    @Test
    void legalMovesAreMemoizedPerVersion() {
        ReversiState s = ReversiState.standard(8, 8, Board.BLACK);
        Map<Coord, List<Coord>> first = s.legalMoves();
        assertThat(s.legalMoves()).isSameAs(first);

        long version = s.getVersion();
        s.apply(new Move(Coord.of(2, 3), first.get(Coord.of(2, 3))));
        assertThat(s.getVersion()).isGreaterThan(version);

        Map<Coord, List<Coord>> next = s.legalMoves();
        assertThat(next).isNotSameAs(first);
        assertThat(next.keySet()).containsExactlyInAnyOrder(Coord.of(2, 2), Coord.of(4, 2), Coord.of(2, 4));
    }

    @Test
    void directBoardWriteInvalidatesCachedMoves() {
        ReversiState s = ReversiState.standard(8, 8, Board.BLACK);
        assertThat(s.legalMoves()).containsKey(Coord.of(2, 3));

        s.getBoard().place(Coord.of(2, 3), Board.WHITE);
        assertThat(s.legalMoves()).doesNotContainKey(Coord.of(2, 3));

        s.getBoard().clear(Coord.of(2, 3));
        assertThat(s.legalMoves()).containsKey(Coord.of(2, 3));
    }

    @Test
    void fromBoardDoesNotShareTheCallersBoard() {
        Board source = TestBoards.of(
                "O X . .");
        Board untouched = source.copy();
        ReversiState s = ReversiState.fromBoard(source, Board.WHITE);

        s.apply(new Move(Coord.of(2, 0), List.of(Coord.of(1, 0))));

        assertThat(source).isEqualTo(untouched);
        assertThat(s.getBoard().get(2, 0)).isEqualTo(Board.WHITE);
    }

    @Test
    void passBumpsVersionSoCacheFollowsTheNewMover() {
        ReversiState s = TestBoards.state(Board.BLACK,
                "O X . .");
        assertThat(s.legalMoves()).isEmpty();
        s.pass();
        assertThat(s.mover().getId()).isEqualTo(Board.WHITE);
        assertThat(s.legalMoves()).containsOnlyKeys(Coord.of(2, 0));
    }

    @Test
    void twoConsecutivePassesFinish() {
        ReversiState s = TestBoards.state(Board.BLACK,
                "X X",
                ". .");
        s.pass();
        assertThat(s.isFinished()).isFalse();
        assertThat(s.players()).filteredOn(Player::isSkippedLastTurn).hasSize(1);
        s.pass();
        assertThat(s.isFinished()).isTrue();
        assertThat(s.getPhase()).isEqualTo(GamePhase.FINISHED);
    }

    @Test
    void moveBetweenPassesResetsTheSkipFlag() {
        ReversiState s = TestBoards.state(Board.BLACK,
                "O X . .");
        s.pass();                                                        // X
        s.apply(new Move(Coord.of(2, 0), List.of(Coord.of(1, 0))));      // O
        assertThat(s.opponent().isSkippedLastTurn()).isFalse();
        s.pass();                                                        // X again
        assertThat(s.isFinished()).isFalse();
        s.pass();                                                        // O
        assertThat(s.isFinished()).isTrue();
    }

    @Test
    void copyIsDeepAndEqual() {
        ReversiState s = ReversiState.standard(8, 8, Board.BLACK);
        ReversiState c = s.copy();
        assertThat(c).isEqualTo(s);

        c.apply(new Move(Coord.of(2, 3), List.of(Coord.of(3, 3))));
        assertThat(c).isNotEqualTo(s);
        assertThat(s.getBoard().get(3, 3)).isEqualTo(Board.WHITE);
        assertThat(s.mover().pieceCount()).isEqualTo(2);
        assertThat(s.getVersion()).isZero();
    }

    @Test
    void duplicatePlayerIdsAreRejected() {
        assertThatThrownBy(() -> new ReversiState(new Board(4, 4), new Player(Board.BLACK), new Player(Board.BLACK)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
