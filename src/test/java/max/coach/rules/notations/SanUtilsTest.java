package max.coach.rules.notations;

import max.coach.rules.Game;
import max.coach.rules.IllegalMoveException;
import max.coach.rules.Move;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SanUtilsTest {

    @ParameterizedTest
    @CsvSource({
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1, g1f3, Nf3",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1, e2e4, e4",
            "rnbqkbnr/ppp1pppp/8/3p4/4P3/8/PPPP1PPP/RNBQKBNR w KQkq d6 0 2, e4d5, exd5",
            "rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3, e5f6, exf6",
            "k7/8/8/8/8/8/8/R4R1K w - - 0 1, a1c1, Rac1",
            "7k/8/8/R7/8/8/8/R6K w - - 0 1, a1a3, R1a3",
            "7k/P7/8/8/8/8/8/K7 w - - 0 1, a7a8q, a8=Q+",
            "7k/P7/8/8/8/8/8/K7 w - - 0 1, a7a8n, a8=N",
            "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1, e1g1, O-O",
            "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1, e1c1, O-O-O",
            "rnbqkbnr/pppp1ppp/8/4p3/6P1/5P2/PPPPP2P/RNBQKBNR b KQkq g3 0 2, d8h4, Qh4#",
            "rnbqkb1r/pppp1ppp/5n2/4p2Q/4P3/8/PPPP1PPP/RNB1KBNR w KQkq - 2 3, h5f7, Qxf7+"
    })
    public void toSanShouldWriteStandardNotation(String fen, String uciMove, String expectedSan) {
        // Given
        Game game = Game.from(fen);

        // When
        String san = SanUtils.toSan(game, Move.fromUciNotation(uciMove));

        // Then
        assertEquals(expectedSan, san);
        assertEquals(fen, game.toFen());
    }

    @ParameterizedTest
    @CsvSource({
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1, Nf3, g1f3",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1, Nf3!?, g1f3",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1, e4, e2e4",
            "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1, 0-0, e1g1",
            "r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1, O-O-O, e8c8",
            "7k/P7/8/8/8/8/8/K7 w - - 0 1, a8=Q+, a7a8q",
            "7k/P7/8/8/8/8/8/K7 w - - 0 1, a8N, a7a8n",
            "k7/8/8/8/8/8/8/R4R1K w - - 0 1, Rfc1, f1c1",
            "rnbqkbnr/pppp1ppp/8/4p3/6P1/5P2/PPPPP2P/RNBQKBNR b KQkq g3 0 2, Qh4#!, d8h4"
    })
    public void parseSanShouldFindTheLegalMove(String fen, String san, String expectedUci) {
        Game game = Game.from(fen);
        assertEquals(Move.fromUciNotation(expectedUci), SanUtils.parseSan(game, san));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ke3", "e5", "Nf4", "O-O", "hello", "", "Rc1"})
    public void parseSanShouldRejectIllegalOrUnreadableMoves(String san) {
        Game game = Game.newStandardGame();
        assertThrows(IllegalMoveException.class, () -> SanUtils.parseSan(game, san));
    }

    @Test
    public void parseSanShouldRejectAmbiguousMoves() {
        Game game = Game.from("k7/8/8/8/8/8/8/R4R1K w - - 0 1");
        assertThrows(IllegalMoveException.class, () -> SanUtils.parseSan(game, "Rc1"));
    }
}
