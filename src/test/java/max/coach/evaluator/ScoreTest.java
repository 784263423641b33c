package max.coach.evaluator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ScoreTest {

    @ParameterizedTest
    @CsvSource({
            "false, 30, 0.3",
            "false, -120, -1.2",
            "false, 0, 0.0",
            "true, 3, M3",
            "true, -2, M-2"
    })
    public void formatShouldWritePawnsOrMate(boolean mate, int value, String expected) {
        assertEquals(expected, new Score(mate, value).format());
    }

    @Test
    public void mateShouldBeWorthAThousandPawns() {
        assertEquals(1000.0, Score.mateIn(4).toPawns());
        assertEquals(-1000.0, Score.mateIn(-1).toPawns());
        assertEquals(-100_000, Score.mateIn(-1).toCentipawns());
        assertEquals(2.5, Score.centipawns(250).toPawns());
    }

    @Test
    public void mateOnTheBoardShouldFlipWithThePointOfView() {
        // UCI "mate 0": the side to move is checkmated
        Score mated = Score.mateIn(0);

        Score seenByTheOtherSide = mated.negate();

        assertEquals(-1000.0, mated.toPawns());
        assertEquals(1000.0, seenByTheOtherSide.toPawns());
        assertEquals(100_000, seenByTheOtherSide.toCentipawns());
        assertEquals(mated, seenByTheOtherSide.negate());
        assertEquals(1000.0, Score.parsePawns(seenByTheOtherSide.format()));
        assertEquals(-1000.0, Score.parsePawns(mated.format()));
    }

    @Test
    public void negateShouldKeepTheKind() {
        assertEquals(Score.mateIn(-3), Score.mateIn(3).negate());
        assertEquals(Score.centipawns(-40), Score.centipawns(40).negate());
    }

    @ParameterizedTest
    @CsvSource({
            "0.3, 0.3",
            "-1.2, -1.2",
            "M3, 1000.0",
            "M-2, -1000.0",
            "M0, -1000.0",
            "M+0, 1000.0",
            "#+4, 1000.0"
    })
    public void parsePawnsShouldReadFormattedScores(String text, double expected) {
        assertEquals(expected, Score.parsePawns(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "M", "  ", "1.2.3"})
    public void malformedScoreShouldReadAsEven(String text) {
        assertEquals(0.0, Score.parsePawns(text));
    }

    @Test
    public void searchLimitShouldWriteTheGoCommand() {
        assertEquals("go depth 15", SearchLimit.depth(15).toGoCommand());
        assertEquals("go movetime 500", SearchLimit.moveTime(500).toGoCommand());
        assertEquals("go depth 10 movetime 200", new SearchLimit(10, 200).toGoCommand());
        assertThrows(IllegalArgumentException.class, () -> new SearchLimit(SearchLimit.UNSET, SearchLimit.UNSET));
        assertThrows(IllegalArgumentException.class, () -> SearchLimit.depth(0));
        assertThrows(IllegalArgumentException.class, () -> SearchLimit.moveTime(-5));
    }
}
