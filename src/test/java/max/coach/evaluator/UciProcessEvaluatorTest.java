package max.coach.evaluator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(60)
public class UciProcessEvaluatorTest {

    private static List<String> fakeEngine(String... args) {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(FakeUciEngine.class.getName());
        command.addAll(List.of(args));
        return command;
    }

    @Test
    public void missingBinaryShouldBeUnavailable() {
        try(UciProcessEvaluator evaluator = new UciProcessEvaluator("/nonexistent/engine/stockfish")) {
            assertFalse(evaluator.isAvailable());
            assertThrows(EvaluatorUnavailableException.class,
                    () -> evaluator.analyse("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", SearchLimit.depth(5)));
        }
    }

    @Test
    public void engineAnswerShouldBeReadFromWhitePointOfView() {
        try(UciProcessEvaluator evaluator = new UciProcessEvaluator(fakeEngine(), Map.of("Threads", "1"))) {
            // Given
            assertTrue(evaluator.isAvailable());
            assertEquals("FakeEngine 1.0", evaluator.engineName());
            evaluator.newGame();

            // When
            EngineAnalysis white = evaluator.analyse("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", SearchLimit.depth(2));
            EngineAnalysis black = evaluator.analyse("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1", SearchLimit.depth(2));

            // Then
            assertEquals("e2e4", white.bestMove());
            assertEquals(Score.centipawns(50), white.score());
            assertEquals(2, white.depth());
            assertEquals(321, white.nodes());
            assertEquals(List.of("e2e4", "e7e5"), white.principalVariation());

            assertEquals("e7e5", black.bestMove());
            assertEquals(Score.centipawns(-50), black.score());
        }
    }

    @Test
    public void checkmatedSideToMoveShouldBeLostForThatSide() {
        try(UciProcessEvaluator evaluator = new UciProcessEvaluator(fakeEngine("mated"), Map.of())) {
            // Given Black mated by 4. Qxf7#
            String blackMated = "r1bqkb1r/pppp1Qpp/2n2n2/4p3/2B1P3/8/PPPP1PPP/RNB1K1NR b KQkq - 0 4";
            // and White mated by 2... Qh4#
            String whiteMated = "rnb1kbnr/pppp1ppp/8/4p3/6Pq/5P2/PPPPP2P/RNBQKBNR w KQkq - 1 3";

            // When
            EngineAnalysis whiteWins = evaluator.analyse(blackMated, SearchLimit.depth(2));
            EngineAnalysis blackWins = evaluator.analyse(whiteMated, SearchLimit.depth(2));

            // Then
            assertEquals(Score.MATE_PAWNS, whiteWins.score().toPawns());
            assertEquals("M+0", whiteWins.score().format());
            assertFalse(whiteWins.hasBestMove());
            assertEquals(-Score.MATE_PAWNS, blackWins.score().toPawns());
            assertEquals("M-0", blackWins.score().format());
        }
    }

    @Test
    public void engineDyingMidSearchShouldBeUnavailable() {
        try(UciProcessEvaluator evaluator = new UciProcessEvaluator(fakeEngine("crash"), Map.of())) {
            assertTrue(evaluator.isAvailable());
            assertThrows(EvaluatorUnavailableException.class,
                    () -> evaluator.analyse("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", SearchLimit.depth(2)));
        }
    }

    @Test
    public void closeShouldBeRepeatable() {
        UciProcessEvaluator evaluator = new UciProcessEvaluator(fakeEngine(), Map.of());
        assertTrue(evaluator.isAvailable());
        evaluator.close();
        evaluator.close();
    }
}
