package max.coach.analysis;

import max.coach.rules.notations.GameRecord;
import max.coach.rules.notations.PgnParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
public class BatchGameAnalyzerTest {
    private static final AnalyzerConfig CONFIG = new AnalyzerConfig.Builder().depth(8).build();

    private final List<ScriptedEvaluator> sessions = Collections.synchronizedList(new ArrayList<>());

    private ScriptedEvaluator newSession() {
        ScriptedEvaluator evaluator = ScriptedEvaluator.forQueenRaid();
        sessions.add(evaluator);
        return evaluator;
    }

    @Test
    public void gamesShouldBeAnalyzedInInputOrder() {
        // Given
        GameRecord raid = PgnParser.parse(ScriptedEvaluator.QUEEN_RAID_PGN);
        GameRecord shortGame = GameRecord.fromMoves(List.of("e4", "e5"));
        List<GameRecord> games = List.of(raid, shortGame, raid, shortGame);

        // When
        List<GameAnalysis> results;
        try(BatchGameAnalyzer batch = new BatchGameAnalyzer(this::newSession, CONFIG, 3)) {
            results = batch.analyzeAll(games);
        }

        // Then
        assertEquals(List.of(5, 2, 5, 2), results.stream().map(analysis -> analysis.moves().size()).toList());
        assertEquals(results.get(0), results.get(2));
        assertEquals(4, sessions.size());
        assertTrue(sessions.stream().allMatch(session -> session.closed));
    }

    @Test
    public void failingGameShouldNotAffectTheOthers() {
        GameRecord raid = PgnParser.parse(ScriptedEvaluator.QUEEN_RAID_PGN);
        GameRecord broken = GameRecord.fromMoves(List.of("e4", "Ke7"));

        try(BatchGameAnalyzer batch = new BatchGameAnalyzer(this::newSession, CONFIG, 2)) {
            List<CompletableFuture<GameAnalysis>> futures = batch.submit(List.of(raid, broken, raid));

            assertEquals(5, futures.get(0).join().moves().size());
            CompletionException failure = assertThrows(CompletionException.class, () -> futures.get(1).join());
            assertInstanceOf(InvalidGameRecordException.class, failure.getCause());
            assertEquals(5, futures.get(2).join().moves().size());
        }
        assertTrue(sessions.stream().allMatch(session -> session.closed));
    }

    @Test
    public void analyzeAllShouldSurfaceTheFailure() {
        GameRecord broken = GameRecord.fromMoves(List.of("e4", "Ke7"));

        try(BatchGameAnalyzer batch = new BatchGameAnalyzer(this::newSession, CONFIG, 2)) {
            CompletionException failure = assertThrows(CompletionException.class,
                    () -> batch.analyzeAll(List.of(GameRecord.fromMoves(List.of("d4")), broken)));
            assertInstanceOf(InvalidGameRecordException.class, failure.getCause());
        }
    }

    @Test
    public void parallelismShouldBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new BatchGameAnalyzer(this::newSession, CONFIG, 0));
    }
}
