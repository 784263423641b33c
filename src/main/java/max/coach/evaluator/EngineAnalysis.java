package max.coach.evaluator;

import java.util.List;
import java.util.Objects;

/**
 * Answer of one evaluator query.
 *
 * @param bestMove best move in UCI notation (e2e4), null when the side to move has no legal move
 * @param score evaluation from White's point of view
 * @param principalVariation expected line in UCI notation, starting with the best move
 */
public record EngineAnalysis(String bestMove, Score score, int depth, List<String> principalVariation, long nodes) {

    public EngineAnalysis {
        Objects.requireNonNull(score);
        principalVariation = principalVariation == null ? List.of() : List.copyOf(principalVariation);
    }

    public boolean hasBestMove() {
        return bestMove != null;
    }
}
