package max.coach.analysis;

import max.coach.classify.Classification;
import max.coach.classify.MoveClassifier;
import max.coach.evaluator.EngineAnalysis;
import max.coach.evaluator.EvaluatorUnavailableException;
import max.coach.evaluator.PositionEvaluator;
import max.coach.rules.Game;
import max.coach.rules.IllegalMoveException;
import max.coach.rules.Move;
import max.coach.rules.notations.SanUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Quick "was that a blunder?" feedback during play: the position is scored before and after the move
 * and the loss compared with {@link AnalyzerConfig#blunderThresholdCp}.
 */
public class BlunderChecker {
    private static final Logger log = LoggerFactory.getLogger(BlunderChecker.class);

    private final PositionEvaluator evaluator;
    private final AnalyzerConfig config;

    public BlunderChecker(PositionEvaluator evaluator, AnalyzerConfig config) {
        this.evaluator = Objects.requireNonNull(evaluator);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * The game is left untouched.
     *
     * @throws IllegalMoveException          when the move is not legal in the game
     * @throws EvaluatorUnavailableException when the evaluator cannot answer
     */
    public BlunderCheck check(Game game, Move move) {
        if(!evaluator.isAvailable()) {
            throw new EvaluatorUnavailableException("Position evaluator is not available, cannot check move");
        }
        Game scratch = game.copy();
        if(!scratch.isLegal(move)) {
            throw new IllegalMoveException("Move " + move + " is not legal in " + scratch.toFen());
        }
        boolean white = scratch.currentPlayer.isWhite();

        EngineAnalysis beforeMove = evaluator.analyse(scratch.toFen(), config.searchLimit());
        String bestSan = GameAnalyzer.bestMoveSan(scratch, beforeMove);
        String playedSan = SanUtils.toSan(scratch, move);

        scratch.playMove(move);
        EngineAnalysis afterMove = evaluator.analyse(scratch.toFen(), config.searchLimit());

        double evalBefore = beforeMove.score().toPawns();
        double evalAfter = afterMove.score().toPawns();
        double change = white ? evalAfter - evalBefore : evalBefore - evalAfter;
        int evalLossCp = (int) Math.round(-change * 100);

        boolean blunder = evalLossCp > config.blunderThresholdCp;
        boolean playedBest = playedSan.equals(bestSan);
        String bestMove = blunder && !playedBest ? bestSan : null;
        Classification classification = MoveClassifier.classify(change, bestSan != null && !playedBest);

        log.debug("{} loses {} cp: {}", playedSan, evalLossCp, classification.label());
        return new BlunderCheck(blunder, bestMove, evalLossCp, classification);
    }
}
