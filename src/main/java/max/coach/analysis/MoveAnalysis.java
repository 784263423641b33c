package max.coach.analysis;

import max.coach.classify.Classification;
import max.coach.common.Color;

import java.util.Objects;

/**
 * Review of one half-move. Evaluations are in pawns from White's point of view, except
 * {@code evalChange} which is seen from the mover.
 *
 * @param bestMove SAN of the engine move, only when it was better than the played one
 * @param bestEval evaluation of the engine move, null when the evaluator gave none
 */
public record MoveAnalysis(int moveNumber, Color color, String moveSan,
                           double evalBefore, double evalAfter, double evalChange,
                           String bestMove, Double bestEval,
                           Classification classification, String comment,
                           boolean capture, boolean check, boolean sacrifice,
                           String fenAfter) {

    public MoveAnalysis {
        if(moveNumber < 1) {
            throw new IllegalArgumentException("moveNumber starts at 1: " + moveNumber);
        }
        Objects.requireNonNull(color);
        Objects.requireNonNull(moveSan);
        Objects.requireNonNull(classification);
        Objects.requireNonNull(comment);
        Objects.requireNonNull(fenAfter);
    }

    public boolean hadBetterMove() {
        return bestMove != null;
    }
}
