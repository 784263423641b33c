package max.coach.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import max.coach.common.Color;

import java.util.List;

/**
 * What is carried from one half-move to the next while a game is reviewed. Each step returns a new
 * state; the reviewed moves themselves are collected by the caller and handed to
 * {@link #toGameAnalysis(List, int)} once.
 *
 * @param moveNumber full-move number of the next half-move
 * @param previousEval evaluation after the last half-move (White's point of view), 0.0 at the start
 */
public record AnalysisState(int moveNumber, double previousEval, ErrorCounts white, ErrorCounts black) {

    public static AnalysisState initial(int firstMoveNumber) {
        return new AnalysisState(firstMoveNumber, 0.0, ErrorCounts.NONE, ErrorCounts.NONE);
    }

    public AnalysisState after(MoveAnalysis move) {
        boolean white = move.color() == Color.WHITE;
        ErrorCounts nextWhite = white ? this.white.record(move.classification()) : this.white;
        ErrorCounts nextBlack = white ? this.black : this.black.record(move.classification());
        int nextMoveNumber = white ? moveNumber : moveNumber + 1;

        return new AnalysisState(nextMoveNumber, move.evalAfter(), nextWhite, nextBlack);
    }

    /**
     * @param moves every half-move folded into this state, in game order
     */
    public GameAnalysis toGameAnalysis(List<MoveAnalysis> moves, int criticalMovesInSummary) {
        IntList criticalMoments = new IntArrayList();
        for(MoveAnalysis move : moves) {
            if(move.classification().isCritical()) {
                criticalMoments.add(move.moveNumber());
            }
        }
        String summary = GameSummary.write(moves, white, black, criticalMovesInSummary);
        return new GameAnalysis(moves, white, black, criticalMoments, summary);
    }
}
