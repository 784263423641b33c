package max.coach.classify;

import java.util.Locale;

/**
 * Maps an evaluation change plus a few flags to a {@link Classification}, and writes the matching comment.
 * Evaluations are in pawns; the change is seen from the side that moved.
 */
public final class MoveClassifier {
    public static final int INACCURACY_THRESHOLD_CP = 50;
    public static final int MISTAKE_THRESHOLD_CP = 100;
    public static final int BLUNDER_THRESHOLD_CP = 200;

    static final int BRILLIANT_SACRIFICE_GAIN_CP = 50;
    static final int GREAT_MOVE_GAIN_CP = 100;
    static final int BEST_MOVE_TOLERANCE_CP = 10;
    static final double LOSING_POSITION = -1.0;

    // Slack for floating-point noise on band edges, far below one centipawn
    private static final double EDGE_EPSILON = 1e-9;

    private MoveClassifier() {
    }

    /**
     * First matching rule wins: sacrifice brilliancy, only-move brilliancy, great, best/good, then the
     * error bands. Each band edge is inclusive on the real value: -0.50 (even computed as -0.5000000001)
     * is still a good move, -0.504 is already an inaccuracy.
     */
    public static Classification classify(double evalChange, boolean hadBetterMove, boolean isSacrifice,
                                          double evalBefore, double evalAfter, boolean isOnlyGoodMove) {
        if(isSacrifice && reaches(evalChange, BRILLIANT_SACRIFICE_GAIN_CP)) {
            return Classification.BRILLIANT;
        }
        if(isOnlyGoodMove && evalBefore < LOSING_POSITION && evalAfter > 0) {
            return Classification.BRILLIANT;
        }
        if(reaches(evalChange, GREAT_MOVE_GAIN_CP) && !hadBetterMove) {
            return Classification.GREAT;
        }
        if(reaches(evalChange, -BEST_MOVE_TOLERANCE_CP)) {
            return hadBetterMove ? Classification.GOOD : Classification.BEST;
        } else if(reaches(evalChange, -INACCURACY_THRESHOLD_CP)) {
            return Classification.GOOD;
        } else if(reaches(evalChange, -MISTAKE_THRESHOLD_CP)) {
            return Classification.INACCURACY;
        } else if(reaches(evalChange, -BLUNDER_THRESHOLD_CP)) {
            return Classification.MISTAKE;
        }
        return Classification.BLUNDER;
    }

    private static boolean reaches(double evalChange, int thresholdCp) {
        return evalChange >= thresholdCp / 100.0 - EDGE_EPSILON;
    }

    public static Classification classify(double evalChange, boolean hadBetterMove) {
        return classify(evalChange, hadBetterMove, false, 0.0, 0.0, false);
    }

    /**
     * @param bestMove SAN of the better move, or null when the played move was the best one
     */
    public static String comment(Classification classification, double evalChange, String bestMove, boolean isSacrifice) {
        String magnitude = pawns(Math.abs(evalChange));
        return switch (classification) {
            case BRILLIANT -> isSacrifice ? "Brilliant sacrifice!" : "Brilliant! The only winning move.";
            case GREAT -> "Great move! Gains " + pawns(evalChange) + " pawns.";
            case BEST -> "Best move.";
            case GOOD -> "Good move.";
            case BOOK -> "Book move.";
            case INACCURACY -> bestMove != null ? "Inaccuracy. " + bestMove + " was better." : "Slight inaccuracy.";
            case MISTAKE -> bestMove != null
                    ? "Mistake! " + bestMove + " was much better (" + magnitude + " pawns lost)."
                    : "Mistake! (" + magnitude + " pawns lost)";
            case BLUNDER -> bestMove != null
                    ? "Blunder! " + bestMove + " was winning. (" + magnitude + " pawns lost)"
                    : "Blunder! (" + magnitude + " pawns lost)";
        };
    }

    private static String pawns(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
