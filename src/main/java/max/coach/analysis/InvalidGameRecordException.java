package max.coach.analysis;

import max.coach.common.AnalysisException;

/**
 * The game record cannot be parsed or replayed. Raised before the evaluator is queried.
 */
public class InvalidGameRecordException extends AnalysisException {
    private final int halfMoveIndex;

    public InvalidGameRecordException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public InvalidGameRecordException(String message, int halfMoveIndex, Throwable cause) {
        super(message, cause);
        this.halfMoveIndex = halfMoveIndex;
    }

    /** 0-based index of the offending half-move, -1 when the record itself is broken. */
    public int halfMoveIndex() {
        return halfMoveIndex;
    }
}
