package max.coach.evaluator;

import max.coach.common.AnalysisException;

/**
 * The position evaluator could not be reached or gave no answer.
 */
public class EvaluatorUnavailableException extends AnalysisException {

    public EvaluatorUnavailableException(String message) {
        super(message);
    }

    public EvaluatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
