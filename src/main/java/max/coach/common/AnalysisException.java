package max.coach.common;

/**
 * Root of the failures that abort an analysis call. Nothing partial is returned when one is thrown.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
