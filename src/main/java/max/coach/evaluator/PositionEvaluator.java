package max.coach.evaluator;

/**
 * A session with an external engine able to score positions. One session serves one analysis at a
 * time; concurrent analyses each open their own.
 */
public interface PositionEvaluator extends AutoCloseable {

    /**
     * @return true when the session can answer queries, starting it if needed
     */
    boolean isAvailable();

    /**
     * Searches the position and returns the best move and the score from White's point of view.
     *
     * @throws EvaluatorUnavailableException when the engine cannot be reached or gives no answer
     */
    EngineAnalysis analyse(String fen, SearchLimit limit);

    /** Tells the engine the following positions belong to a new game. */
    default void newGame() {
    }

    @Override
    void close();
}
