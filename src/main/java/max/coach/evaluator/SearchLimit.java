package max.coach.evaluator;

/**
 * Budget of one evaluator query. -1 leaves a bound unset.
 */
public record SearchLimit(int depth, long moveTimeMs) {
    public static final int UNSET = -1;

    public SearchLimit {
        if(depth == UNSET && moveTimeMs == UNSET) {
            throw new IllegalArgumentException("A search limit needs a depth or a move time");
        }
        if(depth < UNSET || depth == 0 || moveTimeMs < UNSET || moveTimeMs == 0) {
            throw new IllegalArgumentException("Invalid search limit depth=" + depth + " movetime=" + moveTimeMs);
        }
    }

    public static SearchLimit depth(int depth) {
        return new SearchLimit(depth, UNSET);
    }

    public static SearchLimit moveTime(long moveTimeMs) {
        return new SearchLimit(UNSET, moveTimeMs);
    }

    public String toGoCommand() {
        StringBuilder go = new StringBuilder("go");
        if(depth != UNSET) {
            go.append(" depth ").append(depth);
        }
        if(moveTimeMs != UNSET) {
            go.append(" movetime ").append(moveTimeMs);
        }
        return go.toString();
    }
}
