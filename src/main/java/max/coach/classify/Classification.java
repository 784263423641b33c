package max.coach.classify;

/**
 * Move quality, best first.
 */
public enum Classification {
    BRILLIANT,
    GREAT,
    BEST,
    GOOD,
    // assigned from an opening book lookup, never computed by the classifier
    BOOK,
    INACCURACY,
    MISTAKE,
    BLUNDER;

    public String label() {
        return name().toLowerCase();
    }

    public boolean isError() {
        return this == INACCURACY || this == MISTAKE || this == BLUNDER;
    }

    /** Moves worth pointing out in a review: serious errors and exceptional finds. */
    public boolean isCritical() {
        return this == BLUNDER || this == MISTAKE || this == BRILLIANT || this == GREAT;
    }
}
