package max.coach.analysis;

import max.coach.classify.MoveClassifier;
import max.coach.evaluator.SearchLimit;

public final class AnalyzerConfig {

    // Evaluator budget per position
    public final int depth;                 // -1 to search by time only
    public final long moveTimeMs;           // -1 to search by depth only

    // Live blunder check
    public final int blunderThresholdCp;    // centipawns lost above which a move is flagged

    // Review output
    public final int criticalMovesInSummary;
    public final int principalVariationMoves;

    private AnalyzerConfig(Builder b) {
        depth = b.depth;
        moveTimeMs = b.moveTimeMs;
        blunderThresholdCp = b.blunderThresholdCp;
        criticalMovesInSummary = b.criticalMovesInSummary;
        principalVariationMoves = b.principalVariationMoves;
    }

    public SearchLimit searchLimit() {
        return new SearchLimit(depth, moveTimeMs);
    }

    /**
     * Defaults, overridden by the {@code analysis.depth}, {@code analysis.movetime},
     * {@code analysis.blunderThresholdCp} and {@code analysis.criticalMovesInSummary} system properties.
     */
    public static AnalyzerConfig defaults() {
        return fromSystemProperties().build();
    }

    public static Builder fromSystemProperties() {
        return new Builder()
                .depth(Integer.parseInt(System.getProperty("analysis.depth", "12")))
                .moveTimeMs(Long.parseLong(System.getProperty("analysis.movetime", "-1")))
                .blunderThresholdCp(Integer.parseInt(System.getProperty("analysis.blunderThresholdCp",
                        String.valueOf(MoveClassifier.MISTAKE_THRESHOLD_CP))))
                .criticalMovesInSummary(Integer.parseInt(System.getProperty("analysis.criticalMovesInSummary", "5")));
    }

    public Builder toBuilder() {
        return new Builder()
                .depth(depth)
                .moveTimeMs(moveTimeMs)
                .blunderThresholdCp(blunderThresholdCp)
                .criticalMovesInSummary(criticalMovesInSummary)
                .principalVariationMoves(principalVariationMoves);
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{depth=" + depth + ", moveTimeMs=" + moveTimeMs
                + ", blunderThresholdCp=" + blunderThresholdCp
                + ", criticalMovesInSummary=" + criticalMovesInSummary
                + ", principalVariationMoves=" + principalVariationMoves + '}';
    }

    public static class Builder {
        private int depth = 12;
        private long moveTimeMs = SearchLimit.UNSET;
        private int blunderThresholdCp = MoveClassifier.MISTAKE_THRESHOLD_CP;
        private int criticalMovesInSummary = 5;
        private int principalVariationMoves = 5;

        public Builder depth(int v){depth=v;return this;}
        public Builder moveTimeMs(long v){moveTimeMs=v;return this;}
        public Builder blunderThresholdCp(int v){blunderThresholdCp=v;return this;}
        public Builder criticalMovesInSummary(int v){criticalMovesInSummary=v;return this;}
        public Builder principalVariationMoves(int v){principalVariationMoves=v;return this;}

        public AnalyzerConfig build() {
            // fails early on a limit the evaluator could not use
            new SearchLimit(depth, moveTimeMs);
            if(blunderThresholdCp <= 0) {
                throw new IllegalArgumentException("blunderThresholdCp must be positive: " + blunderThresholdCp);
            }
            if(criticalMovesInSummary < 0 || principalVariationMoves < 0) {
                throw new IllegalArgumentException("Summary sizes cannot be negative");
            }
            return new AnalyzerConfig(this);
        }
    }
}
