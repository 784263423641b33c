package max.coach.analysis;

import max.coach.common.Color;

import java.util.List;

public final class GameSummary {
    static final String TITLE = "Game Analysis Summary";

    private GameSummary() {
    }

    /**
     * Per-side error counts followed by the first critical moves with their comments:
     * <pre>
     * Critical moments:
     *   Move 3. Qxf7+ (white): Brilliant sacrifice!
     * </pre>
     */
    public static String write(List<MoveAnalysis> moves, ErrorCounts white, ErrorCounts black, int maxCriticalMoves) {
        StringBuilder summary = new StringBuilder();
        summary.append(TITLE).append('\n');
        summary.append("=".repeat(40)).append('\n');
        summary.append('\n');
        appendCounts(summary, Color.WHITE, white);
        summary.append('\n');
        appendCounts(summary, Color.BLACK, black);

        List<MoveAnalysis> critical = moves.stream()
                .filter(move -> move.classification().isCritical())
                .limit(maxCriticalMoves)
                .toList();
        if(!critical.isEmpty()) {
            summary.append('\n');
            summary.append("Critical moments:");
            for(MoveAnalysis move : critical) {
                summary.append('\n').append("  Move ").append(move.moveNumber()).append(". ").append(move.moveSan())
                        .append(" (").append(move.color().label()).append("): ").append(move.comment());
            }
        }
        return summary.toString();
    }

    private static void appendCounts(StringBuilder summary, Color color, ErrorCounts counts) {
        summary.append(color.displayName()).append(":\n");
        summary.append("  Blunders: ").append(counts.blunders()).append('\n');
        summary.append("  Mistakes: ").append(counts.mistakes()).append('\n');
        summary.append("  Inaccuracies: ").append(counts.inaccuracies()).append('\n');
    }
}
