package max.coach.tactics;

import max.coach.common.PositionView;

import java.util.List;

public final class TacticalSummary {
    static final String NO_THREATS = "No immediate tactical threats detected.";
    private static final int MAX_LISTED = 3;

    private TacticalSummary() {
    }

    public static String describe(PositionView position) {
        return describe(TacticalMotifDetector.analyzeTactics(position));
    }

    // Critical threats first, then warnings; INFO motifs are left out
    public static String describe(List<Motif> motifs) {
        if(motifs.isEmpty()) {
            return NO_THREATS;
        }
        StringBuilder summary = new StringBuilder();
        appendSection(summary, "Critical threats:", motifs, Severity.CRITICAL);
        appendSection(summary, "Tactical features:", motifs, Severity.WARNING);
        return summary.toString();
    }

    private static void appendSection(StringBuilder summary, String title, List<Motif> motifs, Severity severity) {
        List<Motif> selected = motifs.stream()
                .filter(motif -> motif.severity() == severity)
                .limit(MAX_LISTED)
                .toList();
        if(selected.isEmpty()) {
            return;
        }
        if(!summary.isEmpty()) {
            summary.append('\n');
        }
        summary.append(title);
        for(Motif motif : selected) {
            summary.append("\n  - ").append(motif.description());
        }
    }
}
