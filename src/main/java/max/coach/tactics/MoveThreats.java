package max.coach.tactics;

import java.util.List;

/**
 * Outcome of {@link MoveTactics#analyzeMoveTactics}: the motifs a move introduces and every motif left after it.
 */
public record MoveThreats(boolean createsThreat, List<Motif> threats, List<Motif> motifsAfter) {

    public MoveThreats {
        threats = List.copyOf(threats);
        motifsAfter = List.copyOf(motifsAfter);
    }
}
