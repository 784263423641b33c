package max.coach.analysis;

import max.coach.tactics.MaterialBalance;
import max.coach.tactics.Motif;

import java.util.List;

/**
 * Snapshot of a position for a tutoring view.
 *
 * @param evaluation formatted score from White's point of view ("0.3", "M3")
 * @param bestMove SAN, null when the side to move has no move
 * @param principalVariation expected line in SAN
 * @param tactical true when the score shows a mate or more than 1.5 pawns
 */
public record PositionAssessment(String evaluation, String bestMove, List<String> principalVariation,
                                 boolean tactical, MaterialBalance material, List<Motif> motifs) {

    public PositionAssessment {
        principalVariation = List.copyOf(principalVariation);
        motifs = List.copyOf(motifs);
    }
}
