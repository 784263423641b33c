package max.coach.tactics;

import max.coach.rules.Game;
import max.coach.rules.GameChanges;
import max.coach.rules.Move;

import java.util.ArrayList;
import java.util.List;

public final class MoveTactics {

    private MoveTactics() {
    }

    /**
     * Plays the move, compares the motifs on both sides of it, and takes it back. A threat is a motif
     * whose type and targets did not exist before the move. The game is left as it was.
     */
    public static MoveThreats analyzeMoveTactics(Game game, Move move) {
        List<Motif> before = TacticalMotifDetector.analyzeTactics(game);
        List<Motif> after;
        GameChanges changes = game.playMove(move);
        try {
            after = TacticalMotifDetector.analyzeTactics(game);
        } finally {
            game.undoMove(changes);
        }

        List<Motif> threats = new ArrayList<>();
        for(Motif motif : after) {
            boolean isNew = before.stream().noneMatch(motif::sameThreatAs);
            if(isNew) {
                threats.add(motif);
            }
        }
        return new MoveThreats(!threats.isEmpty(), threats, after);
    }
}
