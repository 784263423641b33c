package max.coach.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import max.coach.common.Color;

import java.util.List;

/**
 * Review of a whole game.
 *
 * @param criticalMoments full-move numbers of the critical half-moves, in game order
 */
public record GameAnalysis(List<MoveAnalysis> moves, ErrorCounts white, ErrorCounts black,
                           IntList criticalMoments, String summary) {

    public GameAnalysis {
        moves = List.copyOf(moves);
        criticalMoments = IntLists.unmodifiable(new IntArrayList(criticalMoments));
    }

    public ErrorCounts errors(Color color) {
        return color.isWhite() ? white : black;
    }

    public List<MoveAnalysis> criticalMoves() {
        return moves.stream().filter(move -> move.classification().isCritical()).toList();
    }
}
