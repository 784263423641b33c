package max.coach.common;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Read-only view over a position, as supplied by the rules engine. Tactical scans only go through this.
 */
public interface PositionView {
    /** Piece on the square or {@code null} when empty. */
    Piece pieceAt(int square);

    Color sideToMove();

    /** Square of the king of that color, or {@link Square#NONE} when there is none. */
    int kingSquare(Color color);

    /** Squares holding pieces of {@code color} that attack {@code square}, ascending. */
    IntList attackers(Color color, int square);

    /** Squares attacked by the piece standing on {@code square}, ascending; empty when the square is empty. */
    IntList attacks(int square);
}
