package max.coach.tactics;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import max.coach.common.Square;

import java.util.Objects;

/**
 * A tactical pattern found in a position. The attacker square may be {@link Square#NONE};
 * target squares are never empty.
 */
public record Motif(MotifType type, int attackerSquare, IntList targetSquares, String description, Severity severity) {

    public Motif {
        Objects.requireNonNull(type);
        Objects.requireNonNull(severity);
        Objects.requireNonNull(description);
        if(targetSquares == null || targetSquares.isEmpty()) {
            throw new IllegalArgumentException(type.label() + " motif needs at least one target square");
        }
        targetSquares = IntLists.unmodifiable(new IntArrayList(targetSquares));
    }

    public boolean hasAttacker() {
        return attackerSquare != Square.NONE;
    }

    /** Same pattern on the same squares, whoever creates it. */
    public boolean sameThreatAs(Motif other) {
        return type == other.type && targetSquares.equals(other.targetSquares);
    }

    @Override
    public String toString() {
        return "[" + severity.label() + "] " + type.label() + ": " + description;
    }
}
