package max.coach.evaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * An engine score: centipawns, or moves to mate when {@code mate} is set (negative when getting mated).
 * <p>
 * A mate distance of 0 is a position that is already checkmate. Its sign cannot live in {@code value},
 * so {@code povMates} tells whether the point-of-view side gave the mate. UCI sends {@code mate 0}
 * from the side to move, which is the mated side.
 */
public record Score(boolean mate, int value, boolean povMates) {
    private static final Logger log = LoggerFactory.getLogger(Score.class);

    /** Pawn value standing in for a forced mate. */
    public static final double MATE_PAWNS = 1000.0;
    public static final Score EVEN = centipawns(0);

    public Score {
        if(!mate) {
            povMates = false;
        } else if(value != 0) {
            povMates = value > 0;
        }
    }

    public Score(boolean mate, int value) {
        this(mate, value, false);
    }

    public static Score centipawns(int centipawns) {
        return new Score(false, centipawns);
    }

    public static Score mateIn(int moves) {
        return new Score(true, moves);
    }

    public Score negate() {
        return new Score(mate, -value, mate && !povMates);
    }

    public double toPawns() {
        if(mate) {
            return povMates ? MATE_PAWNS : -MATE_PAWNS;
        }
        return value / 100.0;
    }

    /** Centipawns, with mates clamped to +-100000. */
    public int toCentipawns() {
        return mate ? (povMates ? 100_000 : -100_000) : value;
    }

    // "0.3", "-1.2", "M3", "M-2", and "M+0" / "M-0" for a mate already on the board
    public String format() {
        if(mate) {
            if(value == 0) {
                return povMates ? "M+0" : "M-0";
            }
            return "M" + value;
        }
        return String.format(Locale.ROOT, "%.1f", value / 100.0);
    }

    /**
     * Reads a formatted score back into pawns. Text that is neither a number nor a mate marker is
     * logged and read as an even position.
     */
    public static double parsePawns(String text) {
        if(text == null || text.isBlank()) {
            log.warn("Missing score, reading it as 0.0");
            return 0.0;
        }
        String trimmed = text.trim();
        try {
            if(trimmed.startsWith("M") || trimmed.startsWith("#")) {
                String distance = trimmed.substring(1);
                int moves = Integer.parseInt(distance.replace("+", ""));
                if(moves == 0) {
                    // bare "M0" follows UCI: the side it is scored for is mated
                    return distance.startsWith("+") ? MATE_PAWNS : -MATE_PAWNS;
                }
                return moves > 0 ? MATE_PAWNS : -MATE_PAWNS;
            }
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            log.warn("Malformed score '{}', reading it as 0.0", trimmed);
            return 0.0;
        }
    }

    @Override
    public String toString() {
        return format();
    }
}
