package max.coach.rules.notations;

import max.coach.rules.Game;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A recorded game: PGN tags, the starting position and the main line in SAN.
 */
public record GameRecord(Map<String, String> tags, String startFen, List<String> sanMoves) {

    public GameRecord {
        Objects.requireNonNull(startFen);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        sanMoves = List.copyOf(sanMoves);
    }

    public static GameRecord fromMoves(List<String> sanMoves) {
        return new GameRecord(Map.of(), Game.STANDARD_GAME, sanMoves);
    }

    public String tag(String name) {
        return tags.get(name);
    }
}
