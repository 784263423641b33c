package max.coach.evaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the engine side of the UCI protocol: {@code info} and {@code bestmove} lines.
 */
public final class UciInfoParser {
    private static final Logger log = LoggerFactory.getLogger(UciInfoParser.class);

    /**
     * Search progress carried by one {@code info} line. Score is null when the line has none, and
     * is seen from the side to move, as UCI sends it.
     */
    public record Info(int depth, int multiPv, Score score, boolean bound, long nodes, List<String> principalVariation) {

        public Info {
            principalVariation = List.copyOf(principalVariation);
        }

        public boolean hasScore() {
            return score != null;
        }
    }

    private UciInfoParser() {
    }

    public static boolean isInfo(String line) {
        return line.startsWith("info ");
    }

    public static boolean isBestMove(String line) {
        return line.startsWith("bestmove");
    }

    /**
     * info depth 12 seldepth 18 multipv 1 score cp 35 nodes 123456 nps 900000 pv e2e4 e7e5 ...
     * Unknown tokens are skipped, {@code string} ends the line.
     */
    public static Info parseInfo(String line) {
        String[] tokens = line.trim().split("\\s+");
        int depth = 0;
        int multiPv = 1;
        Score score = null;
        boolean bound = false;
        long nodes = 0;
        List<String> pv = new ArrayList<>();

        for(int i = 1; i < tokens.length; i++) {
            String token = tokens[i];
            switch (token) {
                case "depth" -> depth = parseInt(tokens, ++i, depth);
                case "multipv" -> multiPv = parseInt(tokens, ++i, multiPv);
                case "nodes" -> nodes = parseLong(tokens, ++i, nodes);
                case "score" -> {
                    if(i + 2 < tokens.length) {
                        String kind = tokens[i + 1];
                        Integer value = parseIntOrNull(tokens[i + 2]);
                        if(value != null && kind.equals("cp")) {
                            score = Score.centipawns(value);
                        } else if(value != null && kind.equals("mate")) {
                            score = Score.mateIn(value);
                        } else {
                            log.warn("Malformed score '{} {}' in engine output, ignoring it", kind, tokens[i + 2]);
                        }
                        i += 2;
                        if(i + 1 < tokens.length && (tokens[i + 1].equals("lowerbound") || tokens[i + 1].equals("upperbound"))) {
                            bound = true;
                            i++;
                        }
                    } else {
                        i = tokens.length;
                    }
                }
                case "pv" -> {
                    for(i = i + 1; i < tokens.length; i++) {
                        pv.add(tokens[i]);
                    }
                }
                case "string" -> i = tokens.length;
                default -> {
                    // seldepth, nps, time, hashfull, currmove... are not needed
                }
            }
        }
        return new Info(depth, multiPv, score, bound, nodes, pv);
    }

    /**
     * bestmove e2e4 [ponder e7e5]; null for "bestmove (none)" or a truncated line.
     */
    public static String parseBestMove(String line) {
        String[] tokens = line.trim().split("\\s+");
        if(tokens.length < 2 || tokens[1].equals("(none)") || tokens[1].equals("0000")) {
            return null;
        }
        return tokens[1];
    }

    private static int parseInt(String[] tokens, int index, int fallback) {
        if(index >= tokens.length) {
            return fallback;
        }
        Integer value = parseIntOrNull(tokens[index]);
        return value == null ? fallback : value;
    }

    private static long parseLong(String[] tokens, int index, long fallback) {
        if(index >= tokens.length) {
            return fallback;
        }
        try {
            return Long.parseLong(tokens[index]);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Integer parseIntOrNull(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
