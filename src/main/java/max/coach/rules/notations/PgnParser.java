package max.coach.rules.notations;

import max.coach.rules.Game;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the first game of a PGN text: tag pairs and the main line of the movetext.
 * Comments, variations, NAGs, move numbers and the result token are skipped. Moves are
 * not validated here, replaying them is up to the caller.
 */
public final class PgnParser {
    private static final Pattern TAG_PATTERN = Pattern.compile("^\\[\\s*(\\w+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s*]$");
    private static final Pattern MOVE_NUMBER_PATTERN = Pattern.compile("^\\d+\\.+");

    private PgnParser() {
    }

    public static GameRecord parse(String pgn) {
        if(pgn == null) {
            throw new IllegalArgumentException("PGN text is null");
        }
        Map<String, String> tags = new LinkedHashMap<>();
        StringBuilder moveText = new StringBuilder();
        boolean inMoveText = false;
        for(String rawLine : pgn.split("\\R")) {
            String line = rawLine.trim();
            if(!inMoveText && line.startsWith("[")) {
                Matcher matcher = TAG_PATTERN.matcher(line);
                if(!matcher.matches()) {
                    throw new IllegalArgumentException("Malformed PGN tag: " + line);
                }
                tags.put(matcher.group(1), matcher.group(2).replace("\\\"", "\"").replace("\\\\", "\\"));
                continue;
            }
            if(line.isEmpty() && !inMoveText) {
                continue;
            }
            if(line.startsWith("%")) {
                continue;
            }
            inMoveText = true;
            moveText.append(rawLine).append('\n');
        }

        String startFen = tags.getOrDefault("FEN", Game.STANDARD_GAME);
        return new GameRecord(tags, startFen, readMoves(moveText.toString()));
    }

    public static GameRecord fromMoveText(String moveText) {
        return new GameRecord(Map.of(), Game.STANDARD_GAME, readMoves(moveText));
    }

    static List<String> readMoves(String moveText) {
        List<String> moves = new ArrayList<>();
        int variationDepth = 0;
        int index = 0;
        int length = moveText.length();
        while(index < length) {
            char character = moveText.charAt(index);
            if(character == '{') {
                int end = moveText.indexOf('}', index);
                if(end == -1) {
                    throw new IllegalArgumentException("Unterminated comment in PGN movetext");
                }
                index = end + 1;
                continue;
            }
            if(character == ';') {
                int end = moveText.indexOf('\n', index);
                index = end == -1 ? length : end + 1;
                continue;
            }
            if(character == '(') {
                variationDepth++;
                index++;
                continue;
            }
            if(character == ')') {
                if(variationDepth == 0) {
                    throw new IllegalArgumentException("Unbalanced variation in PGN movetext");
                }
                variationDepth--;
                index++;
                continue;
            }
            if(Character.isWhitespace(character)) {
                index++;
                continue;
            }

            int end = index;
            while(end < length && !Character.isWhitespace(moveText.charAt(end)) && "{};()".indexOf(moveText.charAt(end)) < 0) {
                end++;
            }
            String token = moveText.substring(index, end);
            index = end;
            if(variationDepth > 0) {
                continue;
            }
            String move = toMoveToken(token);
            if(move == null) {
                if(isResult(token)) {
                    break;
                }
                continue;
            }
            moves.add(move);
        }
        if(variationDepth != 0) {
            throw new IllegalArgumentException("Unbalanced variation in PGN movetext");
        }
        return moves;
    }

    // null when the token carries no move (NAG, move number, result)
    private static String toMoveToken(String token) {
        if(token.startsWith("$") || isResult(token)) {
            return null;
        }
        String move = MOVE_NUMBER_PATTERN.matcher(token).replaceFirst("");
        return move.isEmpty() ? null : move;
    }

    private static boolean isResult(String token) {
        return token.equals("1-0") || token.equals("0-1") || token.equals("1/2-1/2") || token.equals("*");
    }
}
