package max.coach.rules.notations;

import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.Square;
import max.coach.rules.Game;
import max.coach.rules.GameChanges;
import max.coach.rules.IllegalMoveException;
import max.coach.rules.Move;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Standard algebraic notation, written and read against the legal moves of a {@link Game}.
 */
public final class SanUtils {
    // piece letter, optional from file / rank, optional capture, target square, optional promotion
    private static final Pattern SAN_PATTERN =
            Pattern.compile("^([NBRQK])?([a-h])?([1-8])?(x)?([a-h][1-8])(?:=?([NBRQnbrq]))?$");

    private SanUtils() {
    }

    public static String toSan(Game game, Move move) {
        Piece piece = game.pieceAt(move.startPosition());
        if(piece == null) {
            throw new IllegalMoveException("No piece on " + Square.name(move.startPosition()) + " for move " + move);
        }
        String san = writeWithoutCheck(game, move, piece);

        GameChanges changes = game.playMove(move);
        try {
            if(game.inCheck()) {
                san += game.getLegalMoves().isEmpty() ? "#" : "+";
            }
        } finally {
            game.undoMove(changes);
        }
        return san;
    }

    private static String writeWithoutCheck(Game game, Move move, Piece piece) {
        int from = move.startPosition();
        int to = move.endPosition();
        if(piece.type() == PieceType.KING && Math.abs(to - from) == 2) {
            return to > from ? "O-O" : "O-O-O";
        }

        StringBuilder san = new StringBuilder();
        boolean capture = game.isCapture(move);
        if(piece.type() == PieceType.PAWN) {
            if(capture) {
                san.append((char) ('a' + Square.file(from)));
            }
        } else {
            san.append(piece.type().sanLetter());
            san.append(disambiguation(game, move, piece));
        }
        if(capture) {
            san.append('x');
        }
        san.append(Square.name(to));
        if(move.promotion() != null) {
            san.append('=').append(move.promotion().sanLetter());
        }
        return san.toString();
    }

    private static String disambiguation(Game game, Move move, Piece piece) {
        List<Move> rivals = new ArrayList<>();
        for(Move other : game.getLegalMoves()) {
            if(other.endPosition() == move.endPosition()
                    && other.startPosition() != move.startPosition()
                    && piece.equals(game.pieceAt(other.startPosition()))) {
                rivals.add(other);
            }
        }
        if(rivals.isEmpty()) {
            return "";
        }
        int from = move.startPosition();
        boolean fileIsUnique = rivals.stream().noneMatch(rival -> Square.file(rival.startPosition()) == Square.file(from));
        if(fileIsUnique) {
            return String.valueOf((char) ('a' + Square.file(from)));
        }
        boolean rankIsUnique = rivals.stream().noneMatch(rival -> Square.rank(rival.startPosition()) == Square.rank(from));
        if(rankIsUnique) {
            return String.valueOf((char) ('1' + Square.rank(from)));
        }
        return Square.name(from);
    }

    public static Move parseSan(Game game, String san) {
        if(san == null || san.isBlank()) {
            throw new IllegalMoveException("Empty SAN move");
        }
        String cleaned = stripDecorations(san.trim());
        List<Move> legalMoves = game.getLegalMoves();

        if(cleaned.equals("O-O") || cleaned.equals("0-0")) {
            return findCastling(game, legalMoves, true, san);
        }
        if(cleaned.equals("O-O-O") || cleaned.equals("0-0-0")) {
            return findCastling(game, legalMoves, false, san);
        }

        Matcher matcher = SAN_PATTERN.matcher(cleaned);
        if(!matcher.matches()) {
            throw new IllegalMoveException("Cannot parse SAN move " + san);
        }
        PieceType pieceType = matcher.group(1) == null ? PieceType.PAWN : PieceType.fromLetter(matcher.group(1).charAt(0));
        int fromFile = matcher.group(2) == null ? -1 : matcher.group(2).charAt(0) - 'a';
        int fromRank = matcher.group(3) == null ? -1 : matcher.group(3).charAt(0) - '1';
        int target = Square.parse(matcher.group(5));
        PieceType promotion = matcher.group(6) == null ? null : PieceType.fromLetter(matcher.group(6).charAt(0));

        Move found = null;
        for(Move move : legalMoves) {
            if(move.endPosition() != target || move.promotion() != promotion) {
                continue;
            }
            Piece piece = game.pieceAt(move.startPosition());
            if(piece.type() != pieceType) {
                continue;
            }
            if(fromFile != -1 && Square.file(move.startPosition()) != fromFile) {
                continue;
            }
            if(fromRank != -1 && Square.rank(move.startPosition()) != fromRank) {
                continue;
            }
            if(found != null) {
                throw new IllegalMoveException("Ambiguous SAN move " + san + " in " + game.toFen());
            }
            found = move;
        }
        if(found == null) {
            throw new IllegalMoveException("Illegal SAN move " + san + " in " + game.toFen());
        }
        return found;
    }

    private static Move findCastling(Game game, List<Move> legalMoves, boolean kingSide, String san) {
        int kingSquare = game.kingSquare(game.currentPlayer);
        int target = kingSide ? kingSquare + 2 : kingSquare - 2;
        for(Move move : legalMoves) {
            if(move.startPosition() == kingSquare && move.endPosition() == target) {
                return move;
            }
        }
        throw new IllegalMoveException("Illegal castling " + san + " in " + game.toFen());
    }

    // Check marks and annotation glyphs (+, #, !, ?) carry no move information
    static String stripDecorations(String san) {
        int end = san.length();
        while(end > 0 && "+#!?".indexOf(san.charAt(end - 1)) >= 0) {
            end--;
        }
        return san.substring(0, end);
    }
}
