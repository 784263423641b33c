package max.coach.tactics;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.PositionView;
import max.coach.common.Square;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Scans a position for pins, forks, hanging pieces and skewers. Every scan is a pure function of
 * the {@link PositionView}; nothing here calls an engine.
 */
public final class TacticalMotifDetector {
    private static final int[] STRAIGHT_DIRECTIONS = {-8, 8, -1, 1};
    private static final int[] DIAGONAL_DIRECTIONS = {-9, -7, 7, 9};
    private static final int MAX_NAMED_FORK_TARGETS = 3;

    private TacticalMotifDetector() {
    }

    /**
     * All motifs of the position: pins, then forks, then hanging pieces, then skewers.
     */
    public static List<Motif> analyzeTactics(PositionView position) {
        List<Motif> motifs = new ArrayList<>();
        motifs.addAll(findPins(position));
        motifs.addAll(findForks(position));
        motifs.addAll(findHangingPieces(position));
        motifs.addAll(findSkewers(position));
        return motifs;
    }

    /**
     * Absolute pins: an own piece on a line with its king, with an enemy slider moving along that
     * line behind it. Only the part of the line beyond the pinned piece is walked.
     */
    public static List<Motif> findPins(PositionView position) {
        List<Motif> motifs = new ArrayList<>();
        for(Color color : Color.values()) {
            int kingSquare = position.kingSquare(color);
            if(kingSquare == Square.NONE) {
                continue;
            }
            for(int square = 0; square < 64; square++) {
                Piece piece = position.pieceAt(square);
                if(piece == null || piece.color() != color || square == kingSquare) {
                    continue;
                }
                int pinner = findPinner(position, square, kingSquare, color.getOppositeColor());
                if(pinner == Square.NONE) {
                    continue;
                }
                Piece pinnerPiece = position.pieceAt(pinner);
                String description = piece.type().capitalizedName() + " on " + Square.name(square)
                        + " is pinned to the king by " + pinnerPiece.type().pieceName();
                Severity severity = piece.type() == PieceType.QUEEN || piece.type() == PieceType.ROOK
                        ? Severity.WARNING : Severity.INFO;
                motifs.add(new Motif(MotifType.PIN, pinner, IntList.of(square, kingSquare), description, severity));
            }
        }
        return motifs;
    }

    private static int findPinner(PositionView position, int pinnedSquare, int kingSquare, Color attackerColor) {
        if(!Square.sameLine(pinnedSquare, kingSquare)) {
            return Square.NONE;
        }
        int direction = Square.direction(kingSquare, pinnedSquare);
        int previous = pinnedSquare;
        int current = pinnedSquare + direction;
        while(Square.isStepOnBoard(previous, current)) {
            Piece piece = position.pieceAt(current);
            if(piece != null) {
                if(piece.color() != attackerColor) {
                    return Square.NONE;
                }
                return canAttackAlong(piece.type(), direction) ? current : Square.NONE;
            }
            previous = current;
            current += direction;
        }
        return Square.NONE;
    }

    private static boolean canAttackAlong(PieceType type, int direction) {
        if(Square.isStraight(direction)) {
            return type.slidesStraight();
        }
        return Square.isDiagonal(direction) && type.slidesDiagonally();
    }

    /**
     * A piece attacking at least two valuable enemy pieces. Queens, rooks and kings are always
     * valuable; knights and bishops only count when a pawn attacks them.
     */
    public static List<Motif> findForks(PositionView position) {
        List<Motif> motifs = new ArrayList<>();
        for(Color color : Color.values()) {
            for(int square = 0; square < 64; square++) {
                Piece piece = position.pieceAt(square);
                if(piece == null || piece.color() != color) {
                    continue;
                }
                IntList targets = new IntArrayList();
                boolean kingTargeted = false;
                for(int target : position.attacks(square)) {
                    Piece targetPiece = position.pieceAt(target);
                    if(targetPiece == null || targetPiece.color() == color) {
                        continue;
                    }
                    if(isForkTarget(piece.type(), targetPiece.type())) {
                        targets.add(target);
                        kingTargeted |= targetPiece.type() == PieceType.KING;
                    }
                }
                if(targets.size() < 2) {
                    continue;
                }
                StringJoiner names = new StringJoiner(" and ");
                for(int i = 0; i < Math.min(MAX_NAMED_FORK_TARGETS, targets.size()); i++) {
                    int target = targets.getInt(i);
                    names.add(position.pieceAt(target).type().pieceName() + " on " + Square.name(target));
                }
                String description = piece.type().capitalizedName() + " on " + Square.name(square) + " forks " + names;
                motifs.add(new Motif(MotifType.FORK, square, targets, description,
                        kingTargeted ? Severity.CRITICAL : Severity.WARNING));
            }
        }
        return motifs;
    }

    private static boolean isForkTarget(PieceType attacker, PieceType target) {
        return switch (target) {
            case QUEEN, ROOK, KING -> true;
            case KNIGHT, BISHOP -> attacker == PieceType.PAWN;
            case PAWN -> false;
        };
    }

    /**
     * Non-pawn pieces, kings included, attacked at least once and defended by nothing.
     */
    public static List<Motif> findHangingPieces(PositionView position) {
        List<Motif> motifs = new ArrayList<>();
        for(int square = 0; square < 64; square++) {
            Piece piece = position.pieceAt(square);
            if(piece == null || piece.type() == PieceType.PAWN) {
                continue;
            }
            Color color = piece.color();
            IntList attackers = position.attackers(color.getOppositeColor(), square);
            if(attackers.isEmpty() || !position.attackers(color, square).isEmpty()) {
                continue;
            }
            String description = color.displayName() + " " + piece.type().pieceName() + " on " + Square.name(square)
                    + " is undefended and attacked";
            Severity severity = piece.type() == PieceType.QUEEN || piece.type() == PieceType.ROOK
                    ? Severity.CRITICAL : Severity.WARNING;
            motifs.add(new Motif(MotifType.HANGING_PIECE, attackers.getInt(0), IntList.of(square), description, severity));
        }
        return motifs;
    }

    /**
     * A slider whose line hits an enemy piece worth more than the next enemy piece behind it.
     */
    public static List<Motif> findSkewers(PositionView position) {
        List<Motif> motifs = new ArrayList<>();
        for(Color color : Color.values()) {
            for(int square = 0; square < 64; square++) {
                Piece piece = position.pieceAt(square);
                if(piece == null || piece.color() != color || !piece.type().isSlider()) {
                    continue;
                }
                if(piece.type().slidesStraight()) {
                    addSkewers(position, square, piece, STRAIGHT_DIRECTIONS, motifs);
                }
                if(piece.type().slidesDiagonally()) {
                    addSkewers(position, square, piece, DIAGONAL_DIRECTIONS, motifs);
                }
            }
        }
        return motifs;
    }

    private static void addSkewers(PositionView position, int square, Piece attacker, int[] directions, List<Motif> motifs) {
        for(int direction : directions) {
            IntList skewered = skeweredSquares(position, square, direction, attacker.color());
            if(skewered == null) {
                continue;
            }
            Piece front = position.pieceAt(skewered.getInt(0));
            Piece back = position.pieceAt(skewered.getInt(1));
            String description = attacker.type().capitalizedName() + " skewers " + front.type().pieceName()
                    + " to " + back.type().pieceName();
            motifs.add(new Motif(MotifType.SKEWER, square, skewered, description, Severity.WARNING));
        }
    }

    // [front, back] or null
    private static IntList skeweredSquares(PositionView position, int attackerSquare, int direction, Color attackerColor) {
        int front = Square.NONE;
        int previous = attackerSquare;
        int current = attackerSquare + direction;
        while(Square.isStepOnBoard(previous, current)) {
            Piece piece = position.pieceAt(current);
            if(piece != null) {
                if(piece.color() == attackerColor) {
                    return null;
                }
                if(front == Square.NONE) {
                    front = current;
                } else {
                    int frontValue = position.pieceAt(front).type().comparisonValue();
                    return frontValue > piece.type().comparisonValue() ? IntList.of(front, current) : null;
                }
            }
            previous = current;
            current += direction;
        }
        return null;
    }
}
