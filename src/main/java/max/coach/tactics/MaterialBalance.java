package max.coach.tactics;

import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PositionView;

/**
 * Material count of both sides with pawn = 1, minor piece = 3, rook = 5, queen = 9. Kings are not counted.
 */
public record MaterialBalance(int white, int black) {

    public static MaterialBalance of(PositionView position) {
        int white = 0;
        int black = 0;
        for(int square = 0; square < 64; square++) {
            Piece piece = position.pieceAt(square);
            if(piece == null) {
                continue;
            }
            if(piece.color() == Color.WHITE) {
                white += piece.type().materialValue();
            } else {
                black += piece.type().materialValue();
            }
        }
        return new MaterialBalance(white, black);
    }

    /** White material minus black material. */
    public int balance() {
        return white - black;
    }

    public String description() {
        int balance = balance();
        if(balance == 0) {
            return "Material is equal";
        }
        String side = balance > 0 ? Color.WHITE.displayName() : Color.BLACK.displayName();
        int advantage = Math.abs(balance);
        if(advantage >= 9) {
            return side + " is up a queen (" + advantage + " points)";
        } else if(advantage >= 5) {
            return side + " is up a rook (" + advantage + " points)";
        } else if(advantage >= 3) {
            return side + " is up a minor piece (" + advantage + " points)";
        }
        return side + " is up " + advantage + " pawn(s)";
    }
}
