package max.coach.rules;

import max.coach.common.PieceType;
import max.coach.common.Square;

/**
 * A move with minimal information such as d7d8q: start square, end square and the promotion piece (or null).
 */
public record Move(int startPosition, int endPosition, PieceType promotion) {

    public Move(int startPosition, int endPosition) {
        this(startPosition, endPosition, null);
    }

    public static Move fromUciNotation(String notation) {
        if(notation == null || (notation.length() != 4 && notation.length() != 5)) {
            throw new IllegalMoveException("Cannot parse UCI notation " + notation);
        }
        try {
            int startPosition = Square.parse(notation.substring(0, 2));
            int endPosition = Square.parse(notation.substring(2, 4));
            if (notation.length() == 4) {
                return new Move(startPosition, endPosition);
            }
            return new Move(startPosition, endPosition, PieceType.fromLetter(notation.charAt(4)));
        } catch (IllegalArgumentException e) {
            throw new IllegalMoveException("Cannot parse UCI notation " + notation, e);
        }
    }

    public String toUciNotation() {
        String promotedPiece = promotion == null ? "" : String.valueOf(promotion.fenLetter());
        return Square.name(startPosition) + Square.name(endPosition) + promotedPiece;
    }

    @Override
    public String toString() {
        return toUciNotation();
    }
}
