package max.coach.rules;

import max.coach.common.Piece;

/**
 * Everything needed to take back a move played on a {@link Game}.
 */
public record GameChanges(Move move, Piece movedPiece, Piece capturedPiece, int capturedSquare,
                          boolean castling, int previousEnPassantSquare, int previousHalfMoveClock,
                          boolean previousWhiteCanCastleKingSide, boolean previousWhiteCanCastleQueenSide,
                          boolean previousBlackCanCastleKingSide, boolean previousBlackCanCastleQueenSide) {

    public boolean isCapture() {
        return capturedPiece != null;
    }
}
