package max.coach.rules;

import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.Square;

import java.util.Arrays;

public class Board {
    public long pawnBB = 0;
    public long knightBB = 0;
    public long bishopBB = 0;
    public long rookBB = 0;
    public long queenBB = 0;
    public long kingBB = 0;

    public long whiteBB = 0;
    public long blackBB = 0;

    public long gameBB = 0;

    private final Piece[] pieceAt;

    public Board() {
        this.pieceAt = new Piece[64];
    }

    public Board(Board other) {
        this.pawnBB = other.pawnBB;
        this.knightBB = other.knightBB;
        this.bishopBB = other.bishopBB;
        this.rookBB = other.rookBB;
        this.queenBB = other.queenBB;
        this.kingBB = other.kingBB;
        this.whiteBB = other.whiteBB;
        this.blackBB = other.blackBB;
        this.gameBB = other.gameBB;
        this.pieceAt = Arrays.copyOf(other.pieceAt, 64);
    }

    public Piece pieceAt(int square) {
        return pieceAt[square];
    }

    public void addPiece(int square, Piece piece) {
        if(pieceAt[square] != null) {
            throw new IllegalStateException("Square " + Square.name(square) + " is already occupied");
        }
        long bb = BitBoardUtils.bit(square);
        switch (piece.type()) {
            case PAWN -> pawnBB |= bb;
            case KNIGHT -> knightBB |= bb;
            case BISHOP -> bishopBB |= bb;
            case ROOK -> rookBB |= bb;
            case QUEEN -> queenBB |= bb;
            case KING -> kingBB |= bb;
        }
        if(piece.color().isWhite()) {
            whiteBB |= bb;
        } else {
            blackBB |= bb;
        }
        gameBB |= bb;
        pieceAt[square] = piece;
    }

    public Piece removePiece(int square) {
        Piece piece = pieceAt[square];
        if(piece == null) {
            return null;
        }
        long bb = ~BitBoardUtils.bit(square);
        switch (piece.type()) {
            case PAWN -> pawnBB &= bb;
            case KNIGHT -> knightBB &= bb;
            case BISHOP -> bishopBB &= bb;
            case ROOK -> rookBB &= bb;
            case QUEEN -> queenBB &= bb;
            case KING -> kingBB &= bb;
        }
        whiteBB &= bb;
        blackBB &= bb;
        gameBB &= bb;
        pieceAt[square] = null;
        return piece;
    }

    public void movePiece(int from, int to) {
        addPiece(to, removePiece(from));
    }

    public long colorBB(Color color) {
        return color.isWhite() ? whiteBB : blackBB;
    }

    public long typeBB(PieceType type) {
        return switch (type) {
            case PAWN -> pawnBB;
            case KNIGHT -> knightBB;
            case BISHOP -> bishopBB;
            case ROOK -> rookBB;
            case QUEEN -> queenBB;
            case KING -> kingBB;
        };
    }

    public int kingSquare(Color color) {
        long bb = kingBB & colorBB(color);
        return bb == 0L ? Square.NONE : Long.numberOfTrailingZeros(bb);
    }

    // Squares attacked by the piece on the square, whatever stands on them
    public long attacksFrom(int square) {
        Piece piece = pieceAt[square];
        if(piece == null) {
            return 0L;
        }
        return switch (piece.type()) {
            case PAWN -> BitBoardUtils.pawnAttacks(piece.color(), square);
            case KNIGHT -> BitBoardUtils.knightAttacks(square);
            case BISHOP -> BitBoardUtils.diagonalAttacks(square, gameBB);
            case ROOK -> BitBoardUtils.straightAttacks(square, gameBB);
            case QUEEN -> BitBoardUtils.straightAttacks(square, gameBB) | BitBoardUtils.diagonalAttacks(square, gameBB);
            case KING -> BitBoardUtils.kingAttacks(square);
        };
    }

    public long attackersOf(int square, Color color) {
        return attackersOf(square, color, gameBB);
    }

    // occupied is a parameter so castling and legality checks can look through the moving king
    public long attackersOf(int square, Color color, long occupied) {
        long straightSliders = (rookBB | queenBB);
        long diagonalSliders = (bishopBB | queenBB);
        long attackers = (BitBoardUtils.knightAttacks(square) & knightBB)
                | (BitBoardUtils.kingAttacks(square) & kingBB)
                // a pawn of "color" attacks square iff it stands where an opposite pawn on square would attack
                | (BitBoardUtils.pawnAttacks(color.getOppositeColor(), square) & pawnBB)
                | (BitBoardUtils.straightAttacks(square, occupied) & straightSliders)
                | (BitBoardUtils.diagonalAttacks(square, occupied) & diagonalSliders);
        return attackers & colorBB(color) & occupied;
    }

    public boolean isAttacked(int square, Color byColor) {
        return attackersOf(square, byColor) != 0L;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                Piece piece = pieceAt[Square.of(file, rank)];
                sb.append(piece == null ? '.' : piece.fenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
