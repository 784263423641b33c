package max.coach.rules;

import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.Square;

import java.util.ArrayList;
import java.util.List;

public final class MoveGenerator {
    private static final PieceType[] PROMOTIONS = {PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT};

    private MoveGenerator() {
    }

    public static List<Move> generateLegalMoves(Game game) {
        List<Move> pseudoLegalMoves = generatePseudoLegalMoves(game);
        List<Move> legalMoves = new ArrayList<>(pseudoLegalMoves.size());
        Color us = game.currentPlayer;
        for(Move move : pseudoLegalMoves) {
            GameChanges changes = game.playMove(move);
            int kingSquare = game.board().kingSquare(us);
            boolean leavesKingInCheck = kingSquare != Square.NONE && game.board().isAttacked(kingSquare, us.getOppositeColor());
            game.undoMove(changes);
            if(!leavesKingInCheck) {
                legalMoves.add(move);
            }
        }
        return legalMoves;
    }

    static List<Move> generatePseudoLegalMoves(Game game) {
        Board board = game.board();
        Color us = game.currentPlayer;
        long ownBB = board.colorBB(us);
        long enemyBB = board.colorBB(us.getOppositeColor());
        List<Move> moves = new ArrayList<>(64);

        long pieces = ownBB;
        while(pieces != 0L) {
            int square = Long.numberOfTrailingZeros(pieces);
            pieces &= pieces - 1;
            Piece piece = board.pieceAt(square);
            if(piece.type() == PieceType.PAWN) {
                addPawnMoves(game, square, enemyBB, moves);
            } else {
                long targets = board.attacksFrom(square) & ~ownBB;
                addMoves(square, targets, moves);
                if(piece.type() == PieceType.KING) {
                    addCastlingMoves(game, square, moves);
                }
            }
        }
        return moves;
    }

    private static void addMoves(int from, long targets, List<Move> moves) {
        while(targets != 0L) {
            int to = Long.numberOfTrailingZeros(targets);
            targets &= targets - 1;
            moves.add(new Move(from, to));
        }
    }

    private static void addPawnMoves(Game game, int square, long enemyBB, List<Move> moves) {
        Board board = game.board();
        Color us = game.currentPlayer;
        int forward = us.isWhite() ? 8 : -8;
        int startRank = us.isWhite() ? 1 : 6;
        int lastRank = us.isWhite() ? 7 : 0;

        int oneStep = square + forward;
        if(Square.isValid(oneStep) && board.pieceAt(oneStep) == null) {
            addPawnMove(square, oneStep, lastRank, moves);
            int twoSteps = oneStep + forward;
            if(Square.rank(square) == startRank && board.pieceAt(twoSteps) == null) {
                moves.add(new Move(square, twoSteps));
            }
        }

        long captureTargets = BitBoardUtils.pawnAttacks(us, square);
        long captures = captureTargets & enemyBB;
        while(captures != 0L) {
            int to = Long.numberOfTrailingZeros(captures);
            captures &= captures - 1;
            addPawnMove(square, to, lastRank, moves);
        }
        if(game.enPassantSquare != Square.NONE && (captureTargets & BitBoardUtils.bit(game.enPassantSquare)) != 0L) {
            moves.add(new Move(square, game.enPassantSquare));
        }
    }

    private static void addPawnMove(int from, int to, int lastRank, List<Move> moves) {
        if(Square.rank(to) == lastRank) {
            for(PieceType promotion : PROMOTIONS) {
                moves.add(new Move(from, to, promotion));
            }
        } else {
            moves.add(new Move(from, to));
        }
    }

    private static void addCastlingMoves(Game game, int kingSquare, List<Move> moves) {
        Color us = game.currentPlayer;
        int homeSquare = us.isWhite() ? 4 : 60;
        if(kingSquare != homeSquare) {
            return;
        }
        Board board = game.board();
        Color them = us.getOppositeColor();
        if(board.isAttacked(kingSquare, them)) {
            return;
        }
        boolean kingSide = us.isWhite() ? game.whiteCanCastleKingSide : game.blackCanCastleKingSide;
        boolean queenSide = us.isWhite() ? game.whiteCanCastleQueenSide : game.blackCanCastleQueenSide;
        Piece ownRook = Piece.of(PieceType.ROOK, us);

        if(kingSide
                && ownRook.equals(board.pieceAt(kingSquare + 3))
                && board.pieceAt(kingSquare + 1) == null && board.pieceAt(kingSquare + 2) == null
                && !board.isAttacked(kingSquare + 1, them) && !board.isAttacked(kingSquare + 2, them)) {
            moves.add(new Move(kingSquare, kingSquare + 2));
        }
        if(queenSide
                && ownRook.equals(board.pieceAt(kingSquare - 4))
                && board.pieceAt(kingSquare - 1) == null && board.pieceAt(kingSquare - 2) == null
                && board.pieceAt(kingSquare - 3) == null
                && !board.isAttacked(kingSquare - 1, them) && !board.isAttacked(kingSquare - 2, them)) {
            moves.add(new Move(kingSquare, kingSquare - 2));
        }
    }
}
