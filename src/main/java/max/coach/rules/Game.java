package max.coach.rules;

import it.unimi.dsi.fastutil.ints.IntList;
import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.PositionView;
import max.coach.common.Square;
import max.coach.rules.notations.FENUtils;

import java.util.List;

public class Game implements PositionView {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private final Board board;

    public Color currentPlayer = Color.WHITE;
    public boolean whiteCanCastleKingSide = true;
    public boolean whiteCanCastleQueenSide = true;
    public boolean blackCanCastleKingSide = true;
    public boolean blackCanCastleQueenSide = true;

    public int enPassantSquare = Square.NONE;
    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    public Game() {
        board = new Board();
    }

    private Game(Game other) {
        this.board = new Board(other.board);
        this.currentPlayer = other.currentPlayer;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.enPassantSquare = other.enPassantSquare;
        this.halfMoveClock = other.halfMoveClock;
        this.fullMoveClock = other.fullMoveClock;
    }

    public static Game newStandardGame() {
        return FENUtils.getGameFrom(STANDARD_GAME);
    }

    public static Game from(String fen) {
        return FENUtils.getGameFrom(fen);
    }

    public Game copy() {
        return new Game(this);
    }

    public Board board() {
        return board;
    }

    public List<Move> getLegalMoves() {
        return MoveGenerator.generateLegalMoves(this);
    }

    public boolean isLegal(Move move) {
        return getLegalMoves().contains(move);
    }

    public GameChanges playMove(Move move) {
        final int startPosition = move.startPosition();
        final int endPosition = move.endPosition();
        final Piece movedPiece = board.pieceAt(startPosition);
        if(movedPiece == null || movedPiece.color() != currentPlayer) {
            throw new IllegalMoveException("No " + currentPlayer.label() + " piece on " + Square.name(startPosition) + " for move " + move);
        }

        final int previousEnPassantSquare = enPassantSquare;
        final int previousHalfMoveClock = halfMoveClock;
        final boolean previousWhiteCanCastleKingSide = whiteCanCastleKingSide;
        final boolean previousWhiteCanCastleQueenSide = whiteCanCastleQueenSide;
        final boolean previousBlackCanCastleKingSide = blackCanCastleKingSide;
        final boolean previousBlackCanCastleQueenSide = blackCanCastleQueenSide;

        boolean isPawn = movedPiece.type() == PieceType.PAWN;
        boolean castling = movedPiece.type() == PieceType.KING && Math.abs(endPosition - startPosition) == 2;

        // determining piece eaten, en passant takes the pawn behind the target square
        int capturedSquare = endPosition;
        if(isPawn && endPosition == enPassantSquare && Square.file(startPosition) != Square.file(endPosition)) {
            capturedSquare = currentPlayer.isWhite() ? endPosition - 8 : endPosition + 8;
        }
        Piece capturedPiece = board.removePiece(capturedSquare);
        if(capturedPiece == null) {
            capturedSquare = Square.NONE;
        }

        board.movePiece(startPosition, endPosition);
        if(move.promotion() != null) {
            board.removePiece(endPosition);
            board.addPiece(endPosition, Piece.of(move.promotion(), currentPlayer));
        }
        if(castling) {
            boolean kingSide = endPosition > startPosition;
            int rookFrom = kingSide ? startPosition + 3 : startPosition - 4;
            int rookTo = kingSide ? startPosition + 1 : startPosition - 1;
            board.movePiece(rookFrom, rookTo);
        }

        if(isPawn && Math.abs(endPosition - startPosition) == 16) {
            enPassantSquare = (startPosition + endPosition) / 2;
        } else {
            enPassantSquare = Square.NONE;
        }

        updateCastlingRights(movedPiece, startPosition, endPosition);

        if(isPawn || capturedPiece != null) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if(!currentPlayer.isWhite()) {
            fullMoveClock++;
        }
        currentPlayer = currentPlayer.getOppositeColor();

        return new GameChanges(move, movedPiece, capturedPiece, capturedSquare, castling,
                previousEnPassantSquare, previousHalfMoveClock,
                previousWhiteCanCastleKingSide, previousWhiteCanCastleQueenSide,
                previousBlackCanCastleKingSide, previousBlackCanCastleQueenSide);
    }

    private void updateCastlingRights(Piece movedPiece, int startPosition, int endPosition) {
        if(movedPiece.type() == PieceType.KING) {
            if(movedPiece.color().isWhite()) {
                whiteCanCastleKingSide = false;
                whiteCanCastleQueenSide = false;
            } else {
                blackCanCastleKingSide = false;
                blackCanCastleQueenSide = false;
            }
        }

        // Removing castling rights when a rook leaves or is taken on its corner
        if(endPosition == 7 || startPosition == 7) {
            whiteCanCastleKingSide = false;
        }
        if(endPosition == 0 || startPosition == 0) {
            whiteCanCastleQueenSide = false;
        }
        if(endPosition == 63 || startPosition == 63) {
            blackCanCastleKingSide = false;
        }
        if(endPosition == 56 || startPosition == 56) {
            blackCanCastleQueenSide = false;
        }
    }

    public void undoMove(GameChanges changes) {
        currentPlayer = currentPlayer.getOppositeColor();
        if(!currentPlayer.isWhite()) {
            fullMoveClock--;
        }

        Move move = changes.move();
        int startPosition = move.startPosition();
        int endPosition = move.endPosition();

        if(changes.castling()) {
            boolean kingSide = endPosition > startPosition;
            int rookFrom = kingSide ? startPosition + 3 : startPosition - 4;
            int rookTo = kingSide ? startPosition + 1 : startPosition - 1;
            board.movePiece(rookTo, rookFrom);
        }

        board.removePiece(endPosition);
        board.addPiece(startPosition, changes.movedPiece());
        if(changes.isCapture()) {
            board.addPiece(changes.capturedSquare(), changes.capturedPiece());
        }

        enPassantSquare = changes.previousEnPassantSquare();
        halfMoveClock = changes.previousHalfMoveClock();
        whiteCanCastleKingSide = changes.previousWhiteCanCastleKingSide();
        whiteCanCastleQueenSide = changes.previousWhiteCanCastleQueenSide();
        blackCanCastleKingSide = changes.previousBlackCanCastleKingSide();
        blackCanCastleQueenSide = changes.previousBlackCanCastleQueenSide();
    }

    public boolean inCheck() {
        int kingSquare = board.kingSquare(currentPlayer);
        return kingSquare != Square.NONE && board.isAttacked(kingSquare, currentPlayer.getOppositeColor());
    }

    public boolean isCheckmate() {
        return getPlayerState() == PlayerState.CHECKMATE;
    }

    public boolean isStalemate() {
        return getPlayerState() == PlayerState.STALEMATE;
    }

    public PlayerState getPlayerState() {
        boolean legalMovePossible = !getLegalMoves().isEmpty();
        if(!legalMovePossible) {
            // No legal move possible, so we are either in pat or checkmate depending on the king check state
            return inCheck() ? PlayerState.CHECKMATE : PlayerState.STALEMATE;
        }
        if(halfMoveClock >= 100 || isInsufficientMaterial()) {
            return PlayerState.DRAW;
        }
        return PlayerState.IN_PROGRESS;
    }

    private boolean isInsufficientMaterial() {
        if((board.pawnBB | board.rookBB | board.queenBB) != 0L) {
            return false;
        }
        return Long.bitCount(board.knightBB | board.bishopBB) <= 1;
    }

    public boolean isCapture(Move move) {
        if(board.pieceAt(move.endPosition()) != null) {
            return true;
        }
        Piece piece = board.pieceAt(move.startPosition());
        return piece != null && piece.type() == PieceType.PAWN
                && move.endPosition() == enPassantSquare
                && Square.file(move.startPosition()) != Square.file(move.endPosition());
    }

    /** Piece a move would take, including the pawn removed by en passant; null for quiet moves. */
    public Piece capturedPiece(Move move) {
        Piece target = board.pieceAt(move.endPosition());
        if(target != null) {
            return target;
        }
        return isCapture(move) ? Piece.of(PieceType.PAWN, currentPlayer.getOppositeColor()) : null;
    }

    public boolean givesCheck(Move move) {
        GameChanges changes = playMove(move);
        try {
            return inCheck();
        } finally {
            undoMove(changes);
        }
    }

    /* -------------------- PositionView -------------------- */

    @Override
    public Piece pieceAt(int square) {
        return board.pieceAt(square);
    }

    @Override
    public Color sideToMove() {
        return currentPlayer;
    }

    @Override
    public int kingSquare(Color color) {
        return board.kingSquare(color);
    }

    @Override
    public IntList attackers(Color color, int square) {
        return BitBoardUtils.toSquares(board.attackersOf(square, color));
    }

    @Override
    public IntList attacks(int square) {
        return BitBoardUtils.toSquares(board.attacksFrom(square));
    }

    public String toFen() {
        return FENUtils.getFENFromGame(this);
    }

    @Override
    public String toString() {
        return board + "\nFEN: " + toFen();
    }
}
