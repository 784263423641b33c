package max.coach.rules;

import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.PieceType;
import max.coach.common.Square;
import max.coach.rules.notations.SanUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameTest {

    @ParameterizedTest
    @CsvSource({
            // en passant
            "rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3, e5f6",
            // castling both sides
            "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1, e1g1",
            "r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1, e8c8",
            // capture promotion
            "1n2k3/P7/8/8/8/8/8/4K3 w - - 0 1, a7b8q",
            // rook capture removing castling rights
            "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1, a1a8"
    })
    public void undoShouldRestoreThePosition(String fen, String uciMove) {
        // Given
        Game game = Game.from(fen);

        // When
        GameChanges changes = game.playMove(Move.fromUciNotation(uciMove));
        game.undoMove(changes);

        // Then
        assertEquals(fen, game.toFen());
    }

    @Test
    public void enPassantShouldRemoveThePassedPawn() {
        // Given
        Game game = Game.from("rnbqkbnr/ppp1p1pp/8/3pPp2/8/8/PPPP1PPP/RNBQKBNR w KQkq f6 0 3");
        Move enPassant = Move.fromUciNotation("e5f6");

        // Then
        assertTrue(game.isCapture(enPassant));
        assertEquals(Piece.of(PieceType.PAWN, Color.BLACK), game.capturedPiece(enPassant));

        // When
        game.playMove(enPassant);

        // Then
        assertNull(game.pieceAt(Square.parse("f5")));
        assertEquals(Piece.of(PieceType.PAWN, Color.WHITE), game.pieceAt(Square.parse("f6")));
    }

    @Test
    public void castlingShouldMoveTheRookAndDropRights() {
        // Given
        Game game = Game.from("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        // When
        game.playMove(Move.fromUciNotation("e1c1"));

        // Then
        assertEquals(Piece.of(PieceType.ROOK, Color.WHITE), game.pieceAt(Square.parse("d1")));
        assertNull(game.pieceAt(Square.parse("a1")));
        assertEquals("r3k2r/8/8/8/8/8/8/2KR3R b kq - 1 1", game.toFen());
    }

    @Test
    public void castlingThroughAnAttackedSquareShouldBeIllegal() {
        // f1 is covered by the bishop on c4
        Game game = Game.from("4k3/8/8/8/2b5/8/8/4K2R w K - 0 1");
        assertFalse(game.isLegal(Move.fromUciNotation("e1g1")));
        assertTrue(game.isLegal(Move.fromUciNotation("h1h8")));
    }

    @Test
    public void gameShouldDetectFoolsMate() {
        // Given
        Game game = Game.newStandardGame();
        for(String san : new String[]{"f3", "e5", "g4", "Qh4#"}) {
            game.playMove(SanUtils.parseSan(game, san));
        }

        // Then
        assertTrue(game.inCheck());
        assertTrue(game.isCheckmate());
        assertEquals(PlayerState.CHECKMATE, game.getPlayerState());
    }

    @Test
    public void gameShouldDetectStalemate() {
        Game game = Game.from("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");
        assertFalse(game.inCheck());
        assertTrue(game.isStalemate());
        assertTrue(game.getLegalMoves().isEmpty());
    }

    @Test
    public void gameShouldDetectDrawByInsufficientMaterial() {
        Game game = Game.from("8/8/8/8/8/8/8/K5Bk w - - 0 1");
        assertEquals(PlayerState.DRAW, game.getPlayerState());
    }

    @Test
    public void givesCheckShouldLeaveTheGameUnchanged() {
        // Given
        Game game = Game.from("rnbqkb1r/pppp1ppp/5n2/4p2Q/4P3/8/PPPP1PPP/RNB1KBNR w KQkq - 2 3");
        String fen = game.toFen();

        // Then
        assertTrue(game.givesCheck(Move.fromUciNotation("h5f7")));
        assertFalse(game.givesCheck(Move.fromUciNotation("h5h4")));
        assertEquals(fen, game.toFen());
    }

    @Test
    public void playingFromTheWrongSideShouldFail() {
        Game game = Game.newStandardGame();
        assertThrows(IllegalMoveException.class, () -> game.playMove(Move.fromUciNotation("e7e5")));
    }

    @Test
    public void copyShouldBeIndependent() {
        // Given
        Game game = Game.newStandardGame();
        Game copy = game.copy();

        // When
        copy.playMove(Move.fromUciNotation("e2e4"));

        // Then
        assertEquals(Game.STANDARD_GAME, game.toFen());
        assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1", copy.toFen());
    }

    @Test
    public void attackersShouldListEveryPieceOfTheColor() {
        // e5 is attacked by the knight on f3 and the pawn on d4
        Game game = Game.from("4k3/8/8/8/3P4/5N2/8/4K3 w - - 0 1");
        assertEquals(2, game.attackers(Color.WHITE, Square.parse("e5")).size());
        assertTrue(game.attackers(Color.BLACK, Square.parse("e5")).isEmpty());
    }
}
