package max.coach.rules.notations;

import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.common.Square;
import max.coach.rules.Game;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public final class FENUtils {

    private FENUtils() {
    }

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    // Clocks may be omitted, as some tools write 4-field records
    public static Game getGameFrom(String fen) {
        if(fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("Invalid FEN record: empty");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length < 4 || fenFields.length > 6) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0], fen);
        injectCurrentTurn(game, fenFields[1], fen);
        injectCastlingRights(game, fenFields[2], fen);
        injectEnPassantSquare(game, fenFields[3]);
        game.halfMoveClock = fenFields.length > 4 ? parseClock(fenFields[4], fen) : 0;
        game.fullMoveClock = fenFields.length > 5 ? Math.max(1, parseClock(fenFields[5], fen)) : 1;

        if(game.kingSquare(Color.WHITE) == Square.NONE || game.kingSquare(Color.BLACK) == Square.NONE) {
            throw new IllegalArgumentException("Invalid FEN record, both kings are required: " + fen);
        }
        return game;
    }

    public static String getFENFromGame(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        fen.append(' ').append(game.currentPlayer.isWhite() ? 'w' : 'b');
        injectCastlingRights(game, fen);
        fen.append(' ').append(game.enPassantSquare == Square.NONE ? "-" : Square.name(game.enPassantSquare));
        fen.append(' ').append(game.halfMoveClock);
        fen.append(' ').append(game.fullMoveClock);
        return fen.toString();
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        for(int rank = 7 ; rank >= 0 ; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0 ; file < 8 ; file++) {
                Piece piece = game.pieceAt(Square.of(file, rank));
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.fenLetter());
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(game.whiteCanCastleKingSide) {
            castlingRights.append('K');
        }
        if(game.whiteCanCastleQueenSide) {
            castlingRights.append('Q');
        }
        if(game.blackCanCastleKingSide) {
            castlingRights.append('k');
        }
        if(game.blackCanCastleQueenSide) {
            castlingRights.append('q');
        }

        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectPiecePlacement(Game game, String piecePlacement, String fen) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN piece placement, expected 8 ranks: " + fen);
        }
        int rank = 7;
        for(String piecePlacementRow : piecePlacementRows) {
            int file = 0;
            for(char character : piecePlacementRow.toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if(file > 7) {
                    throw new IllegalArgumentException("Invalid FEN rank " + piecePlacementRow + ": " + fen);
                }
                game.board().addPiece(Square.of(file, rank), Piece.fromFenLetter(character));
                file++;
            }
            if(file != 8) {
                throw new IllegalArgumentException("Invalid FEN rank " + piecePlacementRow + ": " + fen);
            }
            rank--;
        }
    }

    private static void injectCurrentTurn(Game game, String currentTurn, String fen) {
        game.currentPlayer = switch (currentTurn) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("Invalid FEN side to move " + currentTurn + ": " + fen);
        };
    }

    private static void injectCastlingRights(Game game, String castlingRights, String fen) {
        game.whiteCanCastleKingSide = false;
        game.whiteCanCastleQueenSide = false;
        game.blackCanCastleKingSide = false;
        game.blackCanCastleQueenSide = false;
        if("-".equals(castlingRights)) {
            return;
        }
        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> game.whiteCanCastleKingSide = true;
                case 'k' -> game.blackCanCastleKingSide = true;
                case 'Q' -> game.whiteCanCastleQueenSide = true;
                case 'q' -> game.blackCanCastleQueenSide = true;
                default -> throw new IllegalArgumentException("Invalid FEN castling rights " + castlingRights + ": " + fen);
            }
        }
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        game.enPassantSquare = "-".equals(enPassantSquare) ? Square.NONE : Square.parse(enPassantSquare);
    }

    private static int parseClock(String clock, String fen) {
        try {
            return Integer.parseInt(clock);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN clock " + clock + ": " + fen, e);
        }
    }
}
