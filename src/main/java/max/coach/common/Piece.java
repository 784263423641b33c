package max.coach.common;

import java.util.Objects;

public record Piece(PieceType type, Color color) {
    private static final Piece[] CACHE = new Piece[PieceType.VALUES.length * 2];
    static {
        for(PieceType type : PieceType.VALUES) {
            for(Color color : Color.values()) {
                CACHE[cacheIndex(type, color)] = new Piece(type, color);
            }
        }
    }

    public Piece {
        Objects.requireNonNull(type);
        Objects.requireNonNull(color);
    }

    public static Piece of(PieceType type, Color color) {
        return CACHE[cacheIndex(type, color)];
    }

    public static Piece fromFenLetter(char letter) {
        Color color = Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK;
        return of(PieceType.fromLetter(letter), color);
    }

    private static int cacheIndex(PieceType type, Color color) {
        return type.ordinal() * 2 + color.ordinal();
    }

    public char fenLetter() {
        return color.isWhite() ? Character.toUpperCase(type.fenLetter()) : type.fenLetter();
    }
}
