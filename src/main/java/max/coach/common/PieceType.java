package max.coach.common;

public enum PieceType {
    PAWN(1, 1, "", 'p'),
    KNIGHT(3, 3, "N", 'n'),
    BISHOP(3, 3, "B", 'b'),
    ROOK(5, 5, "R", 'r'),
    QUEEN(9, 9, "Q", 'q'),
    KING(100, 0, "K", 'k');

    public static final PieceType[] VALUES = PieceType.values();

    // King counts 100 when ranking targets, 0 when counting material
    private final int comparisonValue;
    private final int materialValue;
    private final String sanLetter;
    private final char fenLetter;

    PieceType(int comparisonValue, int materialValue, String sanLetter, char fenLetter) {
        this.comparisonValue = comparisonValue;
        this.materialValue = materialValue;
        this.sanLetter = sanLetter;
        this.fenLetter = fenLetter;
    }

    public int comparisonValue() {
        return comparisonValue;
    }

    public int materialValue() {
        return materialValue;
    }

    public String sanLetter() {
        return sanLetter;
    }

    public char fenLetter() {
        return fenLetter;
    }

    public boolean isSlider() {
        return this == BISHOP || this == ROOK || this == QUEEN;
    }

    public boolean slidesStraight() {
        return this == ROOK || this == QUEEN;
    }

    public boolean slidesDiagonally() {
        return this == BISHOP || this == QUEEN;
    }

    public String pieceName() {
        return name().toLowerCase();
    }

    public String capitalizedName() {
        String name = pieceName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public static PieceType fromLetter(char letter) {
        return switch (letter) {
            case 'p', 'P' -> PAWN;
            case 'n', 'N' -> KNIGHT;
            case 'b', 'B' -> BISHOP;
            case 'r', 'R' -> ROOK;
            case 'q', 'Q' -> QUEEN;
            case 'k', 'K' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
