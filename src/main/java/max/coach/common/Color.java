package max.coach.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    // "white" / "black", as used in analysis output
    public String label() {
        return this == WHITE ? "white" : "black";
    }

    public String displayName() {
        return this == WHITE ? "White" : "Black";
    }
}
