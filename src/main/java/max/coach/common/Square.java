package max.coach.common;

/**
 * Squares are flat indexes 0..63 with a1 = 0, h1 = 7 and h8 = 63.
 */
public final class Square {
    public static final int NONE = -1;

    private Square() {
    }

    public static int rank(int square) {
        return square / 8;
    }

    public static int file(int square) {
        return square % 8;
    }

    public static int of(int file, int rank) {
        return rank * 8 + file;
    }

    public static boolean isValid(int square) {
        return square >= 0 && square < 64;
    }

    /**
     * A single ray step from {@code from} to {@code to} stays on the board only if the target index exists
     * and the file moved by at most one; anything else wrapped around an edge.
     */
    public static boolean isStepOnBoard(int from, int to) {
        return isValid(to) && Math.abs(file(to) - file(from)) <= 1;
    }

    public static boolean sameLine(int first, int second) {
        int rankDelta = Math.abs(rank(first) - rank(second));
        int fileDelta = Math.abs(file(first) - file(second));
        return rankDelta == 0 || fileDelta == 0 || rankDelta == fileDelta;
    }

    /**
     * Unit step (one of +-1, +-7, +-8, +-9) from one square towards another on the same line.
     */
    public static int direction(int from, int to) {
        int rankStep = Integer.signum(rank(to) - rank(from));
        int fileStep = Integer.signum(file(to) - file(from));
        return rankStep * 8 + fileStep;
    }

    public static boolean isDiagonal(int direction) {
        return direction == -9 || direction == -7 || direction == 7 || direction == 9;
    }

    public static boolean isStraight(int direction) {
        return direction == -8 || direction == -1 || direction == 1 || direction == 8;
    }

    public static String name(int square) {
        if(!isValid(square)) {
            throw new IllegalArgumentException("square should be in [0-63] but was " + square);
        }
        return "" + (char) ('a' + file(square)) + (char) ('1' + rank(square));
    }

    public static int parse(String name) {
        if(name == null || name.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1' but was " + name);
        }
        int file = name.charAt(0) - 'a';
        int rank = name.charAt(1) - '1';
        if(file < 0 || file > 7) {
            throw new IllegalArgumentException("square letter should be in [a-h]: " + name);
        }
        if(rank < 0 || rank > 7) {
            throw new IllegalArgumentException("square digit should be in [1-8]: " + name);
        }
        return of(file, rank);
    }
}
