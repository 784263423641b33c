package max.coach.rules;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import max.coach.common.Color;

public final class BitBoardUtils {

    public enum Direction {
        NORTH, SOUTH, EAST, WEST, NORTHEAST, NORTHWEST, SOUTHEAST, SOUTHWEST
    }

    static final Direction[] STRAIGHT = {Direction.NORTH, Direction.SOUTH, Direction.EAST, Direction.WEST};
    static final Direction[] DIAGONAL = {Direction.NORTHEAST, Direction.NORTHWEST, Direction.SOUTHEAST, Direction.SOUTHWEST};

    /**
     * The bitboards representing the files on a chessboard. Bitboard at index 0
     * identifies the a-file, bitboard at index 1 the b-file, etc.
     */
    static final long[] FILE_BB = { 0x0101010101010101L, 0x0202020202020202L, 0x0404040404040404L, 0x0808080808080808L,
            0x1010101010101010L, 0x2020202020202020L, 0x4040404040404040L, 0x8080808080808080L };

    static final long[] KNIGHT_ATTACKS = new long[64];
    static final long[] KING_ATTACKS = new long[64];
    // [color ordinal][square]: squares a pawn of that color standing on square attacks
    static final long[][] PAWN_ATTACKS = new long[2][64];

    static {
        for(int square = 0; square < 64; square++) {
            long bb = bit(square);
            long north = shift(bb, Direction.NORTH);
            long south = shift(bb, Direction.SOUTH);
            KNIGHT_ATTACKS[square] = shift(shift(north, Direction.NORTH), Direction.EAST)
                    | shift(shift(north, Direction.NORTH), Direction.WEST)
                    | shift(shift(south, Direction.SOUTH), Direction.EAST)
                    | shift(shift(south, Direction.SOUTH), Direction.WEST)
                    | shift(shift(bb, Direction.EAST), Direction.NORTHEAST)
                    | shift(shift(bb, Direction.EAST), Direction.SOUTHEAST)
                    | shift(shift(bb, Direction.WEST), Direction.NORTHWEST)
                    | shift(shift(bb, Direction.WEST), Direction.SOUTHWEST);

            long kingMoves = 0L;
            for(Direction direction : Direction.values()) {
                kingMoves |= shift(bb, direction);
            }
            KING_ATTACKS[square] = kingMoves;

            PAWN_ATTACKS[Color.WHITE.ordinal()][square] = shift(bb, Direction.NORTHEAST) | shift(bb, Direction.NORTHWEST);
            PAWN_ATTACKS[Color.BLACK.ordinal()][square] = shift(bb, Direction.SOUTHEAST) | shift(bb, Direction.SOUTHWEST);
        }
    }

    private BitBoardUtils() {
    }

    public static long bit(int square) {
        return 1L << square;
    }

    public static long shift(long bitboard, Direction direction) {
        return switch (direction) {
            case NORTH -> bitboard << 8;
            case SOUTH -> bitboard >>> 8;
            case EAST -> (bitboard & ~FILE_BB[7]) << 1;
            case WEST -> (bitboard & ~FILE_BB[0]) >>> 1;
            case NORTHEAST -> (bitboard & ~FILE_BB[7]) << 9;
            case NORTHWEST -> (bitboard & ~FILE_BB[0]) << 7;
            case SOUTHEAST -> (bitboard & ~FILE_BB[7]) >>> 7;
            case SOUTHWEST -> (bitboard & ~FILE_BB[0]) >>> 9;
        };
    }

    // Walks the ray until it leaves the board or hits an occupied square (included)
    public static long rayAttack(int square, Direction direction, long occupied) {
        long attack = 0L;
        long squareBB = bit(square);

        while (true) {
            squareBB = shift(squareBB, direction);
            attack |= squareBB;

            if (squareBB == 0L || (squareBB & occupied) != 0L) {
                break;
            }
        }

        return attack;
    }

    public static long straightAttacks(int square, long occupied) {
        long attacks = 0L;
        for(Direction direction : STRAIGHT) {
            attacks |= rayAttack(square, direction, occupied);
        }
        return attacks;
    }

    public static long diagonalAttacks(int square, long occupied) {
        long attacks = 0L;
        for(Direction direction : DIAGONAL) {
            attacks |= rayAttack(square, direction, occupied);
        }
        return attacks;
    }

    public static long knightAttacks(int square) {
        return KNIGHT_ATTACKS[square];
    }

    public static long kingAttacks(int square) {
        return KING_ATTACKS[square];
    }

    public static long pawnAttacks(Color color, int square) {
        return PAWN_ATTACKS[color.ordinal()][square];
    }

    public static IntList toSquares(long bitboard) {
        IntList squares = new IntArrayList(Long.bitCount(bitboard));
        while(bitboard != 0L) {
            squares.add(Long.numberOfTrailingZeros(bitboard));
            bitboard &= bitboard - 1;
        }
        return squares;
    }
}
