package max.coach.analysis;

import max.coach.classify.Classification;

public record ErrorCounts(int blunders, int mistakes, int inaccuracies) {
    public static final ErrorCounts NONE = new ErrorCounts(0, 0, 0);

    public ErrorCounts record(Classification classification) {
        return switch (classification) {
            case BLUNDER -> new ErrorCounts(blunders + 1, mistakes, inaccuracies);
            case MISTAKE -> new ErrorCounts(blunders, mistakes + 1, inaccuracies);
            case INACCURACY -> new ErrorCounts(blunders, mistakes, inaccuracies + 1);
            default -> this;
        };
    }

    public int total() {
        return blunders + mistakes + inaccuracies;
    }
}
