package max.coach.tactics;

public enum MotifType {
    PIN("pin"),
    FORK("fork"),
    SKEWER("skewer"),
    HANGING_PIECE("hanging_piece");

    private final String label;

    MotifType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
