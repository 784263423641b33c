package max.coach.tactics;

public enum Severity {
    INFO, WARNING, CRITICAL;

    public String label() {
        return name().toLowerCase();
    }
}
