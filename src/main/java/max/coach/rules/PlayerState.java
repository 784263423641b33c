package max.coach.rules;

public enum PlayerState {
    IN_PROGRESS, CHECKMATE, STALEMATE, DRAW
}
