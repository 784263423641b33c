package max.coach.analysis;

import max.coach.classify.Classification;

/**
 * Verdict on a single move played live.
 *
 * @param bestMove SAN of the engine move, only set for a blunder that the engine would not have played
 * @param evalLossCp centipawns lost by the mover, negative when the move gained
 */
public record BlunderCheck(boolean blunder, String bestMove, int evalLossCp, Classification classification) {
}
