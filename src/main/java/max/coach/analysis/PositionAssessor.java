package max.coach.analysis;

import max.coach.evaluator.EngineAnalysis;
import max.coach.evaluator.EvaluatorUnavailableException;
import max.coach.evaluator.PositionEvaluator;
import max.coach.evaluator.Score;
import max.coach.rules.Game;
import max.coach.rules.IllegalMoveException;
import max.coach.rules.Move;
import max.coach.rules.notations.SanUtils;
import max.coach.tactics.MaterialBalance;
import max.coach.tactics.TacticalMotifDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class PositionAssessor {
    private static final Logger log = LoggerFactory.getLogger(PositionAssessor.class);

    static final int TACTICAL_THRESHOLD_CP = 150;

    private final PositionEvaluator evaluator;
    private final AnalyzerConfig config;

    public PositionAssessor(PositionEvaluator evaluator, AnalyzerConfig config) {
        this.evaluator = Objects.requireNonNull(evaluator);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Evaluator score and line, material count and motifs of the current position.
     *
     * @throws EvaluatorUnavailableException when the evaluator cannot answer
     */
    public PositionAssessment assess(Game game) {
        if(!evaluator.isAvailable()) {
            throw new EvaluatorUnavailableException("Position evaluator is not available, cannot assess position");
        }
        EngineAnalysis analysis = evaluator.analyse(game.toFen(), config.searchLimit());
        Score score = analysis.score();
        boolean tactical = score.mate() || Math.abs(score.value()) > TACTICAL_THRESHOLD_CP;

        return new PositionAssessment(score.format(),
                GameAnalyzer.bestMoveSan(game, analysis),
                principalVariationSan(game, analysis.principalVariation(), config.principalVariationMoves),
                tactical,
                MaterialBalance.of(game),
                TacticalMotifDetector.analyzeTactics(game));
    }

    /**
     * Converts the line move by move on a copy; stops at the first move that does not fit the position.
     */
    static List<String> principalVariationSan(Game game, List<String> uciMoves, int maxMoves) {
        Game scratch = game.copy();
        List<String> sanMoves = new ArrayList<>();
        for(String uci : uciMoves) {
            if(sanMoves.size() >= maxMoves) {
                break;
            }
            try {
                Move move = Move.fromUciNotation(uci);
                if(!scratch.isLegal(move)) {
                    log.debug("Principal variation cut at illegal move {}", uci);
                    break;
                }
                sanMoves.add(SanUtils.toSan(scratch, move));
                scratch.playMove(move);
            } catch (IllegalMoveException e) {
                log.debug("Principal variation cut at unreadable move {}", uci);
                break;
            }
        }
        return sanMoves;
    }
}
