package max.coach.analysis;

import max.coach.classify.Classification;
import max.coach.classify.MoveClassifier;
import max.coach.common.Color;
import max.coach.common.Piece;
import max.coach.evaluator.EngineAnalysis;
import max.coach.evaluator.EvaluatorUnavailableException;
import max.coach.evaluator.PositionEvaluator;
import max.coach.evaluator.SearchLimit;
import max.coach.rules.Game;
import max.coach.rules.IllegalMoveException;
import max.coach.rules.Move;
import max.coach.rules.notations.GameRecord;
import max.coach.rules.notations.PgnParser;
import max.coach.rules.notations.SanUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reviews a game move by move against a {@link PositionEvaluator}: evaluation swing, best move,
 * classification and comment for every half-move, plus per-side error counts.
 * <p>
 * The analyzer owns no mutable state; concurrent analyses need their own evaluator session each.
 */
public class GameAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(GameAnalyzer.class);

    static final double LOSING_EVAL = -1.0;
    static final double RESCUED_EVAL = -0.5;

    private final PositionEvaluator evaluator;
    private final AnalyzerConfig config;

    public GameAnalyzer(PositionEvaluator evaluator) {
        this(evaluator, AnalyzerConfig.defaults());
    }

    public GameAnalyzer(PositionEvaluator evaluator, AnalyzerConfig config) {
        this.evaluator = Objects.requireNonNull(evaluator);
        this.config = Objects.requireNonNull(config);
    }

    public AnalyzerConfig config() {
        return config;
    }

    public GameAnalysis analyzeGame(String pgn) {
        GameRecord record;
        try {
            record = PgnParser.parse(pgn);
        } catch (IllegalArgumentException e) {
            throw new InvalidGameRecordException("Cannot read PGN: " + e.getMessage(), e);
        }
        return analyzeGame(record);
    }

    /**
     * @throws EvaluatorUnavailableException when the evaluator is down, before anything else, or when it
     *                                       stops answering during the review; no partial result is kept
     * @throws InvalidGameRecordException    when a move cannot be replayed, before any evaluator query
     */
    public GameAnalysis analyzeGame(GameRecord record) {
        Objects.requireNonNull(record);
        if(!evaluator.isAvailable()) {
            throw new EvaluatorUnavailableException("Position evaluator is not available, cannot analyze game");
        }
        List<Move> moves = replay(record);
        log.info("Analyzing game of {} half-moves ({})", moves.size(), config);

        Game game = Game.from(record.startFen());
        evaluator.newGame();
        SearchLimit limit = config.searchLimit();
        AnalysisState state = AnalysisState.initial(game.fullMoveClock);
        List<MoveAnalysis> reviewed = new ArrayList<>(moves.size());
        for(Move move : moves) {
            MoveAnalysis analysis;
            try {
                analysis = analyzeMove(game, move, state, limit);
            } catch (EvaluatorUnavailableException e) {
                log.error("Analysis aborted at move {}: {}", state.moveNumber(), e.getMessage());
                throw e;
            }
            log.debug("{}. {} ({}) {} -> {} : {}", analysis.moveNumber(), analysis.moveSan(), analysis.color().label(),
                    analysis.evalBefore(), analysis.evalAfter(), analysis.classification().label());
            reviewed.add(analysis);
            state = state.after(analysis);
        }

        GameAnalysis gameAnalysis = state.toGameAnalysis(reviewed, config.criticalMovesInSummary);
        log.info("Game analyzed: white {}, black {}", gameAnalysis.white(), gameAnalysis.black());
        return gameAnalysis;
    }

    /**
     * Plays the whole record on a scratch game so a bad move is reported before the evaluator is used.
     */
    static List<Move> replay(GameRecord record) {
        Game game;
        try {
            game = Game.from(record.startFen());
        } catch (IllegalArgumentException e) {
            throw new InvalidGameRecordException("Invalid start position " + record.startFen(), e);
        }
        List<Move> moves = new ArrayList<>(record.sanMoves().size());
        for(int i = 0; i < record.sanMoves().size(); i++) {
            String san = record.sanMoves().get(i);
            try {
                Move move = SanUtils.parseSan(game, san);
                game.playMove(move);
                moves.add(move);
            } catch (IllegalMoveException e) {
                throw new InvalidGameRecordException("Cannot replay half-move " + (i + 1) + " '" + san + "': " + e.getMessage(), i, e);
            }
        }
        return moves;
    }

    /**
     * Reviews one half-move and plays it on {@code game}.
     */
    MoveAnalysis analyzeMove(Game game, Move move, AnalysisState state, SearchLimit limit) {
        Color mover = game.currentPlayer;
        boolean capture = game.isCapture(move);
        boolean check = game.givesCheck(move);
        boolean sacrifice = capture && isSacrifice(game, move);

        EngineAnalysis beforeMove = evaluator.analyse(game.toFen(), limit);
        String bestSan = bestMoveSan(game, beforeMove);
        Double bestEval = bestSan == null ? null : beforeMove.score().toPawns();

        String moveSan = SanUtils.toSan(game, move);
        game.playMove(move);
        String fenAfter = game.toFen();

        EngineAnalysis afterMove = evaluator.analyse(fenAfter, limit);
        double evalBefore = state.previousEval();
        double evalAfter = afterMove.score().toPawns();
        double evalChange = mover.isWhite() ? evalAfter - evalBefore : evalBefore - evalAfter;

        boolean playedBest = moveSan.equals(bestSan);
        boolean hadBetterMove = bestEval != null && !playedBest;
        boolean onlyGoodMove = playedBest && evalBefore < LOSING_EVAL && evalAfter > RESCUED_EVAL;

        Classification classification = MoveClassifier.classify(evalChange, hadBetterMove, sacrifice,
                evalBefore, evalAfter, onlyGoodMove);
        String betterMove = hadBetterMove ? bestSan : null;
        String comment = MoveClassifier.comment(classification, evalChange, betterMove, sacrifice);

        return new MoveAnalysis(state.moveNumber(), mover, moveSan, evalBefore, evalAfter, evalChange,
                betterMove, bestEval, classification, comment, capture, check, sacrifice, fenAfter);
    }

    // Material value, king 0: taking with the more valuable piece gives material up
    static boolean isSacrifice(Game game, Move move) {
        Piece moving = game.pieceAt(move.startPosition());
        Piece captured = game.capturedPiece(move);
        return moving != null && captured != null
                && moving.type().materialValue() > captured.type().materialValue();
    }

    /**
     * SAN of the evaluator's best move, null when it has none or proposes a move that is not legal here.
     */
    static String bestMoveSan(Game game, EngineAnalysis analysis) {
        if(!analysis.hasBestMove()) {
            return null;
        }
        try {
            Move best = Move.fromUciNotation(analysis.bestMove());
            if(!game.isLegal(best)) {
                log.warn("Evaluator proposed illegal move {} in {}", analysis.bestMove(), game.toFen());
                return null;
            }
            return SanUtils.toSan(game, best);
        } catch (IllegalMoveException e) {
            log.warn("Evaluator proposed unreadable move {} in {}", analysis.bestMove(), game.toFen());
            return null;
        }
    }
}
