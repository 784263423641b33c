package max.coach.analysis;

import max.coach.evaluator.EvaluatorUnavailableException;
import max.coach.evaluator.Score;
import max.coach.rules.Game;
import max.coach.tactics.MotifType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PositionAssessorTest {
    private static final AnalyzerConfig CONFIG = new AnalyzerConfig.Builder().depth(8).principalVariationMoves(5).build();

    @Test
    public void quietPositionShouldBeAssessed() {
        // Given
        ScriptedEvaluator evaluator = new ScriptedEvaluator().answer(ScriptedEvaluator.START, "e2e4", Score.centipawns(30),
                "e2e4", "e7e5", "g1f3", "b8c6", "f1b5", "a7a6");

        // When
        PositionAssessment assessment = new PositionAssessor(evaluator, CONFIG).assess(Game.newStandardGame());

        // Then
        assertEquals("0.3", assessment.evaluation());
        assertEquals("e4", assessment.bestMove());
        assertEquals(List.of("e4", "e5", "Nf3", "Nc6", "Bb5"), assessment.principalVariation());
        assertFalse(assessment.tactical());
        assertEquals("Material is equal", assessment.material().description());
        assertTrue(assessment.motifs().isEmpty());
    }

    @Test
    public void mateScoreShouldBeTactical() {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().answer(ScriptedEvaluator.AFTER_NF6, "h5f7", Score.mateIn(2));
        Game game = Game.from(ScriptedEvaluator.AFTER_NF6 + " 2 3");

        PositionAssessment assessment = new PositionAssessor(evaluator, CONFIG).assess(game);

        assertEquals("M2", assessment.evaluation());
        assertEquals("Qxf7+", assessment.bestMove());
        assertEquals(List.of("Qxf7+"), assessment.principalVariation());
        assertTrue(assessment.tactical());
    }

    @Test
    public void largeAdvantageShouldBeTactical() {
        ScriptedEvaluator evaluator = new ScriptedEvaluator().answer(ScriptedEvaluator.AFTER_QXF7, "e8f7", Score.centipawns(151));
        Game game = Game.from(ScriptedEvaluator.AFTER_QXF7 + " 0 3");

        PositionAssessment assessment = new PositionAssessor(evaluator, CONFIG).assess(game);

        assertTrue(assessment.tactical());
        assertEquals("Kxf7", assessment.bestMove());
        assertTrue(assessment.motifs().stream().anyMatch(motif -> motif.type() == MotifType.HANGING_PIECE));
    }

    @Test
    public void principalVariationShouldStopAtTheFirstIllegalMove() {
        List<String> line = PositionAssessor.principalVariationSan(Game.newStandardGame(), List.of("e2e4", "e2e4", "g1f3"), 5);
        assertEquals(List.of("e4"), line);

        List<String> unreadable = PositionAssessor.principalVariationSan(Game.newStandardGame(), List.of("d2d4", "zz"), 5);
        assertEquals(List.of("d4"), unreadable);
    }

    @Test
    public void unavailableEvaluatorShouldBeReported() {
        ScriptedEvaluator evaluator = new ScriptedEvaluator();
        evaluator.available = false;

        assertThrows(EvaluatorUnavailableException.class,
                () -> new PositionAssessor(evaluator, CONFIG).assess(Game.newStandardGame()));
    }
}
