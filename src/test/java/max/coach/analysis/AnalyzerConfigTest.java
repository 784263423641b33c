package max.coach.analysis;

import max.coach.evaluator.SearchLimit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AnalyzerConfigTest {

    @Test
    public void defaultsShouldSearchByDepth() {
        AnalyzerConfig config = new AnalyzerConfig.Builder().build();

        assertEquals(12, config.depth);
        assertEquals(SearchLimit.UNSET, config.moveTimeMs);
        assertEquals(100, config.blunderThresholdCp);
        assertEquals(5, config.criticalMovesInSummary);
        assertEquals("go depth 12", config.searchLimit().toGoCommand());
    }

    @Test
    public void systemPropertiesShouldOverrideDefaults() {
        System.setProperty("analysis.depth", "7");
        System.setProperty("analysis.movetime", "250");
        try {
            AnalyzerConfig config = AnalyzerConfig.defaults();

            assertEquals(7, config.depth);
            assertEquals(250, config.moveTimeMs);
            assertEquals(new SearchLimit(7, 250), config.searchLimit());
        } finally {
            System.clearProperty("analysis.depth");
            System.clearProperty("analysis.movetime");
        }
    }

    @Test
    public void toBuilderShouldCopyEveryField() {
        AnalyzerConfig config = new AnalyzerConfig.Builder().depth(4).blunderThresholdCp(250).principalVariationMoves(3).build();

        AnalyzerConfig copy = config.toBuilder().build();

        assertEquals(config.toString(), copy.toString());
    }

    @Test
    public void unusableSettingsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AnalyzerConfig.Builder().depth(SearchLimit.UNSET).moveTimeMs(SearchLimit.UNSET).build());
        assertThrows(IllegalArgumentException.class, () -> new AnalyzerConfig.Builder().blunderThresholdCp(0).build());
        assertThrows(IllegalArgumentException.class, () -> new AnalyzerConfig.Builder().criticalMovesInSummary(-1).build());
    }
}
