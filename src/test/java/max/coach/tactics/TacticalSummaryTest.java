package max.coach.tactics;

import max.coach.rules.Game;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TacticalSummaryTest {

    @Test
    public void quietPositionShouldHaveNoThreats() {
        assertEquals("No immediate tactical threats detected.", TacticalSummary.describe(Game.newStandardGame()));
        assertEquals(TacticalSummary.NO_THREATS, TacticalSummary.describe(List.of()));
    }

    @Test
    public void criticalThreatsShouldBeListedFirst() {
        Game game = Game.from("r3k3/2N5/8/8/8/8/8/4K3 b - - 0 1");

        String summary = TacticalSummary.describe(game);

        assertEquals("""
                Critical threats:
                  - Knight on c7 forks rook on a8 and king on e8
                  - Black rook on a8 is undefended and attacked""", summary);
    }

    @Test
    public void warningsShouldBeListedInScanOrder() {
        // the pinning bishop is itself attacked by the queen and undefended
        Game game = Game.from("4k3/3q4/8/1B6/8/8/8/4K3 w - - 0 1");

        String summary = TacticalSummary.describe(game);

        assertEquals("""
                Tactical features:
                  - Queen on d7 is pinned to the king by bishop
                  - White bishop on b5 is undefended and attacked""", summary);
    }

    @Test
    public void infoMotifsShouldBeLeftOut() {
        Game game = Game.from("k7/8/8/8/4r3/8/4N3/4K3 w - - 0 1");

        assertEquals(1, TacticalMotifDetector.analyzeTactics(game).size());
        assertEquals("", TacticalSummary.describe(game));
    }
}
