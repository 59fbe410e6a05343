package imgpack.models;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class RunningTotalsTest {

    @Test
    void derivesPercentAndRatio() {
        RunningTotals totals = new RunningTotals(1, 4, 2_000, 500);

        assertEquals(25.0, totals.percentComplete(), 1e-9);
        assertEquals(25.0, totals.compressionRatio(), 1e-9);
    }

    @Test
    void emptyTotalsDoNotDivideByZero() {
        assertEquals(0.0, RunningTotals.EMPTY.percentComplete());
        assertEquals(0.0, RunningTotals.EMPTY.compressionRatio());
    }
}
