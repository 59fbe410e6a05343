package imgpack.models;

import java.nio.file.*;

// Outcome of one input directory. archive is null when the directory held no eligible images.
public record UnitReport(
        String unitName,
        Path archive,
        RunningTotals totals,
        int entriesWritten,
        boolean interrupted
) {

    public static UnitReport empty(String unitName) {
        return new UnitReport(unitName, null, RunningTotals.EMPTY, 0, false);
    }

    public boolean archived() {
        return archive != null;
    }
}
