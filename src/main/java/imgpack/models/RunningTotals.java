package imgpack.models;

// Snapshot of a unit's progress counters.
public record RunningTotals(
        int itemsProcessed,
        int itemsExpected,
        long totalOriginalBytes,
        long totalEncodedBytes
) {

    public static final RunningTotals EMPTY = new RunningTotals(0, 0, 0, 0);

    public double percentComplete() {
        return itemsExpected > 0 ? 100.0 * itemsProcessed / itemsExpected : 0;
    }

    public double compressionRatio() {
        return totalOriginalBytes > 0 ? 100.0 * totalEncodedBytes / totalOriginalBytes : 0;
    }
}
