package imgpack.models;

import java.util.*;

/**
 * Encoded output of one work item. A dropped result carries no payload and is never archived.
 * <p>
 * The payload array is handed over, not copied: neither the producing worker nor the sink may
 * modify it once the result is emitted. Equality compares payload contents.
 */
public record ResultItem(
        String identity,
        long originalSize,
        byte[] encodedPayload,
        boolean dropped
) {

    private static final byte[] NO_PAYLOAD = new byte[0];

    public ResultItem {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(encodedPayload, "encodedPayload");
    }

    public ResultItem(String identity, long originalSize, byte[] encodedPayload) {
        this(identity, originalSize, encodedPayload, false);
    }

    public static ResultItem dropped(String identity, long originalSize) {
        return new ResultItem(identity, originalSize, NO_PAYLOAD, true);
    }

    public int encodedSize() {
        return encodedPayload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultItem)) return false;
        ResultItem other = (ResultItem) o;
        return originalSize == other.originalSize
                && dropped == other.dropped
                && identity.equals(other.identity)
                && Arrays.equals(encodedPayload, other.encodedPayload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(identity, originalSize, dropped) + Arrays.hashCode(encodedPayload);
    }

    @Override
    public String toString() {
        return String.format("ResultItem[identity=%s, originalSize=%d, encodedSize=%d, dropped=%s]",
                identity, originalSize, encodedSize(), dropped);
    }
}
