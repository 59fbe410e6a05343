package imgpack.models;

public enum EncodeFailurePolicy {
    /** Drop the item and lower the expected total. */
    SKIP,
    /** Forward whatever the failed attempt produced, keeping processed == expected. */
    PLACEHOLDER
}
