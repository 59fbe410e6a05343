package imgpack.models;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class ResultItemTest {

    @Test
    void equalityComparesPayloadContents() {
        ResultItem first = new ResultItem("p1", 10, new byte[] {1, 2, 3});
        ResultItem second = new ResultItem("p1", 10, new byte[] {1, 2, 3});

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, new ResultItem("p1", 10, new byte[] {1, 2, 4}));
        assertNotEquals(first, new ResultItem("p1", 10, new byte[] {1, 2, 3}, true));
    }

    @Test
    void droppedResultHasNoPayload() {
        ResultItem dropped = ResultItem.dropped("p2", 100);

        assertTrue(dropped.dropped());
        assertEquals(0, dropped.encodedSize());
        assertEquals(100, dropped.originalSize());
    }

    @Test
    void toStringShowsSizeInsteadOfBytes() {
        String text = new ResultItem("p1", 10, new byte[] {1, 2, 3}).toString();

        assertTrue(text.contains("encodedSize=3"), text);
        assertFalse(text.contains("[B@"), text);
    }

    @Test
    void rejectsMissingPayload() {
        assertThrows(NullPointerException.class, () -> new ResultItem("p1", 10, null));
    }
}
