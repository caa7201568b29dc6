package work.companion.exchange.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class TextValuesTest {
    @Test
    void parsesIntegersLeniently() {
        assertEquals(Optional.of(7), TextValues.parseInt(" 7 "));
        assertEquals(Optional.of(3), TextValues.parseInt("3.0"));
        assertEquals(Optional.of(0), TextValues.parseInt("0"));
        assertEquals(Optional.empty(), TextValues.parseInt("3.5"));
        assertEquals(Optional.empty(), TextValues.parseInt("many"));
        assertEquals(Optional.empty(), TextValues.parseInt(""));
    }

    @Test
    void readsLeadingNumberOfDurations() {
        assertEquals(Optional.of(45), TextValues.parseLeadingInt("45 seconds"));
        assertEquals(Optional.of(30), TextValues.parseLeadingInt("30s"));
        assertEquals(Optional.empty(), TextValues.parseLeadingInt("about a minute"));
    }

    @Test
    void parsesFlags() {
        assertEquals(Optional.of(true), TextValues.parseFlag("Yes"));
        assertEquals(Optional.of(true), TextValues.parseFlag("1"));
        assertEquals(Optional.of(false), TextValues.parseFlag("false"));
        assertEquals(Optional.of(false), TextValues.parseFlag("No"));
        assertEquals(Optional.empty(), TextValues.parseFlag("maybe"));
    }

    @Test
    void collapsesLineBreaks() {
        assertEquals("first line second line", TextValues.singleLine("first line\n  second line\r\n"));
        assertNull(TextValues.blankToNull("   "));
    }
}
