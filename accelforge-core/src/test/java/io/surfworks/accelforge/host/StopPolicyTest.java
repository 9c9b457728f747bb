package io.surfworks.accelforge.host;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StopPolicy.
 */
class StopPolicyTest {

    @Test
    void parseAllForms() {
        assertEquals(StopPolicy.TERMINATE, StopPolicy.parse("term"));
        assertEquals(StopPolicy.TERMINATE, StopPolicy.parse("TERMINATE"));
        assertEquals(StopPolicy.TERMINATE, StopPolicy.parse("0"));
        assertEquals(StopPolicy.PAUSE, StopPolicy.parse("stop"));
        assertEquals(StopPolicy.PAUSE, StopPolicy.parse(" Pause "));
        assertEquals(StopPolicy.PAUSE, StopPolicy.parse("1"));
        assertEquals(StopPolicy.KEEP, StopPolicy.parse("keep"));
        assertEquals(StopPolicy.KEEP, StopPolicy.parse("2"));
    }

    @Test
    void parseBlankIsNull() {
        assertNull(StopPolicy.parse(null));
        assertNull(StopPolicy.parse("  "));
    }

    @Test
    void parseInvalidThrows() {
        assertThrows(IllegalArgumentException.class, () -> StopPolicy.parse("3"));
        assertThrows(IllegalArgumentException.class, () -> StopPolicy.parse("halt"));
    }

    @Test
    void shortNameRoundTrips() {
        for (StopPolicy policy : StopPolicy.values()) {
            assertEquals(policy, StopPolicy.parse(policy.shortName()));
        }
    }
}
