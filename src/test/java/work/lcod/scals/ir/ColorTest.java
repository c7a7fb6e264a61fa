package work.lcod.scals.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ColorTest {

    @Test
    void parsesHexForms() {
        assertEquals(Color.WHITE, Color.parse("#FFF"));
        assertEquals(new Color(1, 0, 0, 1), Color.parse("#ff0000"));
        assertEquals(new Color(0, 0, 0, 0), Color.parse("00000000"));
    }

    @Test
    void parsesFunctionalForms() {
        assertEquals(new Color(1, 0, 0, 1), Color.parse("rgb(255, 0, 0)"));
        assertEquals(new Color(0, 0, 0, 0.5), Color.parse("rgba(0, 0, 0, .5)"));
        assertEquals(Color.CLEAR, Color.parse("transparent"));
    }

    @Test
    void malformedNumbersFallBackToBlack() {
        assertEquals(Color.BLACK, Color.parse("rgb(1.2.3, 0, 0)"));
        assertEquals(Color.BLACK, Color.parse("rgba(0, 0, 0, ..)"));
        assertEquals(Color.BLACK, Color.parse("#12345"));
        assertEquals(Color.BLACK, Color.parse(null));
        assertNull(Color.parseOptional(null));
    }

    @Test
    void validityMatchesWhatParseUnderstands() {
        assertTrue(Color.isValid("#007AFF"));
        assertTrue(Color.isValid(" Clear "));
        assertTrue(Color.isValid("rgba(10, 20, 30, 0.4)"));
        assertFalse(Color.isValid("rgb(1.2.3, 0, 0)"));
        assertFalse(Color.isValid("#12345"));
        assertFalse(Color.isValid("blue"));
        assertFalse(Color.isValid(null));
    }
}
