package in.kiteticker.bootstrap;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void testParseTokens() {
        assertEquals(List.of(408065L, 256265L), App.parseTokens("408065, 256265"));
        assertEquals(List.of(408065L), App.parseTokens(" 408065 ,,"));
        assertTrue(App.parseTokens("").isEmpty());
    }

    @Test
    void testParseTokensRejectsGarbage() {
        assertThrows(NumberFormatException.class, () -> App.parseTokens("408065,INFY"));
    }
}
