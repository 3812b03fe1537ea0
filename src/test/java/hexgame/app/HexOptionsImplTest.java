package hexgame.app;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HexOptionsImplTest {

    private final HexOptionsImpl opts = new HexOptionsImpl();

    @Test
    void defaults() {
        assertEquals(11, opts.boardSize());
        assertTrue(opts.showBridges());
        assertTrue(opts.showBoard());
        assertEquals("11", opts.getOptionValue(HexOptionsImpl.SIZE));
        assertNull(opts.getOptionValue("Hash"));
    }

    @Test
    void setsSpinWithinBounds() {
        assertTrue(opts.setOption("setoption name Size value 19"));
        assertEquals(19, opts.boardSize());
        assertTrue(opts.setOption("setoption name Size value 2"));
        assertEquals(2, opts.boardSize());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "setoption name Size value 1",
            "setoption name Size value 20",
            "setoption name Size value eleven",
            "setoption name Size",
            "setoption name ShowBoard value yes",
            "setoption name Threads value 4"
    })
    void rejectsBadValues(String line) {
        assertFalse(opts.setOption(line));
        assertEquals(11, opts.boardSize());
        assertTrue(opts.showBoard());
    }

    @Test
    void setsCheck() {
        assertTrue(opts.setOption("setoption name ShowBridges value false"));
        assertFalse(opts.showBridges());
        assertEquals("false", opts.getOptionValue(HexOptionsImpl.SHOW_BRIDGES));
        assertTrue(opts.showBoard());
    }

    @Test
    void printsInDeclarationOrder() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        opts.setOption("setoption name ShowBoard value false");
        opts.printOptions(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertArrayEquals(new String[] {
                "option name Size type spin default 11 min 2 max 19 value 11",
                "option name ShowBridges type check default true value true",
                "option name ShowBoard type check default true value false"
        }, lines);
    }
}
