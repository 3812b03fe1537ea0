package hexgame.app;

import java.io.PrintStream;

/**
 * Runtime settings of the command loop, changed through
 * {@code setoption name <Name> value <value>} lines.
 */
public interface HexOptions {

    /**
     * Parses a full {@code setoption ...} line and applies it.
     *
     * @return {@code true} if the option exists and the value was accepted
     */
    boolean setOption(String line);

    /** Prints one {@code option name ...} line per option. */
    void printOptions(PrintStream out);

    /** @return current value as text, or {@code null} for an unknown option. */
    String getOptionValue(String name);

    int boardSize();

    boolean showBridges();

    boolean showBoard();
}
