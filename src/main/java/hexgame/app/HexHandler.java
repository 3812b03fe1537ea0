package hexgame.app;

/**
 * Line-oriented command loop around a single game. Reads until {@code quit} or end of input.
 */
public interface HexHandler {

    void runLoop();
}
