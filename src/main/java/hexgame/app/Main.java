package hexgame.app;

import hexgame.Color;
import hexgame.Coords;
import hexgame.InvalidMoveException;
import hexgame.Status;
import hexgame.internal.GameImpl;
import hexgame.io.JsonGameCodec;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wire everything together and run the command loop, or run the random-playout bench.
 *
 * <pre>
 *   java -jar hexgame.jar [--size N]
 *   java -jar hexgame.jar bench [games] [size] [seed]
 * </pre>
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int games = (args.length > 1) ? Integer.parseInt(args[1]) : 1000;
            int size  = (args.length > 2) ? Integer.parseInt(args[2]) : 11;
            long seed = (args.length > 3) ? Long.parseLong(args[3]) : 42L;
            runPlayoutBench(games, size, seed);
            return;
        }

        HexOptions opts = new HexOptionsImpl();
        if (args.length > 1 && "--size".equals(args[0])) {
            if (!opts.setOption("setoption name " + HexOptionsImpl.SIZE + " value " + args[1])) {
                System.err.println("Invalid board size: " + args[1]);
                System.exit(2);
            }
        }

        System.out.println("Hex");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        HexHandler handler = new HexHandlerImpl(opts, new JsonGameCodec(), in, System.out);
        handler.runLoop();
    }

    /** Plays {@code games} uniformly random games to the end and reports moves per second. */
    private static void runPlayoutBench(int games, int size, long seed) {
        SplittableRandom rng = new SplittableRandom(seed);
        long totalMoves = 0;
        int blackWins = 0;

        long t0 = System.nanoTime();
        for (int g = 0; g < games; g++) {
            GameImpl game = new GameImpl(size);
            totalMoves += playout(game, rng);
            if (game.getStatus().player() == Color.BLACK) blackWins++;
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        long mps = ms > 0 ? (1000L * totalMoves) / ms : 0;
        System.out.printf("Games played    : %d%n", games);
        System.out.printf("Black wins      : %d%n", blackWins);
        System.out.printf("Moves played    : %d%n", totalMoves);
        System.out.printf("Total time (ms) : %d%n", ms);
        System.out.printf("Moves/second    : %d%n", mps);
        System.out.println("benchok");
        LOG.debug("bench size={} seed={} done in {} ms", size, seed, ms);
    }

    /** @return number of moves until the game finished */
    static int playout(GameImpl game, SplittableRandom rng) {
        List<Coords> empty = new ArrayList<>(game.getBoard().getEmptyCells());
        int moves = 0;
        // shuffle lazily: pick a random remaining cell, swap it out
        for (int remaining = empty.size(); remaining > 0; remaining--) {
            int pick = rng.nextInt(remaining);
            Coords coords = empty.get(pick);
            empty.set(pick, empty.get(remaining - 1));
            try {
                game.play(coords);
            } catch (InvalidMoveException e) {
                throw new IllegalStateException("Random playout picked an illegal move " + coords, e);
            }
            moves++;
            Status status = game.getStatus();
            if (status.isFinished()) break;
        }
        return moves;
    }
}
