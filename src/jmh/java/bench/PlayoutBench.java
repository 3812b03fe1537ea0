package bench;

import hexgame.Color;
import hexgame.Coords;
import hexgame.InvalidMoveException;
import hexgame.internal.BoardImpl;
import hexgame.internal.GameImpl;
import org.openjdk.jmh.annotations.*;

import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/** Micro-benchmark: full random games, and bridge scans over a crowded board. */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class PlayoutBench {

    /** Move orders fixed per trial so every invocation replays identical games. */
    @State(Scope.Thread)
    public static class TestData {
        @Param({"11", "19"})
        public int size;

        Coords[][] orders = new Coords[16][];
        BoardImpl crowded;
        int next;

        @Setup(Level.Trial)
        public void init() throws InvalidMoveException {
            SplittableRandom rng = new SplittableRandom(42);
            for (int g = 0; g < orders.length; g++) {
                List<Coords> cells = new BoardImpl(size).getEmptyCells();
                Coords[] order = cells.toArray(new Coords[0]);
                for (int i = order.length - 1; i > 0; i--) {
                    int j = rng.nextInt(i + 1);
                    Coords t = order[i]; order[i] = order[j]; order[j] = t;
                }
                orders[g] = order;
            }

            // two thirds of the cells taken, colors alternating along a random order
            crowded = new BoardImpl(size);
            Coords[] order = orders[0];
            for (int i = 0; i < order.length * 2 / 3; i++) {
                crowded.play(order[i], (i & 1) == 0 ? Color.BLACK : Color.WHITE);
            }
        }
    }

    @Benchmark
    public int playout(TestData td) throws InvalidMoveException {
        Coords[] order = td.orders[td.next++ & (td.orders.length - 1)];
        GameImpl game = new GameImpl(td.size);
        int moves = 0;
        while (!game.getStatus().isFinished()) {
            game.play(order[moves++]);
        }
        return moves;
    }

    @Benchmark
    public int bridgeScan(TestData td) {
        int found = 0;
        for (Coords c : td.orders[0]) {
            found += td.crowded.findAttackedBridges(c).size();
        }
        return found;
    }
}
