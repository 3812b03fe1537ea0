package hexgame.app;

import hexgame.Coords;
import hexgame.Game;
import hexgame.InvalidBoardException;
import hexgame.InvalidMoveException;
import hexgame.Status;
import hexgame.internal.GameImpl;
import hexgame.io.BoardFormatter;
import hexgame.io.GameCodec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text front-end for humans and scripts.
 *
 * <p>Every command prints its answer to {@code out}; rejected input prints a single
 * {@code Error: ...} line and leaves the game untouched.</p>
 */
public final class HexHandlerImpl implements HexHandler {

    private static final Logger LOG = LoggerFactory.getLogger(HexHandlerImpl.class);

    private static final Pattern NOTATION = Pattern.compile("[a-z][0-9]+");
    private static final Pattern ROW_COLUMN = Pattern.compile("[0-9]+\\s*,\\s*[0-9]+");

    static final List<String> HELP = List.of(
            "Commands:",
            "  <coords>                play a stone, e.g. c3 or 2,2 (row,column from 0)",
            "  play <coords>           same as above",
            "  new [size]              start a new game",
            "  show                    print the board",
            "  status                  print whose turn it is or who won",
            "  bridges <coords>        attacked bridges around a stone",
            "  empty                   list empty cells",
            "  save <file>             write the game as JSON",
            "  load <file>             read a game from JSON",
            "  setoption name <N> value <V>",
            "  options                 list options",
            "  quit");

    /* ── collaborators ─────────────────────────────────────────── */
    private final HexOptions opts;
    private final GameCodec codec;
    private final BufferedReader in;
    private final PrintStream out;

    /* ── mutable state ─────────────────────────────────────────── */
    private Game game;

    public HexHandlerImpl(HexOptions opts, GameCodec codec, BufferedReader in, PrintStream out) {
        this.opts  = opts;
        this.codec = codec;
        this.in    = in;
        this.out   = out;
        this.game  = new GameImpl(opts.boardSize());
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override public void runLoop() {
        out.print(BoardFormatter.format(game.getBoard()));
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty() && handle(line)) break;   // "quit" → exit
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Reading commands failed", e);
        }
    }

    Game game() {
        return game;
    }

    /* ── router ───────────────────────────────────────────────── */
    boolean handle(String cmd) {
        String[] t = cmd.split("\\s+");

        try {
            return switch (t[0]) {
                case "play"      -> { cmdPlay(argument(t, cmd)); yield false; }
                case "new"       -> { cmdNew(t);                 yield false; }
                case "show"      -> { cmdShow();                 yield false; }
                case "status"    -> { cmdStatus();               yield false; }
                case "bridges"   -> { cmdBridges(argument(t, cmd)); yield false; }
                case "empty"     -> { cmdEmpty();                yield false; }
                case "save"      -> { cmdSave(argument(t, cmd)); yield false; }
                case "load"      -> { cmdLoad(argument(t, cmd)); yield false; }
                case "setoption" -> { cmdSetOption(cmd);         yield false; }
                case "options"   -> { opts.printOptions(out);    yield false; }
                case "help"      -> { HELP.forEach(out::println); yield false; }
                case "quit", "exit" -> true;
                default -> {
                    if (NOTATION.matcher(cmd).matches() || ROW_COLUMN.matcher(cmd).matches()) {
                        cmdPlay(cmd);
                    } else {
                        error("Unknown command: " + cmd);
                    }
                    yield false;
                }
            };
        } catch (IllegalArgumentException e) {
            error(e.getMessage());
            return false;
        }
    }

    /* ── commands ─────────────────────────────────────────────── */

    private void cmdPlay(String text) {
        Coords coords = parseCoords(text);
        try {
            game.play(coords);
        } catch (InvalidMoveException e) {
            error(e.getMessage());
            return;
        }

        if (opts.showBoard()) out.print(BoardFormatter.format(game.getBoard()));
        if (opts.showBridges()) {
            List<Coords> attacked = game.getBoard().findAttackedBridges(coords);
            if (!attacked.isEmpty()) out.println("Attacked bridges: " + join(attacked));
        }
        cmdStatus();
    }

    private void cmdNew(String[] t) {
        int size = t.length > 1 ? parseSize(t[1]) : opts.boardSize();
        game = new GameImpl(size);
        LOG.info("New {}x{} game", size, size);
        out.print(BoardFormatter.format(game.getBoard()));
    }

    private void cmdShow() {
        out.print(BoardFormatter.format(game.getBoard()));
    }

    private void cmdStatus() {
        Status status = game.getStatus();
        if (status.isFinished()) {
            out.println(status.player() + " wins");
        } else {
            out.println(status.player() + " to move");
        }
    }

    private void cmdBridges(String text) {
        Coords coords = parseCoords(text);
        if (!coords.isOnBoard(game.getBoard().size())) {
            error("Coordinates " + coords + " are out of bounds");
            return;
        }
        out.println(join(game.getBoard().findAttackedBridges(coords)));
    }

    private void cmdEmpty() {
        List<Coords> empty = game.getBoard().getEmptyCells();
        out.println(empty.size() + " empty: " + join(empty));
    }

    private void cmdSave(String file) {
        try {
            Files.writeString(Path.of(file), codec.save(game), StandardCharsets.UTF_8);
            LOG.info("Saved game to {}", file);
            out.println("Saved " + file);
        } catch (IOException e) {
            LOG.warn("Cannot write {}", file, e);
            error("Cannot write " + file + ": " + e.getMessage());
        }
    }

    private void cmdLoad(String file) {
        try {
            game = codec.load(Files.readString(Path.of(file), StandardCharsets.UTF_8));
            LOG.info("Loaded game from {}", file);
        } catch (IOException e) {
            LOG.warn("Cannot read {}", file, e);
            error("Cannot read " + file + ": " + e.getMessage());
            return;
        } catch (InvalidBoardException e) {
            error("Invalid game in " + file + ": " + e.getMessage());
            return;
        }
        out.print(BoardFormatter.format(game.getBoard()));
        cmdStatus();
    }

    private void cmdSetOption(String line) {
        if (!opts.setOption(line)) error("Cannot apply: " + line);
    }

    /* ── helpers ─────────────────────────────────────────────── */

    private void error(String message) {
        LOG.debug("Rejected input: {}", message);
        out.println("Error: " + message);
    }

    /** everything after the command word */
    private static String argument(String[] t, String cmd) {
        if (t.length < 2) throw new IllegalArgumentException("Missing argument for " + t[0]);
        return cmd.substring(t[0].length()).trim();
    }

    static Coords parseCoords(String text) {
        String s = text.trim();
        if (ROW_COLUMN.matcher(s).matches()) {
            String[] p = s.split(",");
            try {
                return new Coords(Integer.parseInt(p[0].trim()), Integer.parseInt(p[1].trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid coordinates: " + text);
            }
        }
        return Coords.parse(s);
    }

    private static int parseSize(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid board size: " + text);
        }
    }

    private static String join(List<Coords> coords) {
        return coords.stream().map(Coords::toString).collect(Collectors.joining(" "));
    }
}
