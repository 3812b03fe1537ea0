package hexgame.app;

import static hexgame.constants.HexConstants.DEFAULT_BOARD_SIZE;
import static hexgame.constants.HexConstants.MAX_BOARD_SIZE;
import static hexgame.constants.HexConstants.MIN_BOARD_SIZE;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option table in declaration order. Spin options carry bounds, check options accept
 * {@code true}/{@code false}.
 */
public class HexOptionsImpl implements HexOptions {

    private static final Logger LOG = LoggerFactory.getLogger(HexOptionsImpl.class);

    public static final String SIZE = "Size";
    public static final String SHOW_BRIDGES = "ShowBridges";
    public static final String SHOW_BOARD = "ShowBoard";

    private static final class HexOption {
        final String type;
        final String defaultValue;
        final String min;
        final String max;
        final Predicate<String> validator;
        String value;

        HexOption(String type, String defaultValue, String min, String max, Predicate<String> validator) {
            this.type = type;
            this.defaultValue = defaultValue;
            this.min = min;
            this.max = max;
            this.validator = validator;
            this.value = defaultValue;
        }

        void print(PrintStream out, String name) {
            StringBuilder sb = new StringBuilder("option name ").append(name).append(" type ").append(type);
            if (defaultValue != null) sb.append(" default ").append(defaultValue);
            if (min != null) sb.append(" min ").append(min);
            if (max != null) sb.append(" max ").append(max);
            sb.append(" value ").append(value);
            out.println(sb);
        }
    }

    private final Map<String, HexOption> options = new LinkedHashMap<>();

    public HexOptionsImpl() {
        options.put(SIZE, spin(DEFAULT_BOARD_SIZE, MIN_BOARD_SIZE, MAX_BOARD_SIZE));
        options.put(SHOW_BRIDGES, check(true));
        options.put(SHOW_BOARD, check(true));
    }

    @Override
    public boolean setOption(String line) {
        String[] parts = line.split(" value ", 2);
        String name = parts[0].replaceFirst("^\\s*setoption\\s+name\\s+", "").trim();
        String value = parts.length > 1 ? parts[1].trim() : "";

        HexOption option = options.get(name);
        if (option == null) {
            LOG.debug("Unknown option: {}", name);
            return false;
        }
        if (!option.validator.test(value)) {
            LOG.debug("Rejected value '{}' for option {}", value, name);
            return false;
        }
        option.value = value;
        LOG.info("Option {} set to {}", name, value);
        return true;
    }

    @Override
    public void printOptions(PrintStream out) {
        for (Map.Entry<String, HexOption> entry : options.entrySet()) {
            entry.getValue().print(out, entry.getKey());
        }
    }

    @Override
    public String getOptionValue(String name) {
        HexOption o = options.get(name);
        return o != null ? o.value : null;
    }

    @Override
    public int boardSize() {
        return Integer.parseInt(getOptionValue(SIZE));
    }

    @Override
    public boolean showBridges() {
        return Boolean.parseBoolean(getOptionValue(SHOW_BRIDGES));
    }

    @Override
    public boolean showBoard() {
        return Boolean.parseBoolean(getOptionValue(SHOW_BOARD));
    }

    /* ── option factories ─────────────────────────────────────── */

    private static HexOption spin(int defaultValue, int min, int max) {
        return new HexOption("spin", Integer.toString(defaultValue), Integer.toString(min), Integer.toString(max),
                v -> {
                    try {
                        int n = Integer.parseInt(v);
                        return n >= min && n <= max;
                    } catch (NumberFormatException e) {
                        return false;
                    }
                });
    }

    private static HexOption check(boolean defaultValue) {
        return new HexOption("check", Boolean.toString(defaultValue), null, null,
                v -> v.equals("true") || v.equals("false"));
    }
}
