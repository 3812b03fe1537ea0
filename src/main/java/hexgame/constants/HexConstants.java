package hexgame.constants;

/** Process-wide board limits. */
public final class HexConstants {

  private HexConstants() {}

  /* ────────────── Board size ────────────── */
  // Neighbor arithmetic needs at least a 2x2 grid.
  public static final int MIN_BOARD_SIZE = 2;
  public static final int MAX_BOARD_SIZE = 19;
  public static final int DEFAULT_BOARD_SIZE = 11;

  /* ────────────── Cell layout ────────────── */
  public static final int EDGE_COUNT = 4;
  public static final int MAX_NEIGHBORS = 6;
}
