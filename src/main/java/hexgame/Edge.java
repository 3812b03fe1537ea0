package hexgame;

import java.util.List;

/** The four virtual board edges. Each one is permanently owned by one player. */
public enum Edge {
  LEFT(Color.WHITE),
  TOP(Color.BLACK),
  RIGHT(Color.WHITE),
  BOTTOM(Color.BLACK);

  private static final List<Edge> BLACK_EDGES = List.of(TOP, BOTTOM);
  private static final List<Edge> WHITE_EDGES = List.of(LEFT, RIGHT);

  private final Color color;

  Edge(Color color) {
    this.color = color;
  }

  /** @return the player owning this edge, never {@code null}. */
  public Color color() {
    return color;
  }

  /** @return the two edges {@code color} has to connect, in a fixed order. */
  public static List<Edge> edgesOf(Color color) {
    return color == Color.BLACK ? BLACK_EDGES : WHITE_EDGES;
  }
}
