package hexgame;

import java.util.Objects;

/**
 * Either a cell of the board or one of its edges. Exactly one of {@link #coords()} and {@link
 * #edge()} is non-null.
 */
public record CoordsOrEdge(Coords coords, Edge edge) {

  public CoordsOrEdge {
    if ((coords == null) == (edge == null)) {
      throw new IllegalArgumentException("Exactly one of coords and edge must be set");
    }
  }

  public static CoordsOrEdge of(Coords coords) {
    return new CoordsOrEdge(Objects.requireNonNull(coords, "coords"), null);
  }

  public static CoordsOrEdge of(Edge edge) {
    return new CoordsOrEdge(null, Objects.requireNonNull(edge, "edge"));
  }

  public static CoordsOrEdge of(int row, int column) {
    return of(new Coords(row, column));
  }

  public boolean isEdge() {
    return edge != null;
  }

  @Override
  public String toString() {
    return isEdge() ? edge.name() : coords.toString();
  }
}
