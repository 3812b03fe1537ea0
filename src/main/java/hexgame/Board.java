package hexgame;

import java.util.List;
import java.util.Optional;

/**
 * A Hex board: a {@code size x size} rhombus of hexagonal cells plus four permanently colored
 * virtual edges.
 *
 * <p>Stones are never removed. Connectivity between like-colored stones (and the edges of the same
 * color) is tracked incrementally, so {@link #isInSameSet} answers in near-constant time.
 *
 * <p>Implementations are not thread-safe: even connectivity queries may rewrite internal state.
 */
public interface Board {

  /** @return side length, between {@code MIN_BOARD_SIZE} and {@code MAX_BOARD_SIZE}. */
  int size();

  /**
   * Places a stone.
   *
   * @throws InvalidMoveException {@code OUT_OF_BOUNDS} or {@code CELL_OCCUPIED}; the board is left
   *     untouched in both cases
   */
  void play(Coords coords, Color color) throws InvalidMoveException;

  /** @return the stone at {@code coords}, empty if none was played there. */
  Optional<Color> getColor(Coords coords);

  /** @return {@code true} iff a path of like-colored adjacent cells joins {@code a} and {@code b}. */
  boolean isInSameSet(CoordsOrEdge a, CoordsOrEdge b);

  default boolean isInSameSet(Edge a, Edge b) {
    return isInSameSet(CoordsOrEdge.of(a), CoordsOrEdge.of(b));
  }

  /** @return every cell without a stone, row-major. */
  List<Coords> getEmptyCells();

  /**
   * Midpoints of opponent bridges threatened by the stone at {@code coords}, in clockwise neighbor
   * order starting at the left neighbor. Empty if {@code coords} holds no stone.
   */
  List<Coords> findAttackedBridges(Coords coords);

  /**
   * @return a fresh {@code size x size} matrix, row-major, {@code null} for empty cells.
   */
  Color[][] toStoneMatrix();
}
