package hexgame.internal;

import hexgame.Edge;

/**
 * Hex-neighbor generation on the flat index space of {@link HexCells}.
 *
 * <p>Order is clockwise starting left: left, top-left, top-right, right, bottom-right,
 * bottom-left. Off-board neighbors are replaced by the matching edge; where two off-board
 * neighbors fall onto the same edge only one entry is produced, so top-right is dropped on the
 * top row and the right column, bottom-left on the bottom row and the left column.
 *
 * <pre>
 *   acute corners (a1, last cell)     4 neighbors
 *   obtuse corners, other border      5 neighbors
 *   interior                          6 neighbors
 * </pre>
 */
final class Neighbors {

  private Neighbors() {}

  /**
   * Writes the neighbors of {@code index} into {@code out} starting at position 0.
   *
   * @param out at least {@code MAX_NEIGHBORS} long
   * @return number of neighbors written
   */
  static int generate(HexCells cells, int index, int[] out) {
    if (cells.isEdge(index)) {
      throw new IllegalArgumentException("Edges have no neighbor list: " + index);
    }
    final int size = cells.size();
    final int column = index % size;
    final boolean topRow = index < size;
    final boolean bottomRow = index >= size * (size - 1);
    final boolean leftColumn = column == 0;
    final boolean rightColumn = column == size - 1;

    int n = 0;
    out[n++] = leftColumn ? cells.indexOf(Edge.LEFT) : index - 1;
    out[n++] = topRow ? cells.indexOf(Edge.TOP) : index - size;
    if (!topRow && !rightColumn) {
      out[n++] = index - size + 1;
    }
    out[n++] = rightColumn ? cells.indexOf(Edge.RIGHT) : index + 1;
    out[n++] = bottomRow ? cells.indexOf(Edge.BOTTOM) : index + size;
    if (!bottomRow && !leftColumn) {
      out[n++] = index + size - 1;
    }
    return n;
  }
}
