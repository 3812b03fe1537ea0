package hexgame.internal;

import static hexgame.constants.HexConstants.EDGE_COUNT;
import static hexgame.constants.HexConstants.MAX_BOARD_SIZE;
import static hexgame.constants.HexConstants.MIN_BOARD_SIZE;

import hexgame.Color;
import hexgame.Coords;
import hexgame.CoordsOrEdge;
import hexgame.Edge;
import java.util.Arrays;

/**
 * Flat per-cell storage: stone color and union-find parent.
 *
 * <p>Layout is {@code [row * size + column ...; LEFT, TOP, RIGHT, BOTTOM]}, i.e. {@code size * size}
 * normal cells followed by the four edges in {@link Edge} declaration order. Edges therefore sort
 * after every cell, which is what keeps them roots under {@link UnionFind#merge}.
 *
 * <p>Indices never leave this package; callers see {@link Coords} or {@link Edge}.
 */
final class HexCells implements UnionFind<Integer> {

  private static final int NO_PARENT = -1;

  private final int size;
  private final int firstEdge;
  private final Color[] colors;
  private final int[] parents;

  HexCells(int size) {
    if (size < MIN_BOARD_SIZE || size > MAX_BOARD_SIZE) {
      throw new IllegalArgumentException(
          "Board size must be between " + MIN_BOARD_SIZE + " and " + MAX_BOARD_SIZE
              + ". Found " + size);
    }
    this.size = size;
    this.firstEdge = size * size;
    this.colors = new Color[firstEdge + EDGE_COUNT];
    this.parents = new int[firstEdge + EDGE_COUNT];
    Arrays.fill(parents, NO_PARENT);

    for (Edge edge : Edge.values()) {
      colors[indexOf(edge)] = edge.color();
    }
  }

  int size() {
    return size;
  }

  /** @return number of slots, cells and edges together. */
  int length() {
    return colors.length;
  }

  /* ────── coordinate system ────── */

  int indexOf(Coords coords) {
    if (!coords.isOnBoard(size)) {
      throw new IllegalArgumentException(
          "Coords " + coords + " out of bounds. Must be at most " + new Coords(size - 1, size - 1));
    }
    return coords.row() * size + coords.column();
  }

  int indexOf(Edge edge) {
    return firstEdge + edge.ordinal();
  }

  int indexOf(CoordsOrEdge target) {
    return target.isEdge() ? indexOf(target.edge()) : indexOf(target.coords());
  }

  boolean isEdge(int index) {
    return index >= firstEdge;
  }

  CoordsOrEdge decode(int index) {
    checkIndex(index);
    if (isEdge(index)) {
      return CoordsOrEdge.of(Edge.values()[index - firstEdge]);
    }
    return CoordsOrEdge.of(index / size, index % size);
  }

  Coords coordsOf(int index) {
    checkIndex(index);
    if (isEdge(index)) {
      throw new IllegalStateException("Index " + index + " cannot be converted to Coords");
    }
    return new Coords(index / size, index % size);
  }

  /* ────── colors ────── */

  Color colorAt(int index) {
    return colors[index];
  }

  void setColor(int index, Color color) {
    if (colors[index] != null) {
      throw new IllegalStateException("Index " + index + " is already colored");
    }
    colors[index] = color;
  }

  /* ────── union-find parents ────── */

  @Override
  public Integer getParent(Integer item) {
    int parent = parents[item];
    return parent == NO_PARENT ? null : parent;
  }

  @Override
  public void setParent(Integer item, Integer parent) {
    parents[item] = parent;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= colors.length) {
      throw new IllegalArgumentException("Index " + index + " out of range [0, " + colors.length + ")");
    }
  }
}
