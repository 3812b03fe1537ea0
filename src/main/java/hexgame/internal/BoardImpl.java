package hexgame.internal;

import static hexgame.constants.HexConstants.MAX_BOARD_SIZE;
import static hexgame.constants.HexConstants.MAX_NEIGHBORS;
import static hexgame.constants.HexConstants.MIN_BOARD_SIZE;

import hexgame.Board;
import hexgame.Color;
import hexgame.Coords;
import hexgame.CoordsOrEdge;
import hexgame.InvalidBoardException;
import hexgame.InvalidMoveException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Board} backed by {@link HexCells}. Every placed stone is merged with its like-colored
 * neighbors right away, so connectivity queries are union-find lookups.
 */
public final class BoardImpl implements Board {

  private final HexCells cells;
  /** scratch buffer for neighbor generation */
  private final int[] neighbors = new int[MAX_NEIGHBORS];

  /**
   * @throws IllegalArgumentException if {@code size} lies outside {@code [MIN_BOARD_SIZE,
   *     MAX_BOARD_SIZE]}
   */
  public BoardImpl(int size) {
    this.cells = new HexCells(size);
  }

  /**
   * Rebuilds a board from a stone matrix by replaying it row-major through {@link #play}, so the
   * result is exactly what playing those stones would have produced.
   *
   * @param matrix square, row-major, {@code null} entries are empty cells
   */
  public static BoardImpl fromStoneMatrix(Color[][] matrix) throws InvalidBoardException {
    Objects.requireNonNull(matrix, "matrix");
    int size = matrix.length;
    if (size < MIN_BOARD_SIZE || size > MAX_BOARD_SIZE) {
      throw InvalidBoardException.sizeOutOfBounds(size, MIN_BOARD_SIZE, MAX_BOARD_SIZE);
    }
    for (int row = 0; row < size; row++) {
      if (matrix[row] == null || matrix[row].length != size) {
        throw InvalidBoardException.notSquare(size, row);
      }
    }

    BoardImpl board = new BoardImpl(size);
    for (int row = 0; row < size; row++) {
      for (int column = 0; column < size; column++) {
        Color color = matrix[row][column];
        if (color == null) continue;
        try {
          board.play(new Coords(row, column), color);
        } catch (InvalidMoveException e) {
          // every cell is visited once and lies on the board
          throw new IllegalStateException("Replaying stone matrix failed", e);
        }
      }
    }
    return board;
  }

  @Override
  public int size() {
    return cells.size();
  }

  @Override
  public void play(Coords coords, Color color) throws InvalidMoveException {
    Objects.requireNonNull(coords, "coords");
    Objects.requireNonNull(color, "color");
    if (!coords.isOnBoard(size())) {
      throw InvalidMoveException.outOfBounds(coords);
    }
    int index = cells.indexOf(coords);
    if (cells.colorAt(index) != null) {
      throw InvalidMoveException.cellOccupied(coords);
    }

    cells.setColor(index, color);

    int n = Neighbors.generate(cells, index, neighbors);
    for (int i = 0; i < n; i++) {
      if (cells.colorAt(neighbors[i]) == color) {
        cells.merge(index, neighbors[i]);
        // consecutive neighbors touch each other, so the next one (if ours) is already merged
        i++;
      }
    }
  }

  @Override
  public Optional<Color> getColor(Coords coords) {
    return Optional.ofNullable(cells.colorAt(cells.indexOf(coords)));
  }

  @Override
  public boolean isInSameSet(CoordsOrEdge a, CoordsOrEdge b) {
    return cells.isInSameSet(cells.indexOf(a), cells.indexOf(b));
  }

  @Override
  public List<Coords> getEmptyCells() {
    int size = size();
    List<Coords> empty = new ArrayList<>();
    for (int index = 0; index < size * size; index++) {
      if (cells.colorAt(index) == null) {
        empty.add(cells.coordsOf(index));
      }
    }
    return empty;
  }

  @Override
  public List<Coords> findAttackedBridges(Coords coords) {
    return AttackedBridges.find(cells, coords);
  }

  @Override
  public Color[][] toStoneMatrix() {
    int size = size();
    Color[][] matrix = new Color[size][size];
    for (int row = 0; row < size; row++) {
      for (int column = 0; column < size; column++) {
        matrix[row][column] = cells.colorAt(row * size + column);
      }
    }
    return matrix;
  }

  /** Package-private view for tests and the connectivity oracle. */
  HexCells cells() {
    return cells;
  }
}
