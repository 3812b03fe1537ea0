package hexgame;

/**
 * A move was rejected. Rejection always happens before the board is touched, so the board is
 * unchanged when this is thrown.
 */
public final class InvalidMoveException extends Exception {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    OUT_OF_BOUNDS,
    CELL_OCCUPIED,
    GAME_OVER
  }

  private final Kind kind;
  private final Coords coords;

  private InvalidMoveException(Kind kind, Coords coords, String message) {
    super(message);
    this.kind = kind;
    this.coords = coords;
  }

  public static InvalidMoveException outOfBounds(Coords coords) {
    return new InvalidMoveException(
        Kind.OUT_OF_BOUNDS, coords, "Coordinates " + coords + " are out of bounds");
  }

  public static InvalidMoveException cellOccupied(Coords coords) {
    return new InvalidMoveException(
        Kind.CELL_OCCUPIED, coords, "Cell " + coords + " is already occupied");
  }

  public static InvalidMoveException gameOver() {
    return new InvalidMoveException(Kind.GAME_OVER, null, "Game has ended");
  }

  public Kind kind() {
    return kind;
  }

  /** @return the rejected coordinates, or {@code null} for {@link Kind#GAME_OVER}. */
  public Coords coords() {
    return coords;
  }
}
