package hexgame;

/** Externally supplied board data (a stone matrix or a saved game) could not be loaded. */
public final class InvalidBoardException extends Exception {

  private static final long serialVersionUID = 1L;

  public enum Kind {
    SIZE_OUT_OF_BOUNDS,
    NOT_SQUARE,
    NO_CURRENT_PLAYER,
    MALFORMED
  }

  private final Kind kind;

  private InvalidBoardException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static InvalidBoardException sizeOutOfBounds(int size, int min, int max) {
    return new InvalidBoardException(
        Kind.SIZE_OUT_OF_BOUNDS,
        "Board size must be between " + min + " and " + max + ". Found " + size);
  }

  public static InvalidBoardException notSquare(int size, int rowIndex) {
    return new InvalidBoardException(
        Kind.NOT_SQUARE, "Length of row " + rowIndex + " does not match board size " + size);
  }

  public static InvalidBoardException noCurrentPlayer() {
    return new InvalidBoardException(Kind.NO_CURRENT_PLAYER, "Current player is missing");
  }

  public static InvalidBoardException malformed(String detail) {
    return new InvalidBoardException(Kind.MALFORMED, detail);
  }

  public Kind kind() {
    return kind;
  }
}
