package hexgame;

/**
 * Zero-based cell coordinates as seen by callers.
 *
 * <p>The textual form is the usual Hex notation: a lowercase column letter followed by the
 * one-based row, so {@code new Coords(0, 0)} prints as {@code a1} and {@code new Coords(12, 5)} as
 * {@code f13}.
 */
public record Coords(int row, int column) {

  /** @return {@code true} if both components lie in {@code [0, size)}. */
  public boolean isOnBoard(int size) {
    return row >= 0 && row < size && column >= 0 && column < size;
  }

  /**
   * Parses {@code a1} style notation.
   *
   * @throws IllegalArgumentException if {@code text} is not a lowercase letter followed by a
   *     positive row number
   */
  public static Coords parse(String text) {
    if (text == null || text.length() < 2) {
      throw invalid(text);
    }
    char c = text.charAt(0);
    if (c < 'a' || c > 'z') {
      throw invalid(text);
    }
    String rowPart = text.substring(1);
    for (int i = 0; i < rowPart.length(); i++) {
      char d = rowPart.charAt(i);
      if (d < '0' || d > '9') {
        throw invalid(text);
      }
    }
    int row;
    try {
      row = Integer.parseInt(rowPart);
    } catch (NumberFormatException e) {
      throw invalid(text);
    }
    if (row < 1) {
      throw invalid(text);
    }
    return new Coords(row - 1, c - 'a');
  }

  public static char columnChar(int column) {
    return (char) ('a' + column);
  }

  private static IllegalArgumentException invalid(String text) {
    return new IllegalArgumentException("Invalid coordinates: " + text);
  }

  @Override
  public String toString() {
    return columnChar(column) + Integer.toString(row + 1);
  }
}
