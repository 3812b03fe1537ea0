package hexgame;

/**
 * The two players of Hex.
 *
 * <p>{@link #BLACK} connects the {@link Edge#TOP top} and {@link Edge#BOTTOM bottom} edges, {@link
 * #WHITE} connects {@link Edge#LEFT left} and {@link Edge#RIGHT right}.
 */
public enum Color {
  BLACK,
  WHITE;

  /** @return the other player; applying it twice yields {@code this}. */
  public Color opponent() {
    return this == BLACK ? WHITE : BLACK;
  }
}
