package hexgame;

/** Turn sequencing on top of a {@link Board}. Black moves first. */
public interface Game {

  /**
   * Plays a stone for the current player.
   *
   * @throws InvalidMoveException {@code GAME_OVER} once the game has finished, otherwise whatever
   *     {@link Board#play} rejects
   */
  void play(Coords coords) throws InvalidMoveException;

  Status getStatus();

  /** @return the player to move, or the winner once the game has finished. */
  Color getCurrentPlayer();

  /** Read access to the board. Mutating it directly bypasses turn sequencing. */
  Board getBoard();
}
