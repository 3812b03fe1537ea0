package hexgame.internal;

import hexgame.Board;
import hexgame.Color;
import hexgame.Coords;
import hexgame.Edge;
import hexgame.Game;
import hexgame.InvalidBoardException;
import hexgame.InvalidMoveException;
import hexgame.Status;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Alternating turns on a {@link BoardImpl}, finishing as soon as the mover links their edges. */
public final class GameImpl implements Game {

  private static final Logger LOG = LoggerFactory.getLogger(GameImpl.class);

  private final BoardImpl board;
  private Status status;

  public GameImpl(int size) {
    this(new BoardImpl(size), Status.ongoing(Color.BLACK));
  }

  private GameImpl(BoardImpl board, Status status) {
    this.board = board;
    this.status = status;
  }

  /**
   * Restores a game from a stone matrix. If either player's edges are already joined the game is
   * returned finished with that player as winner.
   */
  public static GameImpl load(Color[][] matrix, Color currentPlayer) throws InvalidBoardException {
    BoardImpl board = BoardImpl.fromStoneMatrix(matrix);
    if (currentPlayer == null) {
      throw InvalidBoardException.noCurrentPlayer();
    }
    for (Color color : Color.values()) {
      if (hasConnected(board, color)) {
        return new GameImpl(board, Status.finished(color));
      }
    }
    return new GameImpl(board, Status.ongoing(currentPlayer));
  }

  @Override
  public void play(Coords coords) throws InvalidMoveException {
    Objects.requireNonNull(coords, "coords");
    if (status.isFinished()) {
      throw InvalidMoveException.gameOver();
    }

    Color mover = status.player();
    board.play(coords, mover);

    if (hasConnected(board, mover)) {
      status = Status.finished(mover);
      LOG.info("{} wins with {}", mover, coords);
    } else {
      status = Status.ongoing(mover.opponent());
    }
  }

  @Override
  public Status getStatus() {
    return status;
  }

  @Override
  public Color getCurrentPlayer() {
    return status.player();
  }

  @Override
  public Board getBoard() {
    return board;
  }

  private static boolean hasConnected(BoardImpl board, Color color) {
    List<Edge> edges = Edge.edgesOf(color);
    return board.isInSameSet(edges.get(0), edges.get(1));
  }
}
