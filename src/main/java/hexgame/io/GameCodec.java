package hexgame.io;

import hexgame.Game;
import hexgame.InvalidBoardException;

/** Converts games to and from a text transport format. */
public interface GameCodec {

  String save(Game game);

  /**
   * @throws InvalidBoardException if {@code text} cannot be decoded or describes an illegal board
   */
  Game load(String text) throws InvalidBoardException;
}
