package hexgame.io;

import static org.junit.jupiter.api.Assertions.*;

import hexgame.Color;
import hexgame.Coords;
import hexgame.Game;
import hexgame.InvalidBoardException;
import hexgame.InvalidMoveException;
import hexgame.Status;
import hexgame.internal.GameImpl;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JsonGameCodecTest {

  private final JsonGameCodec codec = new JsonGameCodec();

  @Test
  void savesCompactForm() throws InvalidMoveException {
    GameImpl game = new GameImpl(2);
    game.play(new Coords(0, 1));
    game.play(new Coords(1, 0));
    assertEquals("{\"size\":2,\"currentPlayer\":1,\"cells\":[[0,1],[2,0]]}", codec.save(game));
  }

  @Test
  void loadsCompactForm() throws InvalidBoardException {
    Game game = codec.load("{\"size\":2,\"currentPlayer\":2,\"cells\":[[1,0],[0,0]]}");
    assertEquals(Status.ongoing(Color.WHITE), game.getStatus());
    assertEquals(Optional.of(Color.BLACK), game.getBoard().getColor(new Coords(0, 0)));
    assertEquals(Optional.empty(), game.getBoard().getColor(new Coords(1, 1)));
  }

  @Test
  void sizeFieldIsOptional() throws InvalidBoardException {
    Game game = codec.load("{\"currentPlayer\":1,\"cells\":[[0,0],[0,0]]}");
    assertEquals(2, game.getBoard().size());
  }

  @Test
  void roundTripKeepsBoardAndTurn() throws Exception {
    GameImpl game = new GameImpl(5);
    game.play(new Coords(2, 2));
    game.play(new Coords(1, 3));
    game.play(new Coords(3, 1));

    Game loaded = new JsonGameCodec(true).load(new JsonGameCodec(true).save(game));

    assertEquals(game.getStatus(), loaded.getStatus());
    assertArrayEquals(game.getBoard().toStoneMatrix(), loaded.getBoard().toStoneMatrix());
  }

  @Test
  void finishedStatusIsDerived() throws InvalidBoardException {
    // black column on the left, but white is recorded to move
    Game game = codec.load("{\"currentPlayer\":2,\"cells\":[[1,0],[1,0]]}");
    assertEquals(Status.finished(Color.BLACK), game.getStatus());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "not json",
      "[1, 2]",
      "{\"currentPlayer\":1}",
      "{\"cells\":[[0,0],[0,0]]}",
      "{\"size\":3,\"currentPlayer\":1,\"cells\":[[0,0],[0,0]]}",
      "{\"currentPlayer\":1,\"cells\":[[0,7],[0,0]]}",
      "{\"currentPlayer\":5,\"cells\":[[0,0],[0,0]]}"
  })
  void malformedInput(String text) {
    InvalidBoardException e = assertThrows(InvalidBoardException.class, () -> codec.load(text));
    assertEquals(InvalidBoardException.Kind.MALFORMED, e.kind());
  }

  @Test
  void nullCellIsMalformed() {
    InvalidBoardException e = assertThrows(InvalidBoardException.class,
        () -> codec.load("{\"currentPlayer\":1,\"cells\":[[null,0],[0,0]]}"));
    assertEquals(InvalidBoardException.Kind.MALFORMED, e.kind());
    assertEquals("Missing color at row 0 column 0", e.getMessage());
  }

  @Test
  void emptyCurrentPlayer() {
    InvalidBoardException e = assertThrows(InvalidBoardException.class,
        () -> codec.load("{\"currentPlayer\":0,\"cells\":[[0,0],[0,0]]}"));
    assertEquals(InvalidBoardException.Kind.NO_CURRENT_PLAYER, e.kind());
  }

  @Test
  void raggedRows() {
    InvalidBoardException e = assertThrows(InvalidBoardException.class,
        () -> codec.load("{\"currentPlayer\":1,\"cells\":[[0,0],[0]]}"));
    assertEquals(InvalidBoardException.Kind.NOT_SQUARE, e.kind());

    e = assertThrows(InvalidBoardException.class,
        () -> codec.load("{\"currentPlayer\":1,\"cells\":[[0,0],null]}"));
    assertEquals(InvalidBoardException.Kind.NOT_SQUARE, e.kind());
  }

  @Test
  void boardTooSmall() {
    InvalidBoardException e = assertThrows(InvalidBoardException.class,
        () -> codec.load("{\"currentPlayer\":1,\"cells\":[[0]]}"));
    assertEquals(InvalidBoardException.Kind.SIZE_OUT_OF_BOUNDS, e.kind());
  }

  @Test
  void colorCodes() throws InvalidBoardException {
    assertEquals(0, JsonGameCodec.encode(null));
    assertEquals(1, JsonGameCodec.encode(Color.BLACK));
    assertEquals(2, JsonGameCodec.encode(Color.WHITE));
    assertNull(JsonGameCodec.decode(0));
    assertEquals(Color.BLACK, JsonGameCodec.decode(1));
    assertEquals(Color.WHITE, JsonGameCodec.decode(2));
    assertThrows(InvalidBoardException.class, () -> JsonGameCodec.decode(-1));
  }
}
