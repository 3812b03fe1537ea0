package hexgame.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import hexgame.Color;
import hexgame.Game;
import hexgame.InvalidBoardException;
import hexgame.internal.GameImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON form of a game:
 *
 * <pre>{@code
 * {"size": 2, "currentPlayer": 1, "cells": [[0, 1], [2, 0]]}
 * }</pre>
 *
 * Colors are coded {@code 0} = empty, {@code 1} = Black, {@code 2} = White. The game status is not
 * stored; it is derived from the board on load.
 */
public final class JsonGameCodec implements GameCodec {

  private static final Logger LOG = LoggerFactory.getLogger(JsonGameCodec.class);

  private static final int EMPTY = 0;
  private static final int BLACK = 1;
  private static final int WHITE = 2;

  private final Gson gson;

  public JsonGameCodec() {
    this(false);
  }

  public JsonGameCodec(boolean prettyPrinting) {
    GsonBuilder builder = new GsonBuilder();
    if (prettyPrinting) builder.setPrettyPrinting();
    this.gson = builder.create();
  }

  /** Wire shape; field names are the JSON keys. */
  private static final class StoredGame {
    Integer size;
    Integer currentPlayer;
    Integer[][] cells;
  }

  @Override
  public String save(Game game) {
    Color[][] matrix = game.getBoard().toStoneMatrix();
    StoredGame stored = new StoredGame();
    stored.size = matrix.length;
    stored.currentPlayer = encode(game.getCurrentPlayer());
    stored.cells = new Integer[matrix.length][];
    for (int row = 0; row < matrix.length; row++) {
      stored.cells[row] = new Integer[matrix[row].length];
      for (int column = 0; column < matrix[row].length; column++) {
        stored.cells[row][column] = encode(matrix[row][column]);
      }
    }
    return gson.toJson(stored);
  }

  @Override
  public Game load(String text) throws InvalidBoardException {
    StoredGame stored;
    try {
      stored = gson.fromJson(text, StoredGame.class);
    } catch (JsonParseException e) {
      throw InvalidBoardException.malformed("Invalid JSON: " + e.getMessage());
    }
    if (stored == null || stored.cells == null) {
      throw InvalidBoardException.malformed("Missing field: cells");
    }
    if (stored.currentPlayer == null) {
      throw InvalidBoardException.malformed("Missing field: currentPlayer");
    }
    if (stored.size != null && stored.size != stored.cells.length) {
      throw InvalidBoardException.malformed(
          "Size " + stored.size + " does not match " + stored.cells.length + " rows");
    }

    Color[][] matrix = new Color[stored.cells.length][];
    for (int row = 0; row < matrix.length; row++) {
      Integer[] codes = stored.cells[row];
      if (codes == null) {
        throw InvalidBoardException.notSquare(matrix.length, row);
      }
      matrix[row] = new Color[codes.length];
      for (int column = 0; column < codes.length; column++) {
        if (codes[column] == null) {
          throw InvalidBoardException.malformed(
              "Missing color at row " + row + " column " + column);
        }
        matrix[row][column] = decode(codes[column]);
      }
    }

    Game game = GameImpl.load(matrix, decode(stored.currentPlayer));
    LOG.debug("Loaded {}x{} game, status {}", matrix.length, matrix.length, game.getStatus());
    return game;
  }

  static int encode(Color color) {
    if (color == null) return EMPTY;
    return color == Color.BLACK ? BLACK : WHITE;
  }

  static Color decode(int code) throws InvalidBoardException {
    return switch (code) {
      case EMPTY -> null;
      case BLACK -> Color.BLACK;
      case WHITE -> Color.WHITE;
      default -> throw InvalidBoardException.malformed("Invalid color " + code);
    };
  }
}
