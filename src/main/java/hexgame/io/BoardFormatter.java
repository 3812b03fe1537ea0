package hexgame.io;

import hexgame.Board;
import hexgame.Color;
import hexgame.Coords;

/**
 * Human-readable board rendering. Each row is shifted one column further right so the rhombus
 * shape of the board shows:
 *
 * <pre>
 *  a  b  c  d  e
 * 1\.  .  .  .  .\1
 *  2\.  ●  .  ○  .\2
 *   3\.  .  ●  .  .\3
 *    4\.  .  .  ○  .\4
 *     5\.  .  .  .  .\5
 *        a  b  c  d  e
 * </pre>
 */
public final class BoardFormatter {

  private BoardFormatter() {}

  public static String format(Board board) {
    int size = board.size();
    StringBuilder sb = new StringBuilder((size + 2) * (3 * size + 8));
    appendColumnLabels(sb, size, 0);
    for (int row = 0; row < size; row++) {
      appendRow(sb, board, row);
    }
    appendColumnLabels(sb, size, size + 1);
    return sb.toString();
  }

  private static void appendColumnLabels(StringBuilder sb, int size, int indent) {
    sb.append(" ".repeat(indent));
    for (int column = 0; column < size; column++) {
      sb.append(' ').append(Coords.columnChar(column)).append(' ');
    }
    sb.append('\n');
  }

  private static void appendRow(StringBuilder sb, Board board, int row) {
    sb.append(" ".repeat(row)).append(row + 1).append('\\');
    for (int column = 0; column < board.size(); column++) {
      if (column > 0) sb.append("  ");
      sb.append(symbol(board.getColor(new Coords(row, column)).orElse(null)));
    }
    sb.append('\\').append(row + 1).append('\n');
  }

  // ● Black, ○ White, . empty
  static char symbol(Color color) {
    if (color == null) return '.';
    return color == Color.BLACK ? '●' : '○';
  }
}
