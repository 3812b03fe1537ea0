package hexgame.internal;

import static hexgame.constants.HexConstants.MAX_NEIGHBORS;

import hexgame.Color;
import hexgame.Coords;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds opponent bridges threatened by a freshly placed stone.
 *
 * <p>Around the stone we look for {@code [opponent, empty, opponent]} on consecutive neighbors:
 * both opponent stones then share the empty cell and the attacked stone as common neighbors, and
 * the empty cell is where the defender has to answer. Edges take part with their owner's color, so
 * a bridge between a stone and its own edge is found as well.
 */
final class AttackedBridges {

  /** How much of {@code [opponent, empty, opponent]} has been matched so far. */
  private enum State {
    FOUND_0,
    FOUND_1,
    FOUND_2
  }

  private AttackedBridges() {}

  static List<Coords> find(HexCells cells, Coords coords) {
    int center = cells.indexOf(coords);
    Color attacker = cells.colorAt(center);
    if (attacker == null) {
      return List.of();
    }
    Color searchColor = attacker.opponent();

    // two extra slots: a match may wrap around from the last neighbor to the first two
    int[] ring = new int[MAX_NEIGHBORS + 2];
    int count = Neighbors.generate(cells, center, ring);
    ring[count] = ring[0];
    ring[count + 1] = ring[1];

    List<Coords> result = new ArrayList<>(2);
    State state = State.FOUND_0;
    for (int i = 0; i < count + 2; i++) {
      Color color = cells.colorAt(ring[i]);
      switch (state) {
        case FOUND_0 -> {
          if (color == searchColor) state = State.FOUND_1;
        }
        case FOUND_1 -> {
          if (color == null) state = State.FOUND_2;
          else if (color != searchColor) state = State.FOUND_0;
          // another searchColor stone may start the next match: stay
        }
        case FOUND_2 -> {
          if (color == searchColor) {
            result.add(cells.coordsOf(ring[i - 1]));
            // the closing stone can open an overlapping bridge
            state = State.FOUND_1;
          } else {
            state = State.FOUND_0;
          }
        }
      }
    }
    return result;
  }
}
