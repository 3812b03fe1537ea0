package hexgame.internal;

import static org.junit.jupiter.api.Assertions.*;

import hexgame.Color;
import hexgame.Coords;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttackedBridgesTest {

  private static final Coords CENTER = new Coords(2, 2);

  private HexCells cells;

  @BeforeEach
  void emptyBoard() {
    cells = new HexCells(5);
  }

  private void stone(int row, int column, Color color) {
    cells.setColor(cells.indexOf(new Coords(row, column)), color);
  }

  private List<Coords> attacked(Coords coords) {
    return AttackedBridges.find(cells, coords);
  }

  @Test
  void noStoneNoBridges() {
    assertEquals(List.of(), attacked(CENTER));
  }

  @Test
  void stoneWithoutNeighbors() {
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  .  ●  .\2
  //   3\.  .  ○  .  .\3
  //    4\.  .  ●  .  .\4
  @Test
  void simpleBridgeInCenter() {
    stone(1, 3, Color.BLACK);
    stone(3, 2, Color.BLACK);
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(new Coords(2, 3)), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  ●  .  .\2
  //   3\.  ●  ○  ●  .\3
  @Test
  void bridgePrecededByAdjacentStone() {
    stone(2, 1, Color.BLACK);
    stone(1, 2, Color.BLACK);
    stone(2, 3, Color.BLACK);
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(new Coords(1, 3)), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  ○  .  .\2
  //   3\.  ●  ○  ●  .\3
  @Test
  void ownStoneBreaksPattern() {
    stone(2, 1, Color.BLACK);
    stone(1, 2, Color.WHITE);
    stone(2, 3, Color.BLACK);
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  .  ●  .\2
  //   3\.  ●  ○  .  .\3
  //    4\.  .  ●  .  .\4
  @Test
  void threeOverlappingBridges() {
    stone(2, 1, Color.BLACK);
    stone(1, 3, Color.BLACK);
    stone(3, 2, Color.BLACK);
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(new Coords(1, 2), new Coords(2, 3), new Coords(3, 1)), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  ●  .  .\2
  //   3\.  .  ○  .  .\3
  //    4\.  ●  .  .  .\4
  @Test
  void bridgeWrappingFromLastToFirstNeighbor() {
    stone(3, 1, Color.BLACK);
    stone(1, 2, Color.BLACK);
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(new Coords(2, 1)), attacked(CENTER));
  }

  //  a  b  c  d  e
  // 1\.  ○  .  .  .\1
  //  2\●  .  .  .  .\2
  @Test
  void bridgeInObtuseCorner() {
    Coords attackedAt = new Coords(0, 1);
    stone(1, 0, Color.BLACK);
    stone(0, 1, Color.WHITE);
    assertEquals(List.of(new Coords(0, 0)), attacked(attackedAt));
  }

  //  a  b  c  d  e
  // 1\○  .  .  .  .\1
  //  2\●  .  .  .  .\2
  @Test
  void bridgeNextToObtuseCorner() {
    Coords attackedAt = new Coords(0, 0);
    stone(1, 0, Color.BLACK);
    stone(0, 0, Color.WHITE);
    assertEquals(List.of(new Coords(0, 1)), attacked(attackedAt));
  }

  //  a  b  c  d  e
  // 1\.  .  ○  .  .\1
  //  2\.  .  ●  .  .\2
  @Test
  void bridgeToOwnEdge() {
    Coords attackedAt = new Coords(0, 2);
    stone(1, 2, Color.BLACK);
    stone(0, 2, Color.WHITE);
    assertEquals(List.of(new Coords(0, 3)), attacked(attackedAt));
  }

  //  a  b  c  d  e
  // 1\.  .  .  .  .\1
  //  2\.  .  .  .  .\2
  //   3\○  ●  .  .  .\3
  @Test
  void noBridgeOnOpponentsEdge() {
    Coords attackedAt = new Coords(2, 0);
    stone(2, 1, Color.BLACK);
    stone(2, 0, Color.WHITE);
    assertEquals(List.of(), attacked(attackedAt));
  }

  @Test
  void blackAttackingWhite() {
    stone(1, 3, Color.WHITE);
    stone(3, 2, Color.WHITE);
    stone(2, 2, Color.BLACK);
    assertEquals(List.of(new Coords(2, 3)), attacked(CENTER));
  }

  @Test
  void sixStonesAroundLeaveNoEmptyMidpoint() {
    for (Coords c : List.of(new Coords(2, 1), new Coords(1, 2), new Coords(1, 3),
        new Coords(2, 3), new Coords(3, 2), new Coords(3, 1))) {
      stone(c.row(), c.column(), Color.BLACK);
    }
    stone(2, 2, Color.WHITE);
    assertEquals(List.of(), attacked(CENTER));
  }

  @Test
  void alternatingRingYieldsThreeBridges() {
    stone(2, 1, Color.BLACK);
    stone(1, 3, Color.BLACK);
    stone(3, 2, Color.BLACK);
    stone(1, 2, Color.WHITE);
    stone(2, 2, Color.WHITE);
    // a white neighbor is not an empty midpoint
    assertEquals(List.of(new Coords(2, 3), new Coords(3, 1)), attacked(CENTER));
  }
}
