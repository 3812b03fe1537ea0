package hexgame;

import java.util.Objects;

/**
 * Progress of a {@link Game}: either still {@link Phase#ONGOING ongoing} with {@link #player()}
 * to move, or {@link Phase#FINISHED finished} with {@link #player()} as the winner.
 */
public record Status(Phase phase, Color player) {

  public enum Phase {
    ONGOING,
    FINISHED
  }

  public Status {
    Objects.requireNonNull(phase, "phase");
    Objects.requireNonNull(player, "player");
  }

  public static Status ongoing(Color toMove) {
    return new Status(Phase.ONGOING, toMove);
  }

  public static Status finished(Color winner) {
    return new Status(Phase.FINISHED, winner);
  }

  public boolean isFinished() {
    return phase == Phase.FINISHED;
  }

  @Override
  public String toString() {
    return isFinished() ? "Finished(" + player + ")" : "Ongoing(" + player + ")";
  }
}
