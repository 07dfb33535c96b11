package io.intellixity.discover.spi.physical;

import java.util.List;
import java.util.Objects;

/**
 * How to undo the {@code project_name} to {@code project_id} substitution in engine results.
 */
public record ReversalPlan(List<Reinsertion> reinsertions) {
  public static final ReversalPlan NONE = new ReversalPlan(List.of());

  public ReversalPlan {
    reinsertions = List.copyOf(reinsertions == null ? List.of() : reinsertions);
  }

  public boolean isEmpty() {
    return reinsertions.isEmpty();
  }

  /** Where {@code project_name} was requested. */
  public enum Location { SELECTED_COLUMNS, GROUPBY }

  /**
   * @param location     list the synthetic column was removed from
   * @param index        its position in the requested list, where it is re-inserted into meta
   * @param dropIdColumn true when {@code project_id} was added only to support the substitution
   */
  public record Reinsertion(Location location, int index, boolean dropIdColumn) {
    public Reinsertion {
      Objects.requireNonNull(location, "location");
      if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }
  }
}
