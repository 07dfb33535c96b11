package io.intellixity.discover.spi.physical;

import java.util.Objects;

/** A physical query together with the plan that reverses its column substitutions. */
public record PhysicalPlan(PhysicalQuery query, ReversalPlan reversal) {
  public PhysicalPlan {
    Objects.requireNonNull(query, "query");
    reversal = (reversal == null) ? ReversalPlan.NONE : reversal;
  }
}
