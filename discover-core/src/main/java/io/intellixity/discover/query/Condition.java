package io.intellixity.discover.query;

/** A single filter node of a discover query. Conditions are implicitly AND-ed. */
public interface Condition {
  <R> R accept(ConditionVisitor<R> visitor);
}
