package io.intellixity.discover.query;

import java.util.Objects;

/** Leaf condition {@code [column, operator, value]}. */
public record ColumnCondition(String column, Operator operator, ConditionValue value) implements Condition {
  public ColumnCondition {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
    value = (value == null) ? ConditionValue.NullValue.INSTANCE : value;
  }

  public ColumnCondition withValue(ConditionValue value) {
    return new ColumnCondition(column, operator, value);
  }

  @Override
  public <R> R accept(ConditionVisitor<R> visitor) { return visitor.visit(this); }

  public static ColumnCondition of(String column, Operator operator, Object value) {
    return new ColumnCondition(column, operator, ConditionValue.fromRaw(value));
  }
}
