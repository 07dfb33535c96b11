package io.intellixity.discover.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Function-call condition {@code [[function, [args...]], operator, value]}.
 * <p>
 * Produced by the membership-test rewrite: {@code [["has", ["error.type", "'ValueError'"]], "=", 1]}.
 * The first argument is a column name, the remaining ones are rendered literals.
 */
public record FunctionCondition(String function, List<Object> args, Operator operator, ConditionValue value)
    implements Condition {
  public static final String HAS = "has";

  public FunctionCondition {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
    // a null literal is a valid argument: has(field, NULL)
    args = Collections.unmodifiableList(new ArrayList<>(args == null ? List.of() : args));
  }

  @Override
  public <R> R accept(ConditionVisitor<R> visitor) { return visitor.visit(this); }

  /** {@code has(field, literal) = 1} when {@code contains}, else {@code = 0}. */
  public static FunctionCondition has(String field, Object literal, boolean contains) {
    return new FunctionCondition(HAS, Arrays.asList(field, literal), Operator.EQ, ConditionValue.of(contains ? 1 : 0));
  }
}
