package io.intellixity.discover.validate;

import io.intellixity.discover.query.ColumnCondition;
import io.intellixity.discover.query.ConditionValue;
import io.intellixity.discover.query.Operator;
import io.intellixity.discover.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Turns raw {@code [column, operator, value]} rows into typed {@link ColumnCondition}s. */
public final class ConditionParser {
  public static final String FIELD = "conditions";

  public List<ColumnCondition> parse(List<List<Object>> rows) {
    if (rows == null || rows.isEmpty()) return List.of();
    List<ColumnCondition> out = new ArrayList<>(rows.size());
    List<String> problems = new ArrayList<>();
    for (List<Object> row : rows) {
      ColumnCondition c = parseRow(row, problems);
      if (c != null) out.add(c);
    }
    if (!problems.isEmpty()) {
      throw new QueryValidationException(Map.of(FIELD, problems));
    }
    return out;
  }

  private static ColumnCondition parseRow(List<Object> row, List<String> problems) {
    if (row == null || row.size() != 3) {
      problems.add("Invalid condition - expected [column, operator, value]: " + row);
      return null;
    }
    if (!(row.get(0) instanceof String column) || column.isBlank()) {
      problems.add("Invalid condition column: " + row.get(0));
      return null;
    }
    Operator op = (row.get(1) instanceof String s) ? Operator.fromSymbol(s) : null;
    if (op == null) {
      problems.add("Invalid condition operator: " + row.get(1));
      return null;
    }
    ConditionValue value;
    try {
      value = ConditionValue.fromRaw(row.get(2));
    } catch (IllegalArgumentException e) {
      problems.add("Invalid condition value for " + column + ": " + e.getMessage());
      return null;
    }
    boolean listOperator = op == Operator.IN || op == Operator.NOT_IN;
    boolean listValue = value instanceof ConditionValue.ListValue;
    if (listOperator && !listValue) {
      problems.add("Operator " + op.symbol() + " requires a list value for " + column);
      return null;
    }
    if (!listOperator && listValue) {
      problems.add("Operator " + op.symbol() + " does not accept a list value for " + column);
      return null;
    }
    return new ColumnCondition(column, op, value);
  }
}
