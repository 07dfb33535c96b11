package io.intellixity.discover.query;

public interface ConditionVisitor<R> {
  R visit(ColumnCondition condition);
  R visit(FunctionCondition condition);
}
