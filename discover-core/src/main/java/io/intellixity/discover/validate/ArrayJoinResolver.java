package io.intellixity.discover.validate;

import io.intellixity.discover.query.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Nested array-typed field groups ({@code error.*}, {@code stack.*}).
 * <p>
 * A query implicitly joins at most one group: the group of the first array field among the requested
 * fields. Equality conditions on the other groups cannot be evaluated per element, so they are rewritten
 * into {@code has(field, value) = 1|0} membership tests.
 */
public final class ArrayJoinResolver {
  private static final Pattern ARRAY_FIELD = Pattern.compile("^(error|stack)\\..+");

  /** Group name of the first array field in {@code fields}, or null. */
  public String resolve(List<String> fields) {
    if (fields == null) return null;
    for (String f : fields) {
      String group = arrayGroup(f);
      if (group != null) return group;
    }
    return null;
  }

  /** Array group of {@code column} when it names a nested array field, else null. */
  public static String arrayGroup(String column) {
    if (column == null) return null;
    Matcher m = ARRAY_FIELD.matcher(column);
    return m.find() ? m.group(1) : null;
  }

  public List<Condition> rewrite(List<ColumnCondition> conditions, String arrayjoin) {
    if (conditions == null || conditions.isEmpty()) return List.of();
    List<Condition> out = new ArrayList<>(conditions.size());
    for (ColumnCondition c : conditions) out.add(rewrite(c, arrayjoin));
    return out;
  }

  Condition rewrite(ColumnCondition condition, String arrayjoin) {
    ColumnCondition c = condition.withValue(condition.value().accept(BOOLEANS_AS_INTEGERS));
    String group = arrayGroup(c.column());
    if (group == null || !c.operator().isEquality() || group.equals(arrayjoin)) return c;

    Object literal = c.value().accept(LITERAL);
    return FunctionCondition.has(c.column(), literal, c.operator() == Operator.EQ);
  }

  private static final ConditionValue.ValueVisitor<ConditionValue> BOOLEANS_AS_INTEGERS = new ConditionValue.ValueVisitor<>() {
    @Override public ConditionValue visitBool(ConditionValue.BoolValue v) { return ConditionValue.of(v.value() ? 1 : 0); }
    @Override public ConditionValue visitNumber(ConditionValue.NumberValue v) { return v; }
    @Override public ConditionValue visitString(ConditionValue.StringValue v) { return v; }
    @Override public ConditionValue visitList(ConditionValue.ListValue v) { return v; }
    @Override public ConditionValue visitNull() { return ConditionValue.NullValue.INSTANCE; }
  };

  /** Membership-test argument: strings become quoted literals, everything else keeps its plain form. */
  private static final ConditionValue.ValueVisitor<Object> LITERAL = new ConditionValue.ValueVisitor<>() {
    @Override public Object visitBool(ConditionValue.BoolValue v) { return v.value() ? 1 : 0; }
    @Override public Object visitNumber(ConditionValue.NumberValue v) { return v.value(); }
    @Override public Object visitString(ConditionValue.StringValue v) { return quote(v.value()); }
    @Override public Object visitList(ConditionValue.ListValue v) { return v.raw(); }
    @Override public Object visitNull() { return null; }
  };

  static String quote(String s) {
    return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }
}
