package io.intellixity.discover.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tagged literal carried by a condition: boolean, number, string, list or null.
 * <p>
 * Callers branch on the tag through {@link ValueVisitor}; every kind must be handled.
 */
public interface ConditionValue {
  <R> R accept(ValueVisitor<R> visitor);

  /** Plain Java form of this value (Boolean, Number, String, List or null). */
  Object raw();

  record BoolValue(boolean value) implements ConditionValue {
    @Override public <R> R accept(ValueVisitor<R> visitor) { return visitor.visitBool(this); }
    @Override public Object raw() { return value; }
  }

  record NumberValue(Number value) implements ConditionValue {
    public NumberValue {
      Objects.requireNonNull(value, "value");
    }
    @Override public <R> R accept(ValueVisitor<R> visitor) { return visitor.visitNumber(this); }
    @Override public Object raw() { return value; }
  }

  record StringValue(String value) implements ConditionValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }
    @Override public <R> R accept(ValueVisitor<R> visitor) { return visitor.visitString(this); }
    @Override public Object raw() { return value; }
  }

  record ListValue(List<ConditionValue> values) implements ConditionValue {
    public ListValue {
      values = List.copyOf(values == null ? List.of() : values);
    }
    @Override public <R> R accept(ValueVisitor<R> visitor) { return visitor.visitList(this); }
    @Override public Object raw() {
      List<Object> out = new ArrayList<>(values.size());
      for (ConditionValue v : values) out.add(v.raw());
      return out;
    }
  }

  enum NullValue implements ConditionValue {
    INSTANCE;
    @Override public <R> R accept(ValueVisitor<R> visitor) { return visitor.visitNull(); }
    @Override public Object raw() { return null; }
  }

  interface ValueVisitor<R> {
    R visitBool(BoolValue value);
    R visitNumber(NumberValue value);
    R visitString(StringValue value);
    R visitList(ListValue value);
    R visitNull();
  }

  static ConditionValue of(boolean b) { return new BoolValue(b); }
  static ConditionValue of(Number n) { return new NumberValue(n); }
  static ConditionValue of(String s) { return new StringValue(s); }

  /**
   * Wrap a decoded JSON value. Objects (maps) and other types are not valid literals.
   *
   * @throws IllegalArgumentException for unsupported value types
   */
  static ConditionValue fromRaw(Object o) {
    if (o == null) return NullValue.INSTANCE;
    if (o instanceof ConditionValue cv) return cv;
    if (o instanceof Boolean b) return new BoolValue(b);
    if (o instanceof Number n) return new NumberValue(n);
    if (o instanceof String s) return new StringValue(s);
    if (o instanceof List<?> list) {
      List<ConditionValue> out = new ArrayList<>(list.size());
      for (Object x : list) out.add(fromRaw(x));
      return new ListValue(out);
    }
    throw new IllegalArgumentException("Unsupported condition value type: " + o.getClass().getSimpleName());
  }
}
