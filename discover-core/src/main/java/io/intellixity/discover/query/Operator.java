package io.intellixity.discover.query;

import java.util.Locale;

/** Condition operators accepted from callers, keyed by their wire symbol. */
public enum Operator {
  EQ("=", true),
  NE("!=", true),
  GT(">", false),
  GE(">=", false),
  LT("<", false),
  LE("<=", false),

  IN("IN", false),
  NOT_IN("NOT IN", false),

  LIKE("LIKE", false),
  NOT_LIKE("NOT LIKE", false),

  IS_NULL("IS NULL", false),
  IS_NOT_NULL("IS NOT NULL", false);

  private final String symbol;
  private final boolean equality;

  Operator(String symbol, boolean equality) {
    this.symbol = symbol;
    this.equality = equality;
  }

  public String symbol() { return symbol; }

  /** True for {@code =} and {@code !=}, the operators eligible for the membership-test rewrite. */
  public boolean isEquality() { return equality; }

  public boolean isUnary() { return this == IS_NULL || this == IS_NOT_NULL; }

  /** Returns the operator for a wire symbol (case-insensitive, surrounding blanks ignored) or null. */
  public static Operator fromSymbol(String symbol) {
    if (symbol == null) return null;
    String s = symbol.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.symbol.equals(s)) return op;
    }
    return null;
  }
}
