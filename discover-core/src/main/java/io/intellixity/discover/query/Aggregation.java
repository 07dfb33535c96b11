package io.intellixity.discover.query;

import java.util.Objects;

/** Aggregation triple {@code [function, column, alias]}; column may be null (e.g. {@code count()}). */
public record Aggregation(String function, String column, String alias) {
  public Aggregation {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(alias, "alias");
  }

  public Aggregation withColumn(String column) {
    return new Aggregation(function, column, alias);
  }
}
