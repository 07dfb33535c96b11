package io.intellixity.discover.query;

import java.util.Objects;

public record OrderBy(String column, Direction direction) {
  public static final String DESC_MARKER = "-";

  public OrderBy {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }

  /** Parses {@code "col"} / {@code "-col"}. Only the first leading marker is treated as direction. */
  public static OrderBy parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw.startsWith(DESC_MARKER)) return new OrderBy(raw.substring(1), Direction.DESC);
    return new OrderBy(raw, Direction.ASC);
  }

  /** Wire form: column prefixed by {@code -} when descending. */
  public String expression() {
    return direction == Direction.DESC ? DESC_MARKER + column : column;
  }
}
