package io.intellixity.discover.query;

import java.time.Instant;
import java.util.Objects;

/** Half-open query window {@code [start, end)}. */
public record TimeWindow(Instant start, Instant end) {
  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!start.isBefore(end)) throw new IllegalArgumentException("start must be before end");
  }
}
