package io.intellixity.discover.validate;

import io.intellixity.discover.query.QueryValidationException;
import io.intellixity.discover.query.TimeWindow;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Normalizes either an explicit {@code start}/{@code end} pair or a relative {@code range} into a
 * {@link TimeWindow}. Exactly one of the two forms must be supplied.
 */
public final class TimeRangeResolver {
  public static final String FIELD = "range";
  public static final String EITHER_REQUIRED = "Either start and end dates or range is required";
  public static final String INVALID_RANGE = "Invalid range";
  public static final String START_BEFORE_END = "start must be before end";

  private final Clock clock;

  public TimeRangeResolver(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public TimeWindow resolve(Instant start, Instant end, String range) {
    boolean hasStart = start != null;
    boolean hasEnd = end != null;
    boolean hasRange = range != null && !range.isEmpty();

    if (hasStart != hasEnd || hasRange == hasStart) {
      throw QueryValidationException.forField(FIELD, EITHER_REQUIRED);
    }

    if (hasRange) {
      Duration delta = StatsPeriod.parse(range);
      if (delta == null || delta.isZero()) throw QueryValidationException.forField(FIELD, INVALID_RANGE);
      Instant now = clock.instant();
      try {
        return new TimeWindow(now.minus(delta), now);
      } catch (DateTimeException | ArithmeticException e) {
        throw QueryValidationException.forField(FIELD, INVALID_RANGE);
      }
    }

    if (!start.isBefore(end)) throw QueryValidationException.forField("start", START_BEFORE_END);
    return new TimeWindow(start, end);
  }
}
