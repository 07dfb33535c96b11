package io.intellixity.discover.validate;

import io.intellixity.discover.query.QueryValidationException;
import io.intellixity.discover.query.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class TimeRangeResolverTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private final TimeRangeResolver resolver = new TimeRangeResolver(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void relativeRangeEndsNowAndStartsOneDurationEarlier() {
    TimeWindow w = resolver.resolve(null, null, "14d");
    assertEquals(NOW, w.end());
    assertEquals(NOW.minus(Duration.ofDays(14)), w.start());
  }

  @Test
  void explicitWindowIsKeptAsIs() {
    Instant start = NOW.minus(Duration.ofHours(2));
    TimeWindow w = resolver.resolve(start, NOW, null);
    assertEquals(start, w.start());
    assertEquals(NOW, w.end());
  }

  @Test
  void rejectsBothForms() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> resolver.resolve(NOW.minusSeconds(60), NOW, "1h"));
    assertEquals(List.of(TimeRangeResolver.EITHER_REQUIRED), ex.errorsFor("range"));
  }

  @Test
  void rejectsNeitherForm() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> resolver.resolve(null, null, null));
    assertEquals(List.of(TimeRangeResolver.EITHER_REQUIRED), ex.errorsFor("range"));
  }

  @Test
  void rejectsHalfAnExplicitWindow() {
    assertThrows(QueryValidationException.class, () -> resolver.resolve(NOW, null, null));
    assertThrows(QueryValidationException.class, () -> resolver.resolve(null, NOW, null));
    assertThrows(QueryValidationException.class, () -> resolver.resolve(NOW, null, "1d"));
  }

  @Test
  void rejectsUnparsableRange() {
    for (String bad : new String[]{"14 days", "-1d", "1y", "d", "0h"}) {
      QueryValidationException ex = assertThrows(QueryValidationException.class,
          () -> resolver.resolve(null, null, bad), bad);
      assertEquals(List.of(TimeRangeResolver.INVALID_RANGE), ex.errorsFor("range"));
    }
  }

  @Test
  void rejectsInvertedExplicitWindow() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> resolver.resolve(NOW, NOW.minusSeconds(1), null));
    assertFalse(ex.errorsFor("start").isEmpty());
  }
}
