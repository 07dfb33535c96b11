package io.intellixity.discover.validate;

import io.intellixity.discover.query.Aggregation;
import io.intellixity.discover.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AggregationValidatorTest {
  private final AggregationValidator validator = new AggregationValidator();

  @Test
  void acceptsWhitelistedFunctions() {
    assertDoesNotThrow(() -> validator.validate(List.of(
        new Aggregation("count()", null, "count"),
        new Aggregation("uniq", "user.id", "users"),
        new Aggregation("avg", "duration", "avg_duration"))));
  }

  @Test
  void listsEveryInvalidFunction() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(List.of(
        new Aggregation("sum", "duration", "a"),
        new Aggregation("count()", null, "b"),
        new Aggregation("topK(5)", "message", "c"),
        new Aggregation("sum", "price", "d"))));
    assertEquals(List.of("Invalid aggregate function - sum, topK(5)"), ex.errorsFor("aggregations"));
  }

  @Test
  void comparesNamesExactly() {
    assertThrows(QueryValidationException.class,
        () -> validator.validate(List.of(new Aggregation("count", null, "c"))));
    assertThrows(QueryValidationException.class,
        () -> validator.validate(List.of(new Aggregation("AVG", "duration", "c"))));
  }

  @Test
  void parsesRowsAllowingMissingColumn() {
    List<Aggregation> parsed = validator.parse(List.of(
        Arrays.asList("count()", null, "count"),
        List.of("uniq", "user.id", "users")));
    assertEquals(new Aggregation("count()", null, "count"), parsed.get(0));
    assertEquals(new Aggregation("uniq", "user.id", "users"), parsed.get(1));
  }

  @Test
  void rejectsMalformedRows() {
    assertThrows(QueryValidationException.class, () -> validator.parse(List.of(List.of("count()", "x"))));
    assertThrows(QueryValidationException.class, () -> validator.parse(List.of(List.of(1, "x", "y"))));
    assertThrows(QueryValidationException.class, () -> validator.parse(List.of(Arrays.asList("avg", "x", null))));
  }
}
