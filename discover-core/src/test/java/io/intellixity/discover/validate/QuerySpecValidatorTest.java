package io.intellixity.discover.validate;

import io.intellixity.discover.query.*;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.discover.query.DiscoverRequest.row;
import static org.junit.jupiter.api.Assertions.*;

final class QuerySpecValidatorTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private final QuerySpecValidator validator = new QuerySpecValidator(Clock.fixed(NOW, ZoneOffset.UTC));

  private static final class Denied extends RuntimeException {}

  @Test
  void buildsCanonicalSpecForRawQuery() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L, 2L, 1L)
        .withRange("1h")
        .withFields("message", "error.type", "stack.filename")
        .withConditions(List.of(row("stack.in_app", "=", true), row("error.type", "!=", "KeyError")))
        .withOrderby("-message")
        .withLimit(50)
        .withTurbo(true);

    QuerySpec spec = validator.validate(r, ProjectAccessCheck.ALLOW_ALL);

    assertEquals(List.of(1L, 2L), new ArrayList<>(spec.projects()));
    assertEquals(NOW, spec.timeWindow().end());
    assertEquals(NOW.minusSeconds(3600), spec.timeWindow().start());
    assertEquals("error", spec.arrayjoin());
    assertEquals(FunctionCondition.has("stack.in_app", 1, true), spec.conditions().get(0));
    assertEquals(new ColumnCondition("error.type", Operator.NE, ConditionValue.of("KeyError")), spec.conditions().get(1));
    assertEquals(new OrderBy("message", OrderBy.Direction.DESC), spec.orderby());
    assertEquals(50, spec.limit());
    assertEquals(Boolean.TRUE, spec.turbo());
    assertTrue(spec.groupby().isEmpty());
    assertFalse(spec.hasAggregations());
  }

  @Test
  void appendsFieldsToGroupByWhenAggregating() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L)
        .withRange("1d")
        .withFields("country", "project_name")
        .withGroupby("time", "country")
        .withAggregations(List.of(row("count()", null, "hits")))
        .withOrderby("-hits");

    QuerySpec spec = validator.validate(r, ProjectAccessCheck.ALLOW_ALL);
    assertEquals(List.of("time", "country", "project_name"), spec.groupby());
    assertEquals(List.of(new Aggregation("count()", null, "hits")), spec.aggregations());
  }

  @Test
  void collectsEveryFieldError() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L)
        .withRange("soon")
        .withFields("country")
        .withAggregations(List.of(row("sum", "price", "revenue"), row("median", "price", "p50")))
        .withConditions(List.of(row("country", "~=", "DE")))
        .withLimit(5000);

    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.validate(r, ProjectAccessCheck.ALLOW_ALL));

    assertEquals(List.of(TimeRangeResolver.INVALID_RANGE), ex.errorsFor("range"));
    assertEquals(List.of("Invalid aggregate function - sum, median"), ex.errorsFor("aggregations"));
    assertEquals(List.of(QuerySpecValidator.LIMIT_MAX), ex.errorsFor("limit"));
    assertEquals(1, ex.errorsFor("conditions").size());
  }

  @Test
  void invalidOrderByIsReportedWithOtherErrors() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L)
        .withFields("country")
        .withOrderby("revenue");

    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.validate(r, ProjectAccessCheck.ALLOW_ALL));
    assertEquals(List.of(TimeRangeResolver.EITHER_REQUIRED), ex.errorsFor("range"));
    assertEquals(List.of(OrderByValidator.INVALID), ex.errorsFor("orderby"));
  }

  @Test
  void projectsAreRequiredAndNonEmpty() {
    QueryValidationException missing = assertThrows(QueryValidationException.class,
        () -> validator.validate(new DiscoverRequest().withRange("1h"), ProjectAccessCheck.ALLOW_ALL));
    assertEquals(List.of(QuerySpecValidator.REQUIRED), missing.errorsFor("projects"));

    QueryValidationException empty = assertThrows(QueryValidationException.class,
        () -> validator.validate(new DiscoverRequest().withProjects(List.of()).withRange("1h"), ProjectAccessCheck.ALLOW_ALL));
    assertEquals(List.of(QuerySpecValidator.EMPTY_PROJECTS), empty.errorsFor("projects"));
  }

  @Test
  void accessDenialShortCircuitsFieldValidation() {
    AtomicReference<Set<Long>> seen = new AtomicReference<>();
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L, 3L)
        .withRange("bogus")
        .withAggregations(List.of(row("sum", "x", "y")));

    assertThrows(Denied.class, () -> validator.validate(r, projects -> {
      seen.set(projects);
      throw new Denied();
    }));
    assertEquals(Set.of(1L, 3L), seen.get());
  }

  @Test
  void specIsImmutable() {
    QuerySpec spec = validator.validate(new DiscoverRequest().withProjects(1L).withRange("1h").withFields("a"),
        ProjectAccessCheck.ALLOW_ALL);
    assertThrows(UnsupportedOperationException.class, () -> spec.fields().add("b"));
    assertThrows(UnsupportedOperationException.class, () -> spec.projects().add(2L));
  }

  @Test
  void nullLiteralOnArrayFieldIsAccepted() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L)
        .withRange("1h")
        .withFields("message")
        .withConditions(List.of(row("error.type", "=", null)));

    QuerySpec spec = validator.validate(r, ProjectAccessCheck.ALLOW_ALL);
    assertEquals(FunctionCondition.has("error.type", null, true), spec.conditions().get(0));
  }

  @Test
  void listValueRequiresListOperator() {
    DiscoverRequest r = new DiscoverRequest()
        .withProjects(1L)
        .withRange("1h")
        .withFields("message")
        .withConditions(List.of(
            row("message", "=", List.of("a", "b")),
            row("error.type", "!=", List.of("KeyError")),
            row("level", "IN", List.of("error", "fatal"))));

    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> validator.validate(r, ProjectAccessCheck.ALLOW_ALL));
    List<String> problems = e.errorsFor(ConditionParser.FIELD);
    assertEquals(2, problems.size());
    assertTrue(problems.get(0).contains("does not accept a list value for message"), problems.get(0));
    assertTrue(problems.get(1).contains("does not accept a list value for error.type"), problems.get(1));
  }
}
