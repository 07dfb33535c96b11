package io.intellixity.discover.spi.physical;

import io.intellixity.discover.query.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnRewriterTest {
  private static final TimeWindow WINDOW = new TimeWindow(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z"));
  private final ColumnRewriter rewriter = new ColumnRewriter();

  private static QuerySpec spec(List<String> fields, List<Aggregation> aggregations, List<String> groupby) {
    return new QuerySpec(new LinkedHashSet<>(List.of(4L, 5L)), WINDOW, fields, aggregations, groupby,
        null, List.of(), 100, null, null, null);
  }

  @Test
  void substitutesProjectNameInSelectedColumns() {
    PhysicalPlan plan = rewriter.toPhysical(spec(List.of("message", "project_name", "timestamp"), List.of(), List.of()));

    assertEquals(List.of("message", "timestamp", "project_id"), plan.query().selectedColumns());
    assertEquals(List.of(new ReversalPlan.Reinsertion(ReversalPlan.Location.SELECTED_COLUMNS, 1, true)),
        plan.reversal().reinsertions());
  }

  @Test
  void keepsExplicitlyRequestedProjectId() {
    PhysicalPlan plan = rewriter.toPhysical(spec(List.of("project_id", "project_name"), List.of(), List.of()));

    assertEquals(List.of("project_id"), plan.query().selectedColumns());
    assertFalse(plan.reversal().reinsertions().get(0).dropIdColumn());
  }

  @Test
  void aggregationModeSelectsNothingAndRewritesGroupByAndAggregations() {
    List<Aggregation> aggs = List.of(new Aggregation("uniq", "project_name", "projects"), new Aggregation("count()", null, "hits"));
    PhysicalPlan plan = rewriter.toPhysical(spec(List.of("project_name"), aggs, List.of("time", "project_name")));

    PhysicalQuery q = plan.query();
    assertTrue(q.selectedColumns().isEmpty());
    assertEquals(List.of("time", "project_id"), q.groupby());
    assertEquals(new Aggregation("uniq", "project_id", "projects"), q.aggregations().get(0));
    assertEquals(new Aggregation("count()", null, "hits"), q.aggregations().get(1));
    assertEquals(List.of(new ReversalPlan.Reinsertion(ReversalPlan.Location.GROUPBY, 1, true)), plan.reversal().reinsertions());
  }

  @Test
  void reversesOnceWhenSelectedAndGroupedInRawMode() {
    PhysicalPlan plan = rewriter.toPhysical(spec(List.of("project_name"), List.of(), List.of("project_name")));
    assertEquals(1, plan.reversal().reinsertions().size());
    assertEquals(ReversalPlan.Location.SELECTED_COLUMNS, plan.reversal().reinsertions().get(0).location());
    assertEquals(List.of("project_id"), plan.query().groupby());
  }

  @Test
  void scopesToRequestedProjectsAndForwardsHints() {
    QuerySpec s = new QuerySpec(Set.of(7L), WINDOW, List.of("message"), List.of(), List.of(),
        new OrderBy("message", OrderBy.Direction.DESC),
        List.of(ColumnCondition.of("message", Operator.LIKE, "%x%")), 10, 3600, "error", true);
    PhysicalQuery q = rewriter.toPhysical(s).query();

    assertEquals(Map.of("project_id", Set.of(7L)), q.filterKeys());
    assertEquals(WINDOW.start(), q.start());
    assertEquals(WINDOW.end(), q.end());
    assertEquals("error", q.arrayjoin());
    assertEquals(Integer.valueOf(3600), q.rollup());
    assertEquals(Boolean.TRUE, q.turbo());
    assertEquals("discover", q.referrer());
    assertEquals(s.conditions(), q.conditions());
    assertTrue(rewriter.toPhysical(s).reversal().isEmpty());
  }
}
