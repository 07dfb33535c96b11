package io.intellixity.discover.spi.physical;

import io.intellixity.discover.query.Aggregation;
import io.intellixity.discover.query.QuerySpec;

import java.util.*;

/**
 * Translates a {@link QuerySpec} into a {@link PhysicalQuery}.
 * <p>
 * {@code project_name} does not exist in the event store: wherever it is requested it is replaced by
 * {@code project_id} and the original position is recorded in a {@link ReversalPlan}.
 */
public final class ColumnRewriter {
  public static final String PROJECT_NAME = "project_name";
  public static final String PROJECT_ID = "project_id";

  public PhysicalPlan toPhysical(QuerySpec spec) {
    Objects.requireNonNull(spec, "spec");
    List<ReversalPlan.Reinsertion> reinsertions = new ArrayList<>();

    // Aggregation mode selects nothing directly: grouped columns come back through groupby.
    List<String> selected = new ArrayList<>(spec.hasAggregations() ? List.of() : spec.fields());
    ReversalPlan.Reinsertion fromSelected = substitute(selected, ReversalPlan.Location.SELECTED_COLUMNS);
    if (fromSelected != null) reinsertions.add(fromSelected);

    List<String> groupby = new ArrayList<>(spec.groupby());
    ReversalPlan.Reinsertion fromGroupby = substitute(groupby, ReversalPlan.Location.GROUPBY);
    if (fromGroupby != null && fromSelected == null) reinsertions.add(fromGroupby);

    List<Aggregation> aggregations = new ArrayList<>(spec.aggregations().size());
    for (Aggregation a : spec.aggregations()) {
      aggregations.add(PROJECT_NAME.equals(a.column()) ? a.withColumn(PROJECT_ID) : a);
    }

    PhysicalQuery query = new PhysicalQuery(
        spec.timeWindow().start(),
        spec.timeWindow().end(),
        selected,
        aggregations,
        groupby,
        spec.conditions(),
        spec.orderby(),
        spec.limit(),
        null,
        spec.rollup(),
        Map.of(PROJECT_ID, spec.projects()),
        spec.arrayjoin(),
        spec.turbo(),
        PhysicalQuery.REFERRER);
    return new PhysicalPlan(query, new ReversalPlan(reinsertions));
  }

  private static ReversalPlan.Reinsertion substitute(List<String> columns, ReversalPlan.Location location) {
    int index = columns.indexOf(PROJECT_NAME);
    if (index < 0) return null;
    columns.remove(index);
    boolean idAdded = !columns.contains(PROJECT_ID);
    if (idAdded) columns.add(PROJECT_ID);
    return new ReversalPlan.Reinsertion(location, index, idAdded);
  }
}
