package io.intellixity.discover.query;

import java.util.*;

/**
 * Validated, canonical form of a discover request. Immutable.
 * <p>
 * Built only by the validation pipeline; {@code groupby} already contains every requested field when
 * aggregations are present, and {@code conditions} are already rewritten for the resolved {@code arrayjoin}.
 */
public record QuerySpec(Set<Long> projects,
                        TimeWindow timeWindow,
                        List<String> fields,
                        List<Aggregation> aggregations,
                        List<String> groupby,
                        OrderBy orderby,
                        List<Condition> conditions,
                        Integer limit,
                        Integer rollup,
                        String arrayjoin,
                        Boolean turbo) {
  public static final int MAX_LIMIT = 1000;

  public QuerySpec {
    Objects.requireNonNull(projects, "projects");
    if (projects.isEmpty()) throw new IllegalArgumentException("projects must not be empty");
    Objects.requireNonNull(timeWindow, "timeWindow");
    if (limit != null && (limit < 0 || limit > MAX_LIMIT)) {
      throw new IllegalArgumentException("limit must be within [0, " + MAX_LIMIT + "]");
    }
    projects = Collections.unmodifiableSet(new LinkedHashSet<>(projects));
    fields = List.copyOf(fields == null ? List.of() : fields);
    aggregations = List.copyOf(aggregations == null ? List.of() : aggregations);
    groupby = List.copyOf(groupby == null ? List.of() : groupby);
    conditions = List.copyOf(conditions == null ? List.of() : conditions);
  }

  public boolean hasAggregations() {
    return !aggregations.isEmpty();
  }
}
