package io.intellixity.discover.spi.physical;

import io.intellixity.discover.query.Aggregation;
import io.intellixity.discover.query.Condition;
import io.intellixity.discover.query.OrderBy;

import java.time.Instant;
import java.util.*;

/**
 * Column-store facing query, after synthetic column substitution. Immutable.
 * <p>
 * {@code selectedColumns} is empty in aggregation mode; {@code filterKeys} scopes the query to
 * {@code project_id IN (...)}. {@code limit}/{@code offset} are the page window requested from the engine.
 */
public record PhysicalQuery(Instant start,
                            Instant end,
                            List<String> selectedColumns,
                            List<Aggregation> aggregations,
                            List<String> groupby,
                            List<Condition> conditions,
                            OrderBy orderby,
                            Integer limit,
                            Integer offset,
                            Integer rollup,
                            Map<String, Set<Long>> filterKeys,
                            String arrayjoin,
                            Boolean turbo,
                            String referrer) {
  public static final String REFERRER = "discover";

  public PhysicalQuery {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    selectedColumns = List.copyOf(selectedColumns == null ? List.of() : selectedColumns);
    aggregations = List.copyOf(aggregations == null ? List.of() : aggregations);
    groupby = List.copyOf(groupby == null ? List.of() : groupby);
    conditions = List.copyOf(conditions == null ? List.of() : conditions);
    filterKeys = copyFilterKeys(filterKeys);
    referrer = (referrer == null) ? REFERRER : referrer;
  }

  /** Same query restricted to one page window. */
  public PhysicalQuery withPage(int offset, int limit) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    return new PhysicalQuery(start, end, selectedColumns, aggregations, groupby, conditions, orderby,
        limit, offset, rollup, filterKeys, arrayjoin, turbo, referrer);
  }

  private static Map<String, Set<Long>> copyFilterKeys(Map<String, Set<Long>> in) {
    if (in == null || in.isEmpty()) return Map.of();
    Map<String, Set<Long>> out = new LinkedHashMap<>();
    for (var e : in.entrySet()) {
      out.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
    }
    return Collections.unmodifiableMap(out);
  }
}
