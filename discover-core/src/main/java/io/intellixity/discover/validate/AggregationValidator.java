package io.intellixity.discover.validate;

import io.intellixity.discover.query.Aggregation;
import io.intellixity.discover.query.QueryValidationException;

import java.util.*;

/** Parses {@code [function, column, alias]} rows and whitelists the aggregate functions. */
public final class AggregationValidator {
  public static final String FIELD = "aggregations";
  public static final Set<String> FUNCTIONS = Set.of("count()", "uniq", "avg");

  public List<Aggregation> parse(List<List<Object>> rows) {
    if (rows == null || rows.isEmpty()) return List.of();
    List<Aggregation> out = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row == null || row.size() != 3
          || !(row.get(0) instanceof String function)
          || !(row.get(1) == null || row.get(1) instanceof String)
          || !(row.get(2) instanceof String alias)) {
        throw QueryValidationException.forField(FIELD,
            "Invalid aggregation - expected [function, column, alias]: " + row);
      }
      out.add(new Aggregation(function, (String) row.get(1), alias));
    }
    return out;
  }

  /** Rejects every function outside {@link #FUNCTIONS}, listing each offending name once. */
  public void validate(List<Aggregation> aggregations) {
    if (aggregations == null || aggregations.isEmpty()) return;
    Set<String> invalid = new LinkedHashSet<>();
    for (Aggregation a : aggregations) {
      if (!FUNCTIONS.contains(a.function())) invalid.add(a.function());
    }
    if (!invalid.isEmpty()) {
      throw QueryValidationException.forField(FIELD, "Invalid aggregate function - " + String.join(", ", invalid));
    }
  }
}
