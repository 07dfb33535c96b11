package io.intellixity.discover.validate;

import io.intellixity.discover.query.Aggregation;
import io.intellixity.discover.query.OrderBy;
import io.intellixity.discover.query.QueryValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Requires the sort column to be visible in the result.
 * <p>
 * With aggregations the candidates are the aggregation aliases plus {@code time}; with fields only,
 * the fields. When both are present either set is accepted.
 */
public final class OrderByValidator {
  public static final String FIELD = "orderby";
  public static final String TIME_COLUMN = "time";
  public static final String INVALID = "Invalid OrderBy - Must be in Fields or Aggregations";

  public OrderBy validate(String orderby, List<String> fields, List<Aggregation> aggregations) {
    if (orderby == null || orderby.isEmpty()) return null;
    OrderBy parsed = OrderBy.parse(orderby);

    Set<String> candidates = new HashSet<>();
    if (fields != null) candidates.addAll(fields);
    if (aggregations != null && !aggregations.isEmpty()) {
      for (Aggregation a : aggregations) candidates.add(a.alias());
      candidates.add(TIME_COLUMN);
    }

    if (parsed.column().isEmpty()) throw QueryValidationException.forField(FIELD, INVALID);
    if (candidates.isEmpty()) return parsed;
    if (!candidates.contains(parsed.column())) throw QueryValidationException.forField(FIELD, INVALID);
    return parsed;
  }
}
