package io.intellixity.discover.spi.result;

import io.intellixity.discover.spi.physical.ColumnRewriter;
import io.intellixity.discover.spi.physical.ReversalPlan;

import java.util.*;

/**
 * Reverses the {@code project_name} substitution on engine results and converts column types to JSON types.
 */
public final class ResultShaper {
  static final String PROJECT_NAME_TYPE = "String";

  public ResultSet reshape(EngineResult result, ReversalPlan plan, Map<Long, String> projectNames) {
    Objects.requireNonNull(result, "result");
    ReversalPlan reversal = (plan == null) ? ReversalPlan.NONE : plan;
    Map<Long, String> names = (projectNames == null) ? Map.of() : projectNames;

    List<ColumnMeta> meta = new ArrayList<>(result.meta());
    List<Map<String, Object>> rows = new ArrayList<>(result.data().size());
    for (Map<String, Object> row : result.data()) rows.add(new LinkedHashMap<>(row));

    for (ReversalPlan.Reinsertion r : reversal.reinsertions()) {
      meta.add(Math.min(r.index(), meta.size()), new ColumnMeta(ColumnRewriter.PROJECT_NAME, PROJECT_NAME_TYPE));
      if (r.dropIdColumn()) meta.removeIf(c -> ColumnRewriter.PROJECT_ID.equals(c.name()));

      for (Map<String, Object> row : rows) {
        row.put(ColumnRewriter.PROJECT_NAME, names.get(asLong(row.get(ColumnRewriter.PROJECT_ID))));
        if (r.dropIdColumn()) row.remove(ColumnRewriter.PROJECT_ID);
      }
    }

    List<ColumnMeta> typed = new ArrayList<>(meta.size());
    for (ColumnMeta c : meta) typed.add(new ColumnMeta(c.name(), JsonTypes.of(c.type())));

    List<Map<String, Object>> shaped = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) shaped.add(inMetaOrder(row, typed));
    return new ResultSet(typed, shaped);
  }

  private static Map<String, Object> inMetaOrder(Map<String, Object> row, List<ColumnMeta> meta) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ColumnMeta c : meta) {
      if (row.containsKey(c.name())) out.put(c.name(), row.get(c.name()));
    }
    for (var e : row.entrySet()) out.putIfAbsent(e.getKey(), e.getValue());
    return out;
  }

  static Long asLong(Object v) {
    if (v == null) return null;
    if (v instanceof Number n) return n.longValue();
    try {
      return Long.parseLong(String.valueOf(v).trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
