package io.intellixity.discover.spi.result;

import java.util.*;

/** Client-facing result: JSON-typed {@code meta} and rows in the requested column shape. */
public record ResultSet(List<ColumnMeta> meta, List<Map<String, Object>> data) {
  public static final ResultSet EMPTY = new ResultSet(List.of(), List.of());

  public ResultSet {
    meta = List.copyOf(meta == null ? List.of() : meta);
    List<Map<String, Object>> rows = new ArrayList<>();
    if (data != null) {
      for (Map<String, Object> row : data) rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    data = Collections.unmodifiableList(rows);
  }

  /** Rows of all pages in order; meta of the first non-empty meta. */
  public static ResultSet concat(List<ResultSet> pages) {
    if (pages == null || pages.isEmpty()) return EMPTY;
    List<ColumnMeta> meta = List.of();
    List<Map<String, Object>> rows = new ArrayList<>();
    for (ResultSet page : pages) {
      if (meta.isEmpty()) meta = page.meta();
      rows.addAll(page.data());
    }
    return new ResultSet(meta, rows);
  }
}
