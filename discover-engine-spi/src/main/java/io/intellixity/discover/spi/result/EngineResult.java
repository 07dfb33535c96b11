package io.intellixity.discover.spi.result;

import java.util.*;

/** Raw rows returned by the query engine, with engine column types in {@code meta}. */
public record EngineResult(List<ColumnMeta> meta, List<Map<String, Object>> data) {
  public EngineResult {
    meta = List.copyOf(meta == null ? List.of() : meta);
    List<Map<String, Object>> rows = new ArrayList<>();
    if (data != null) {
      for (Map<String, Object> row : data) rows.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    data = Collections.unmodifiableList(rows);
  }

  public EngineResult limitRows(int max) {
    if (data.size() <= max) return this;
    return new EngineResult(meta, data.subList(0, max));
  }
}
