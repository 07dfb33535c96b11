package io.intellixity.discover.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Rendered SQL with positional {@code ?} parameters, bound in order. */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // binds may legitimately contain nulls, so no List.copyOf
    binds = Collections.unmodifiableList(new ArrayList<>(binds == null ? List.of() : binds));
  }
}
