package io.intellixity.discover.spi.exec;

import io.intellixity.discover.spi.result.ResultSet;

import java.util.Objects;

/** One shaped page of a paginated query plus what the cursor needs to build prev/next links. */
public record PageResult(ResultSet results, OffsetPage page, boolean hasNext) {
  public PageResult {
    Objects.requireNonNull(results, "results");
    Objects.requireNonNull(page, "page");
  }

  public boolean hasPrevious() {
    return page.offset() > 0;
  }
}
