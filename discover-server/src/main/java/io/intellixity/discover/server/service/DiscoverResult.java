package io.intellixity.discover.server.service;

import io.intellixity.discover.spi.exec.PageResult;
import io.intellixity.discover.spi.result.ResultSet;

import java.util.Objects;

/** Shaped results plus, for raw queries, the page they belong to. {@code page} is null for aggregations. */
public record DiscoverResult(ResultSet results, PageResult page) {
  public DiscoverResult {
    Objects.requireNonNull(results, "results");
  }

  public static DiscoverResult single(ResultSet results) {
    return new DiscoverResult(results, null);
  }

  public static DiscoverResult paged(PageResult page) {
    return new DiscoverResult(page.results(), page);
  }

  public boolean paginated() {
    return page != null;
  }
}
