package io.intellixity.discover.spi.result;

import java.util.Objects;

/** Output column descriptor: engine type before shaping, JSON type after. */
public record ColumnMeta(String name, String type) {
  public ColumnMeta {
    Objects.requireNonNull(name, "name");
  }
}
