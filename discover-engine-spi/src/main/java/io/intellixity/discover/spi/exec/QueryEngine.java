package io.intellixity.discover.spi.exec;

import io.intellixity.discover.spi.physical.PhysicalQuery;
import io.intellixity.discover.spi.result.EngineResult;

/**
 * The column store. Accepts a physical query and returns raw rows.
 * <p>
 * Each call is a synchronous round trip. Implementations report failures and timeouts as
 * {@link QueryEngineException}; callers do not retry.
 */
public interface QueryEngine {
  EngineResult query(PhysicalQuery query);
}
