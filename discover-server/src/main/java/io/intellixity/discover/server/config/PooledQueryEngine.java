package io.intellixity.discover.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.discover.jdbc.JdbcQueryEngine;
import io.intellixity.discover.jdbc.dialect.ClickHouseDialect;
import io.intellixity.discover.spi.exec.QueryEngine;
import io.intellixity.discover.spi.exec.QueryEngineException;
import io.intellixity.discover.spi.physical.PhysicalQuery;
import io.intellixity.discover.spi.result.EngineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link JdbcQueryEngine} over a HikariCP pool created on the first query, so the application starts
 * without a reachable event store.
 */
public final class PooledQueryEngine implements QueryEngine, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PooledQueryEngine.class);

  private final DiscoverProperties.Engine cfg;
  private HikariDataSource pool;
  private JdbcQueryEngine delegate;

  public PooledQueryEngine(DiscoverProperties.Engine cfg) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
  }

  @Override
  public EngineResult query(PhysicalQuery query) {
    return engine().query(query);
  }

  private synchronized JdbcQueryEngine engine() {
    if (delegate != null) return delegate;
    String url = cfg.getJdbcUrl();
    if (url == null || url.isBlank()) throw new QueryEngineException("Missing discover.engine.jdbc-url");

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("discover-engine");
    hc.setJdbcUrl(url);
    hc.setUsername(cfg.getUsername());
    hc.setPassword(cfg.getPassword());
    hc.setMaximumPoolSize(cfg.getMaxPoolSize());
    hc.setReadOnly(true);
    try {
      pool = new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new QueryEngineException("Could not open engine pool: " + e.getMessage(), e);
    }
    log.info("discover.engine pool_created table={} maxPoolSize={}", cfg.getTable(), cfg.getMaxPoolSize());
    delegate = new JdbcQueryEngine(pool, new ClickHouseDialect(cfg.getTable()), cfg.getQueryTimeoutSeconds());
    return delegate;
  }

  @Override
  public synchronized void close() {
    if (pool != null) pool.close();
    pool = null;
    delegate = null;
  }
}
