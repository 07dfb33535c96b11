package io.intellixity.discover.jdbc;

import io.intellixity.discover.jdbc.dialect.ClickHouseDialect;
import io.intellixity.discover.spi.exec.QueryEngine;
import io.intellixity.discover.spi.exec.QueryEngineException;
import io.intellixity.discover.spi.physical.PhysicalQuery;
import io.intellixity.discover.spi.result.ColumnMeta;
import io.intellixity.discover.spi.result.EngineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/** {@link QueryEngine} over a JDBC {@link DataSource}, one connection per call, no transaction. */
public final class JdbcQueryEngine implements QueryEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

  private final DataSource ds;
  private final ClickHouseDialect dialect;
  private final int queryTimeoutSeconds;

  public JdbcQueryEngine(DataSource ds, ClickHouseDialect dialect, int queryTimeoutSeconds) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public EngineResult query(PhysicalQuery query) {
    SqlStatement ss = dialect.render(query);
    long start = System.nanoTime();
    debugSql(query, ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(ss.sql())) {
      if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        EngineResult out = read(rs);
        if (log.isDebugEnabled()) {
          log.debug("discover.jdbc_done referrer={} rows={} durationMs={}",
              query.referrer(), out.data().size(), (System.nanoTime() - start) / 1_000_000.0);
        }
        return out;
      }
    } catch (SQLTimeoutException e) {
      throw new QueryEngineException("Query timed out after " + queryTimeoutSeconds + "s", e);
    } catch (SQLException e) {
      throw new QueryEngineException("Query failed: " + e.getMessage(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      Object v = ss.binds().get(i);
      if (v instanceof Instant t) ps.setTimestamp(i + 1, Timestamp.from(t));
      else if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  static EngineResult read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<ColumnMeta> meta = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) meta.add(new ColumnMeta(md.getColumnLabel(i), md.getColumnTypeName(i)));

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) row.put(meta.get(i - 1).name(), value(rs.getObject(i)));
      rows.add(row);
    }
    return new EngineResult(meta, rows);
  }

  /** Arrays become lists; temporal values become ISO-8601 strings. */
  static Object value(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof java.sql.Array a) return value(a.getArray());
    if (v.getClass().isArray()) {
      int len = java.lang.reflect.Array.getLength(v);
      List<Object> out = new ArrayList<>(len);
      for (int i = 0; i < len; i++) out.add(value(java.lang.reflect.Array.get(v, i)));
      return out;
    }
    if (v instanceof Timestamp ts) return ts.toInstant().toString();
    if (v instanceof TemporalAccessor t) return t.toString();
    return v;
  }

  private void debugSql(PhysicalQuery query, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("discover.jdbc op=SELECT referrer={} table={} bindCount={} offset={} limit={} sql={}",
        query.referrer(), dialect.table(), ss.binds().size(), query.offset(), query.limit(), ss.sql());

    // TRACE: bind types only, values may carry user data
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object b : ss.binds()) {
        log.trace("discover.jdbc bind index={} valueType={}", idx++, b == null ? "null" : b.getClass().getName());
      }
    }
  }
}
