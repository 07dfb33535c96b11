package io.intellixity.discover.spi.exec;

import io.intellixity.discover.query.QuerySpec;
import io.intellixity.discover.spi.physical.ColumnRewriter;
import io.intellixity.discover.spi.physical.PhysicalPlan;
import io.intellixity.discover.spi.physical.PhysicalQuery;
import io.intellixity.discover.spi.result.EngineResult;
import io.intellixity.discover.spi.result.ResultSet;
import io.intellixity.discover.spi.result.ResultShaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a validated {@link QuerySpec} against a {@link QueryEngine}.
 * <p>
 * Without aggregations the query is paginated: the engine is called repeatedly with an offset/limit
 * window, sequentially, and each page is shaped on its own. With aggregations exactly one engine call
 * is made. Physical query construction is shared by both modes.
 */
public final class QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

  public static final int MAX_PAGE_SIZE = 1000;
  public static final int MAX_PAGES = 1000;

  private final QueryEngine engine;
  private final ColumnRewriter rewriter;
  private final ResultShaper shaper;

  public QueryExecutor(QueryEngine engine) {
    this(engine, new ColumnRewriter(), new ResultShaper());
  }

  public QueryExecutor(QueryEngine engine, ColumnRewriter rewriter, ResultShaper shaper) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    this.shaper = Objects.requireNonNull(shaper, "shaper");
  }

  public static boolean isPaginated(QuerySpec spec) {
    return !spec.hasAggregations();
  }

  /**
   * Executes the whole query. Paginated results are concatenated only once every page succeeded.
   *
   * @param projectNames project id to name, used to fill {@code project_name}
   */
  public ResultSet execute(QuerySpec spec, Map<Long, String> projectNames) {
    Objects.requireNonNull(spec, "spec");
    if (!isPaginated(spec)) return executeSingle(spec, projectNames);
    List<ResultSet> pages = new ArrayList<>();
    forEachPage(spec, projectNames, pages::add);
    return ResultSet.concat(pages);
  }

  /**
   * Streams a paginated query page by page. Pages hold {@code spec.limit()} rows ({@link #MAX_PAGE_SIZE}
   * when unset); iteration stops at the first short page or after {@link #MAX_PAGES} pages.
   *
   * @return number of pages delivered
   */
  public int forEachPage(QuerySpec spec, Map<Long, String> projectNames, Consumer<ResultSet> consumer) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(consumer, "consumer");
    requirePaginated(spec);

    PhysicalPlan plan = rewriter.toPhysical(spec);
    int pageSize = spec.limit() == null ? MAX_PAGE_SIZE : spec.limit();
    int pages = 0;
    int offset = 0;
    while (pages < MAX_PAGES) {
      EngineResult raw = call(plan.query().withPage(offset, pageSize), "page");
      consumer.accept(shaper.reshape(raw, plan.reversal(), projectNames));
      pages++;
      if (pageSize == 0 || raw.data().size() < pageSize) break;
      offset += pageSize;
    }
    if (pages == MAX_PAGES) log.warn("discover.exec page_cap_reached pages={} pageSize={}", pages, pageSize);
    return pages;
  }

  /**
   * Fetches one page for an offset cursor. One extra row is requested to learn whether a next page exists.
   */
  public PageResult executePage(QuerySpec spec, Map<Long, String> projectNames, OffsetPage page) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(page, "page");
    requirePaginated(spec);

    int limit = Math.min(page.limit(), MAX_PAGE_SIZE);
    PhysicalPlan plan = rewriter.toPhysical(spec);
    EngineResult raw = call(plan.query().withPage(page.offset(), limit + 1), "cursor");
    boolean hasNext = raw.data().size() > limit;
    ResultSet shaped = shaper.reshape(raw.limitRows(limit), plan.reversal(), projectNames);
    return new PageResult(shaped, new OffsetPage(page.offset(), limit), hasNext);
  }

  private ResultSet executeSingle(QuerySpec spec, Map<Long, String> projectNames) {
    PhysicalPlan plan = rewriter.toPhysical(spec);
    EngineResult raw = call(plan.query(), "single");
    return shaper.reshape(raw, plan.reversal(), projectNames);
  }

  private EngineResult call(PhysicalQuery query, String mode) {
    long t0 = System.nanoTime();
    EngineResult raw;
    try {
      raw = engine.query(query);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new QueryEngineException("Query engine failed: " + e.getMessage(), e);
    }
    if (raw == null) throw new QueryEngineException("Query engine returned no result");
    if (log.isDebugEnabled()) {
      log.debug("discover.exec mode={} offset={} limit={} rows={} durationMs={}",
          mode, query.offset(), query.limit(), raw.data().size(), (System.nanoTime() - t0) / 1_000_000L);
    }
    return raw;
  }

  private static void requirePaginated(QuerySpec spec) {
    if (!isPaginated(spec)) {
      throw new IllegalArgumentException("Aggregation queries are executed in a single call, not paginated");
    }
  }
}
