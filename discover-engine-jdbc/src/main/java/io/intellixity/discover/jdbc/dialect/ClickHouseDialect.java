package io.intellixity.discover.jdbc.dialect;

import io.intellixity.discover.jdbc.SqlStatement;
import io.intellixity.discover.query.*;
import io.intellixity.discover.spi.physical.PhysicalQuery;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders a {@link PhysicalQuery} as a ClickHouse SELECT over a single events table.\n
 *
 * Layout:\n
 * - SELECT: selected columns (raw mode) or groupby columns followed by aggregations\n
 * - FROM table [SAMPLE] [ARRAY JOIN group]\n
 * - WHERE time window AND filter keys AND conditions\n
 * - GROUP BY / ORDER BY / LIMIT n OFFSET m\n
 *
 * Condition values are bound as parameters. The only inline literals are the arguments of function
 * conditions, which arrive already quoted, and integer paging values.\n
 */
public final class ClickHouseDialect {
  public static final String TIME_COLUMN = "time";
  public static final String TIMESTAMP_COLUMN = "timestamp";
  public static final int DEFAULT_ROLLUP_SECONDS = 3600;
  public static final String TURBO_SAMPLE = "0.2";

  private static final Pattern FUNCTION_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private final String table;

  public ClickHouseDialect(String table) {
    Objects.requireNonNull(table, "table");
    if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
    this.table = table;
  }

  public String table() { return table; }

  public SqlStatement render(PhysicalQuery q) {
    Objects.requireNonNull(q, "query");
    List<Object> binds = new ArrayList<>();
    int rollup = (q.rollup() == null || q.rollup() <= 0) ? DEFAULT_ROLLUP_SECONDS : q.rollup();

    StringBuilder sql = new StringBuilder("SELECT ");
    sql.append(String.join(", ", selectItems(q, rollup)));
    sql.append(" FROM ").append(quoteIdent(table));
    if (Boolean.TRUE.equals(q.turbo())) sql.append(" SAMPLE ").append(TURBO_SAMPLE);
    if (q.arrayjoin() != null) sql.append(" ARRAY JOIN ").append(quoteIdent(q.arrayjoin()));

    List<String> where = new ArrayList<>();
    where.add(quoteIdent(TIMESTAMP_COLUMN) + " >= ?");
    binds.add(q.start());
    where.add(quoteIdent(TIMESTAMP_COLUMN) + " < ?");
    binds.add(q.end());
    for (var e : q.filterKeys().entrySet()) {
      where.add(inList(quoteIdent(e.getKey()), false, new ArrayList<Object>(e.getValue()), binds));
    }
    for (Condition c : q.conditions()) where.add(c.accept(new ConditionRenderer(binds)));
    sql.append(" WHERE ").append(String.join(" AND ", where));

    if (!q.groupby().isEmpty()) {
      List<String> cols = new ArrayList<>();
      for (String g : q.groupby()) cols.add(quoteIdent(g));
      sql.append(" GROUP BY ").append(String.join(", ", cols));
    }
    if (q.orderby() != null) {
      sql.append(" ORDER BY ").append(quoteIdent(q.orderby().column()));
      if (q.orderby().direction() == OrderBy.Direction.DESC) sql.append(" DESC");
    }
    if (q.limit() != null) {
      sql.append(" LIMIT ").append(q.limit());
      if (q.offset() != null && q.offset() > 0) sql.append(" OFFSET ").append(q.offset());
    }
    return new SqlStatement(sql.toString(), binds);
  }

  private List<String> selectItems(PhysicalQuery q, int rollup) {
    List<String> items = new ArrayList<>();
    boolean aggregating = !q.aggregations().isEmpty();
    for (String col : aggregating ? q.groupby() : q.selectedColumns()) items.add(column(col, rollup));
    for (Aggregation a : q.aggregations()) items.add(aggregation(a) + " AS " + quoteIdent(a.alias()));
    if (items.isEmpty()) items.add("*");
    return items;
  }

  private String column(String col, int rollup) {
    if (TIME_COLUMN.equals(col)) {
      return "(intDiv(toUInt32(" + quoteIdent(TIMESTAMP_COLUMN) + "), " + rollup + ") * " + rollup + ") AS "
          + quoteIdent(TIME_COLUMN);
    }
    return quoteIdent(col);
  }

  String aggregation(Aggregation a) {
    String fn = a.function();
    if (fn.endsWith("()")) {
      requireFunctionName(fn.substring(0, fn.length() - 2));
      return fn;
    }
    requireFunctionName(fn);
    return fn + "(" + (a.column() == null ? "" : quoteIdent(a.column())) + ")";
  }

  /** Backtick quoting; dotted nested names ({@code error.type}) stay one identifier. */
  public static String quoteIdent(String ident) {
    Objects.requireNonNull(ident, "ident");
    return "`" + ident.replace("\\", "\\\\").replace("`", "\\`") + "`";
  }

  static String quoteLiteral(String s) {
    return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  private static void requireFunctionName(String fn) {
    if (!FUNCTION_NAME.matcher(fn).matches()) throw new IllegalArgumentException("Invalid function name: " + fn);
  }

  private static String inList(String lhs, boolean negated, List<Object> values, List<Object> binds) {
    if (values.isEmpty()) return negated ? "1 = 1" : "1 = 0";
    binds.addAll(values);
    return lhs + (negated ? " NOT IN (" : " IN (") + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
  }

  private static final class ConditionRenderer implements ConditionVisitor<String> {
    private final List<Object> binds;

    ConditionRenderer(List<Object> binds) {
      this.binds = binds;
    }

    @Override
    public String visit(ColumnCondition c) {
      String col = quoteIdent(c.column());
      Operator op = c.operator();
      if (op.isUnary()) return col + " " + op.symbol();
      if (op == Operator.IN || op == Operator.NOT_IN) {
        if (!(c.value() instanceof ConditionValue.ListValue list)) {
          throw new IllegalArgumentException(op.symbol() + " requires a list value for " + c.column());
        }
        List<Object> values = new ArrayList<>();
        for (ConditionValue v : list.values()) values.add(v.accept(BIND_VALUE));
        return inList(col, op == Operator.NOT_IN, values, binds);
      }
      if (c.value() == ConditionValue.NullValue.INSTANCE) {
        if (op == Operator.EQ) return col + " IS NULL";
        if (op == Operator.NE) return col + " IS NOT NULL";
      }
      binds.add(c.value().accept(BIND_VALUE));
      return col + " " + op.symbol() + " ?";
    }

    @Override
    public String visit(FunctionCondition f) {
      requireFunctionName(f.function());
      List<String> args = new ArrayList<>(f.args().size());
      for (int i = 0; i < f.args().size(); i++) {
        Object a = f.args().get(i);
        args.add(i == 0 ? quoteIdent(String.valueOf(a)) : literal(a));
      }
      binds.add(f.value().accept(BIND_VALUE));
      return f.function() + "(" + String.join(", ", args) + ") " + f.operator().symbol() + " ?";
    }

    private static String literal(Object a) {
      if (a == null) return "NULL";
      if (a instanceof Boolean b) return b ? "1" : "0";
      if (a instanceof Number n) return n.toString();
      String s = String.valueOf(a);
      // already quoted by the membership rewrite
      if (s.length() >= 2 && s.startsWith("'") && s.endsWith("'")) return s;
      return quoteLiteral(s);
    }
  }

  private static final ConditionValue.ValueVisitor<Object> BIND_VALUE = new ConditionValue.ValueVisitor<>() {
    @Override public Object visitBool(ConditionValue.BoolValue v) { return v.value() ? 1 : 0; }
    @Override public Object visitNumber(ConditionValue.NumberValue v) { return v.value(); }
    @Override public Object visitString(ConditionValue.StringValue v) { return v.value(); }
    @Override public Object visitList(ConditionValue.ListValue v) {
      throw new IllegalArgumentException("List values are only valid with IN / NOT IN");
    }
    @Override public Object visitNull() { return null; }
  };
}
