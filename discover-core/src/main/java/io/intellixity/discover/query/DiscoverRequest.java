package io.intellixity.discover.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.*;

/**
 * Untrusted discover request as decoded from the wire.
 * <p>
 * Values are typed but not validated. {@link #parseErrors()} holds field-level decoding errors
 * (wrong JSON types) so that they are reported together with semantic ones.
 */
@JsonDeserialize(using = DiscoverRequestJsonDeserializer.class)
public final class DiscoverRequest {
  private List<Long> projects;
  private Instant start;
  private Instant end;
  private String range;
  private List<String> fields;
  private Integer limit;
  private Integer rollup;
  private String orderby;
  private List<List<Object>> conditions;
  private List<List<Object>> aggregations;
  private List<String> groupby;
  private Boolean turbo;
  private final Map<String, List<String>> parseErrors = new LinkedHashMap<>();

  public DiscoverRequest() {}

  public List<Long> projects() { return projects; }
  public Instant start() { return start; }
  public Instant end() { return end; }
  public String range() { return range; }
  public List<String> fields() { return fields; }
  public Integer limit() { return limit; }
  public Integer rollup() { return rollup; }
  public String orderby() { return orderby; }
  public List<List<Object>> conditions() { return conditions; }
  public List<List<Object>> aggregations() { return aggregations; }
  public List<String> groupby() { return groupby; }
  public Boolean turbo() { return turbo; }
  public Map<String, List<String>> parseErrors() { return Collections.unmodifiableMap(parseErrors); }

  public DiscoverRequest withProjects(List<Long> projects) { this.projects = copyOrNull(projects); return this; }
  public DiscoverRequest withProjects(Long... projects) { return withProjects(Arrays.asList(projects)); }
  public DiscoverRequest withStart(Instant start) { this.start = start; return this; }
  public DiscoverRequest withEnd(Instant end) { this.end = end; return this; }
  public DiscoverRequest withRange(String range) { this.range = range; return this; }
  public DiscoverRequest withFields(List<String> fields) { this.fields = copyOrNull(fields); return this; }
  public DiscoverRequest withFields(String... fields) { return withFields(Arrays.asList(fields)); }
  public DiscoverRequest withLimit(Integer limit) { this.limit = limit; return this; }
  public DiscoverRequest withRollup(Integer rollup) { this.rollup = rollup; return this; }
  public DiscoverRequest withOrderby(String orderby) { this.orderby = orderby; return this; }
  public DiscoverRequest withConditions(List<List<Object>> conditions) { this.conditions = copyOrNull(conditions); return this; }
  public DiscoverRequest withAggregations(List<List<Object>> aggregations) { this.aggregations = copyOrNull(aggregations); return this; }
  public DiscoverRequest withGroupby(List<String> groupby) { this.groupby = copyOrNull(groupby); return this; }
  public DiscoverRequest withGroupby(String... groupby) { return withGroupby(Arrays.asList(groupby)); }
  public DiscoverRequest withTurbo(Boolean turbo) { this.turbo = turbo; return this; }

  /** Convenience for building a condition/aggregation row: {@code row("error.type", "=", "ValueError")}. */
  public static List<Object> row(Object... values) {
    return new ArrayList<>(Arrays.asList(values));
  }

  DiscoverRequest addParseError(String field, String message) {
    parseErrors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    return this;
  }

  private static <T> List<T> copyOrNull(List<T> in) {
    return in == null ? null : new ArrayList<>(in);
  }
}
