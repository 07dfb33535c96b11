package io.intellixity.discover.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Lenient JSON deserializer for {@link DiscoverRequest}.
 * <p>
 * A field with the wrong JSON type does not abort decoding: the message is recorded in
 * {@link DiscoverRequest#parseErrors()} and the field is left unset. Unknown keys are ignored.
 */
public final class DiscoverRequestJsonDeserializer extends JsonDeserializer<DiscoverRequest> {
  static final String INVALID_INTEGER = "A valid integer is required.";
  static final String INVALID_STRING = "Not a valid string.";
  static final String INVALID_BOOLEAN = "Must be a valid boolean.";
  static final String INVALID_LIST = "Expected a list of items.";
  static final String INVALID_NESTED_LIST = "Expected a list of lists.";
  static final String INVALID_DATETIME =
      "Datetime has wrong format. Use one of these formats instead: YYYY-MM-DDThh:mm[:ss[.uuuuuu]][+HH:MM|-HH:MM|Z].";

  @Override
  public DiscoverRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull() || !root.isObject()) {
      throw QueryValidationException.forField(QueryValidationException.NON_FIELD_ERRORS,
          "Invalid data. Expected a dictionary.");
    }

    DiscoverRequest r = new DiscoverRequest();

    JsonNode projects = present(root, "projects");
    if (projects != null) {
      List<Long> ids = longList(projects);
      if (ids == null) r.addParseError("projects", projects.isArray() ? INVALID_INTEGER : INVALID_LIST);
      else r.withProjects(ids);
    }

    readInstant(root, "start", r);
    readInstant(root, "end", r);

    JsonNode range = present(root, "range");
    if (range != null) {
      if (range.isTextual()) r.withRange(range.asText());
      else r.addParseError("range", INVALID_STRING);
    }

    JsonNode fields = present(root, "fields");
    if (fields != null) {
      List<String> out = stringList(fields);
      if (out == null) r.addParseError("fields", INVALID_STRING);
      else r.withFields(out);
    }

    JsonNode groupby = present(root, "groupby");
    if (groupby != null) {
      List<String> out = stringList(groupby);
      if (out == null) r.addParseError("groupby", INVALID_STRING);
      else r.withGroupby(out);
    }

    JsonNode limit = present(root, "limit");
    if (limit != null) {
      Integer v = intOrNull(limit);
      if (v == null) r.addParseError("limit", INVALID_INTEGER);
      else r.withLimit(v);
    }

    JsonNode rollup = present(root, "rollup");
    if (rollup != null) {
      Integer v = intOrNull(rollup);
      if (v == null) r.addParseError("rollup", INVALID_INTEGER);
      else r.withRollup(v);
    }

    JsonNode orderby = present(root, "orderby");
    if (orderby != null) {
      if (orderby.isTextual()) r.withOrderby(orderby.asText());
      else r.addParseError("orderby", INVALID_STRING);
    }

    JsonNode conditions = present(root, "conditions");
    if (conditions != null) {
      List<List<Object>> rows = nestedList(conditions, codec);
      if (rows == null) r.addParseError("conditions", INVALID_NESTED_LIST);
      else r.withConditions(rows);
    }

    JsonNode aggregations = present(root, "aggregations");
    if (aggregations != null) {
      List<List<Object>> rows = nestedList(aggregations, codec);
      if (rows == null) r.addParseError("aggregations", INVALID_NESTED_LIST);
      else r.withAggregations(rows);
    }

    JsonNode turbo = present(root, "turbo");
    if (turbo != null) {
      if (turbo.isBoolean()) r.withTurbo(turbo.booleanValue());
      else r.addParseError("turbo", INVALID_BOOLEAN);
    }

    return r;
  }

  private static JsonNode present(JsonNode root, String key) {
    JsonNode n = root.get(key);
    return (n == null || n.isNull()) ? null : n;
  }

  private static void readInstant(JsonNode root, String key, DiscoverRequest r) {
    JsonNode n = present(root, key);
    if (n == null) return;
    Instant v = n.isTextual() ? instantOrNull(n.asText()) : null;
    if (v == null) {
      r.addParseError(key, INVALID_DATETIME);
      return;
    }
    if ("start".equals(key)) r.withStart(v);
    else r.withEnd(v);
  }

  /** ISO-8601 with offset or zone; a local date-time is read as UTC. */
  static Instant instantOrNull(String s) {
    if (s == null || s.isBlank()) return null;
    try {
      TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s.trim(),
          ZonedDateTime::from, LocalDateTime::from);
      if (t instanceof ZonedDateTime z) return z.toInstant();
      return ((LocalDateTime) t).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static Integer intOrNull(JsonNode n) {
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
    if (n.isTextual()) {
      try {
        return Integer.parseInt(n.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static List<Long> longList(JsonNode n) {
    if (!n.isArray()) return null;
    List<Long> out = new ArrayList<>();
    for (JsonNode x : n) {
      if (x.isIntegralNumber() && x.canConvertToLong()) {
        out.add(x.longValue());
      } else if (x.isTextual()) {
        try {
          out.add(Long.parseLong(x.asText().trim()));
        } catch (NumberFormatException e) {
          return null;
        }
      } else {
        return null;
      }
    }
    return out;
  }

  private static List<String> stringList(JsonNode n) {
    if (!n.isArray()) return null;
    List<String> out = new ArrayList<>();
    for (JsonNode x : n) {
      if (!x.isTextual()) return null;
      out.add(x.asText());
    }
    return out;
  }

  private static List<List<Object>> nestedList(JsonNode n, ObjectCodec codec) throws IOException {
    if (!n.isArray()) return null;
    List<List<Object>> out = new ArrayList<>();
    for (JsonNode row : n) {
      if (!row.isArray()) return null;
      List<Object> values = new ArrayList<>();
      for (JsonNode v : row) values.add(v.isNull() ? null : codec.treeToValue(v, Object.class));
      out.add(values);
    }
    return out;
  }
}
