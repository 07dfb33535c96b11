package io.intellixity.discover.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raised when a discover request fails validation.
 * <p>
 * Carries every field-level message collected for the request, keyed by request field name.
 */
public final class QueryValidationException extends RuntimeException {
  public static final String NON_FIELD_ERRORS = "non_field_errors";

  private final Map<String, List<String>> errors;

  public QueryValidationException(Map<String, List<String>> errors) {
    super(describe(errors));
    this.errors = copy(errors);
  }

  public static QueryValidationException forField(String field, String message) {
    return new QueryValidationException(Map.of(field, List.of(message)));
  }

  public Map<String, List<String>> errors() { return errors; }

  public List<String> errorsFor(String field) {
    return errors.getOrDefault(field, List.of());
  }

  private static Map<String, List<String>> copy(Map<String, List<String>> in) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    if (in != null) {
      for (var e : in.entrySet()) out.put(e.getKey(), List.copyOf(new ArrayList<>(e.getValue())));
    }
    return Collections.unmodifiableMap(out);
  }

  private static String describe(Map<String, List<String>> errors) {
    if (errors == null || errors.isEmpty()) return "Invalid discover query";
    StringBuilder sb = new StringBuilder("Invalid discover query:");
    for (var e : errors.entrySet()) {
      sb.append(' ').append(e.getKey()).append('=').append(e.getValue());
    }
    return sb.toString();
  }
}
