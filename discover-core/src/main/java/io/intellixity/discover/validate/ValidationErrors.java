package io.intellixity.discover.validate;

import io.intellixity.discover.query.QueryValidationException;

import java.util.*;
import java.util.function.Supplier;

/** Accumulates field-level messages across validation steps. Not thread-safe; one per request. */
public final class ValidationErrors {
  private final Map<String, List<String>> errors = new LinkedHashMap<>();

  public ValidationErrors add(String field, String message) {
    List<String> messages = errors.computeIfAbsent(field, k -> new ArrayList<>());
    if (!messages.contains(message)) messages.add(message);
    return this;
  }

  public ValidationErrors addAll(Map<String, List<String>> more) {
    if (more == null) return this;
    for (var e : more.entrySet()) {
      for (String m : e.getValue()) add(e.getKey(), m);
    }
    return this;
  }

  public boolean has(String field) {
    return errors.containsKey(field);
  }

  public boolean isEmpty() {
    return errors.isEmpty();
  }

  /**
   * Runs a validation step; a {@link QueryValidationException} it raises is recorded and null is returned.
   */
  public <T> T collect(Supplier<T> step) {
    try {
      return step.get();
    } catch (QueryValidationException e) {
      addAll(e.errors());
      return null;
    }
  }

  public void check(Runnable step) {
    collect(() -> {
      step.run();
      return null;
    });
  }

  public void throwIfAny() {
    if (!errors.isEmpty()) throw new QueryValidationException(errors);
  }
}
