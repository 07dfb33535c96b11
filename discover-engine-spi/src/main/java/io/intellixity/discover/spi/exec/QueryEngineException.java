package io.intellixity.discover.spi.exec;

/** The query engine failed or timed out. */
public final class QueryEngineException extends RuntimeException {
  public QueryEngineException(String message) {
    super(message);
  }

  public QueryEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
