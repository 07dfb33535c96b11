package io.intellixity.discover.server.web;

public final class InvalidPageRequestException extends RuntimeException {
  public InvalidPageRequestException(String message) {
    super(message);
  }
}
