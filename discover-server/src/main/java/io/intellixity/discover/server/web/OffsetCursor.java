package io.intellixity.discover.server.web;

/**
 * Offset pagination cursor, wire form {@code value:offset:isPrev} (e.g. {@code 0:100:0}).
 * Only the offset is meaningful for offset pagination; the other parts are carried for clients.
 */
public record OffsetCursor(long value, int offset, boolean previous) {
  static final String INVALID = "Invalid cursor parameter.";

  public OffsetCursor {
    if (offset < 0) throw new InvalidPageRequestException(INVALID);
  }

  public static OffsetCursor first() {
    return new OffsetCursor(0, 0, false);
  }

  public static OffsetCursor parse(String raw) {
    if (raw == null || raw.isBlank()) return first();
    String[] parts = raw.trim().split(":", -1);
    if (parts.length != 3) throw new InvalidPageRequestException(INVALID);
    try {
      long value = Long.parseLong(parts[0]);
      int offset = Integer.parseInt(parts[1]);
      int prev = Integer.parseInt(parts[2]);
      return new OffsetCursor(value, offset, prev != 0);
    } catch (NumberFormatException e) {
      throw new InvalidPageRequestException(INVALID);
    }
  }

  public static OffsetCursor next(int offset, int pageSize) {
    return new OffsetCursor(0, offset + pageSize, false);
  }

  public static OffsetCursor previous(int offset, int pageSize) {
    return new OffsetCursor(0, Math.max(0, offset - pageSize), true);
  }

  @Override
  public String toString() {
    return value + ":" + offset + ":" + (previous ? 1 : 0);
  }
}
