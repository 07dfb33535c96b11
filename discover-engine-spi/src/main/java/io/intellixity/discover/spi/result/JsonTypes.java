package io.intellixity.discover.spi.result;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Maps column-store type names to the JSON type vocabulary: boolean, integer, number, array, string. */
public final class JsonTypes {
  private JsonTypes() {}

  public static final String BOOLEAN = "boolean";
  public static final String INTEGER = "integer";
  public static final String NUMBER = "number";
  public static final String ARRAY = "array";
  public static final String STRING = "string";

  private static final Pattern NULLABLE = Pattern.compile("^Nullable\\((.+)\\)$");
  private static final Pattern ARRAY_TYPE = Pattern.compile("^Array\\(.+\\)$");

  private static final Map<String, String> SCALARS = Map.of(
      "UInt8", BOOLEAN,
      "UInt16", INTEGER,
      "UInt32", INTEGER,
      "UInt64", INTEGER,
      "Float32", NUMBER,
      "Float64", NUMBER
  );

  public static String of(String engineType) {
    if (engineType == null) return STRING;
    String type = engineType;
    Matcher nullable = NULLABLE.matcher(type);
    if (nullable.matches()) type = nullable.group(1);
    if (ARRAY_TYPE.matcher(type).matches()) return ARRAY;
    return SCALARS.getOrDefault(type, STRING);
  }
}
