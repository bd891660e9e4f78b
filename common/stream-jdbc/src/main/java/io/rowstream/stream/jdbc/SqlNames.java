package io.rowstream.stream.jdbc;

import java.util.regex.Pattern;

final class SqlNames {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private SqlNames() {
  }

  // Names are concatenated into statements, so only plain identifiers are accepted.
  static String require(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    String trimmed = value.trim();
    if (!IDENTIFIER.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(field + " is not a valid SQL identifier: " + value);
    }
    return trimmed;
  }

  static String optional(String value, String field) {
    if (value == null || value.isBlank()) {
      return "";
    }
    return require(value, field);
  }
}
