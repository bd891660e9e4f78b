package io.rowstream.stream.jdbc;

/**
 * SQL representation of a cursor column.
 * <p>
 * The cast value is what gets bound into the guarded update, so the database compares numeric
 * cursors as numbers ({@code 10 > 9}) rather than as strings.
 */
public enum CursorType {

  NUMERIC("0") {
    @Override
    public Object cast(String cursor) {
      if (cursor == null || cursor.isBlank()) {
        throw new IllegalArgumentException("numeric cursor must not be blank");
      }
      try {
        return Long.parseLong(cursor.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("cursor is not numeric: " + cursor, e);
      }
    }
  },

  STRING("") {
    @Override
    public Object cast(String cursor) {
      if (cursor == null) {
        throw new IllegalArgumentException("cursor must not be null");
      }
      return cursor;
    }
  };

  private final String zeroValue;

  CursorType(String zeroValue) {
    this.zeroValue = zeroValue;
  }

  /**
   * Converts {@code cursor} into the value bound for comparisons.
   *
   * @throws IllegalArgumentException if {@code cursor} has no representation in this type
   */
  public abstract Object cast(String cursor);

  /**
   * Cursor reported for consumers that have not checkpointed yet.
   */
  public String zeroValue() {
    return zeroValue;
  }
}
