package io.rowstream.stream.jdbc;

import java.util.Objects;

/**
 * Table and column names of a cursor table, plus how cursor values compare.
 * <p>
 * {@code idField} must carry a unique key: the guarded update relies on it to touch at most one row.
 */
public final class CursorSchema {

  public static final String DEFAULT_ID_FIELD = "id";
  public static final String DEFAULT_CURSOR_FIELD = "last_event_id";
  public static final String DEFAULT_TIME_FIELD = "updated_at";

  private final String tableName;
  private final String idField;
  private final String cursorField;
  private final String timeField;
  private final CursorType cursorType;

  private CursorSchema(Builder builder) {
    this.tableName = SqlNames.require(builder.tableName, "tableName");
    this.idField = SqlNames.require(builder.idField, "idField");
    this.cursorField = SqlNames.require(builder.cursorField, "cursorField");
    this.timeField = SqlNames.require(builder.timeField, "timeField");
    this.cursorType = Objects.requireNonNull(builder.cursorType, "cursorType");
  }

  public static Builder builder(String tableName) {
    return new Builder(tableName);
  }

  public static CursorSchema of(String tableName) {
    return builder(tableName).build();
  }

  public String tableName() {
    return tableName;
  }

  public String idField() {
    return idField;
  }

  public String cursorField() {
    return cursorField;
  }

  public String timeField() {
    return timeField;
  }

  public CursorType cursorType() {
    return cursorType;
  }

  @Override
  public String toString() {
    return "CursorSchema[" + tableName + ", " + cursorField + " " + cursorType + "]";
  }

  public static final class Builder {

    private final String tableName;
    private String idField = DEFAULT_ID_FIELD;
    private String cursorField = DEFAULT_CURSOR_FIELD;
    private String timeField = DEFAULT_TIME_FIELD;
    private CursorType cursorType = CursorType.NUMERIC;

    private Builder(String tableName) {
      this.tableName = tableName;
    }

    public Builder idField(String idField) {
      this.idField = idField;
      return this;
    }

    public Builder cursorField(String cursorField) {
      this.cursorField = cursorField;
      return this;
    }

    public Builder timeField(String timeField) {
      this.timeField = timeField;
      return this;
    }

    public Builder cursorType(CursorType cursorType) {
      this.cursorType = cursorType;
      return this;
    }

    public CursorSchema build() {
      return new CursorSchema(this);
    }
  }
}
