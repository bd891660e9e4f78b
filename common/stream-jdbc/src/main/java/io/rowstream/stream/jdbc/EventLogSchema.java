package io.rowstream.stream.jdbc;

/**
 * Table and column names of an event log.
 * <p>
 * The {@code id} column is fixed: an auto-incremented integer primary key. An empty
 * {@code metadataField} means the table has no metadata column and inserts carrying metadata are
 * rejected.
 */
public final class EventLogSchema {

  public static final String DEFAULT_FOREIGN_ID_FIELD = "foreign_id";
  public static final String DEFAULT_TIME_FIELD = "timestamp";
  public static final String DEFAULT_TYPE_FIELD = "type";

  private final String tableName;
  private final String foreignIdField;
  private final String timeField;
  private final String typeField;
  private final String metadataField;

  private EventLogSchema(Builder builder) {
    this.tableName = SqlNames.require(builder.tableName, "tableName");
    this.foreignIdField = SqlNames.require(builder.foreignIdField, "foreignIdField");
    this.timeField = SqlNames.require(builder.timeField, "timeField");
    this.typeField = SqlNames.require(builder.typeField, "typeField");
    this.metadataField = SqlNames.optional(builder.metadataField, "metadataField");
  }

  public static Builder builder(String tableName) {
    return new Builder(tableName);
  }

  public static EventLogSchema of(String tableName) {
    return builder(tableName).build();
  }

  public String tableName() {
    return tableName;
  }

  public String foreignIdField() {
    return foreignIdField;
  }

  public String timeField() {
    return timeField;
  }

  public String typeField() {
    return typeField;
  }

  public String metadataField() {
    return metadataField;
  }

  public boolean metadataEnabled() {
    return !metadataField.isEmpty();
  }

  @Override
  public String toString() {
    return "EventLogSchema[" + tableName + ", metadata=" + (metadataEnabled() ? metadataField : "disabled") + "]";
  }

  public static final class Builder {

    private final String tableName;
    private String foreignIdField = DEFAULT_FOREIGN_ID_FIELD;
    private String timeField = DEFAULT_TIME_FIELD;
    private String typeField = DEFAULT_TYPE_FIELD;
    private String metadataField = "";

    private Builder(String tableName) {
      this.tableName = tableName;
    }

    public Builder foreignIdField(String foreignIdField) {
      this.foreignIdField = foreignIdField;
      return this;
    }

    public Builder timeField(String timeField) {
      this.timeField = timeField;
      return this;
    }

    public Builder typeField(String typeField) {
      this.typeField = typeField;
      return this;
    }

    public Builder metadataField(String metadataField) {
      this.metadataField = metadataField;
      return this;
    }

    public EventLogSchema build() {
      return new EventLogSchema(this);
    }
  }
}
