package io.rowstream.stream.jdbc;

import io.rowstream.stream.api.EventType;
import io.rowstream.stream.error.MetadataDisabledException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Writes one event row. The id is assigned by the table and the timestamp by the database clock.
 * <p>
 * Replace the default to add columns of your own, as long as the columns of the schema keep their
 * meaning.
 */
@FunctionalInterface
public interface EventInserter {

  void insert(JdbcTemplate jdbc, String foreignId, EventType type, byte[] metadata);

  /**
   * The standard single-row insert for {@code schema}. Metadata is rejected with
   * {@link MetadataDisabledException} before touching storage when the schema has no metadata
   * column.
   */
  static EventInserter forSchema(EventLogSchema schema) {
    Objects.requireNonNull(schema, "schema");
    return (jdbc, foreignId, type, metadata) -> {
      boolean withMetadata = metadata != null && metadata.length > 0;
      if (withMetadata && !schema.metadataEnabled()) {
        throw new MetadataDisabledException(schema.tableName());
      }
      List<Object> args = new ArrayList<>(3);
      args.add(foreignId);
      args.add(type.code());
      if (withMetadata) {
        args.add(metadata);
      }
      jdbc.update(insertSql(schema, withMetadata), args.toArray());
    };
  }

  static String insertSql(EventLogSchema schema, boolean withMetadata) {
    StringBuilder sql = new StringBuilder("INSERT INTO ")
        .append(schema.tableName())
        .append(" SET ").append(schema.foreignIdField()).append("=?, ")
        .append(schema.timeField()).append("=NOW(6), ")
        .append(schema.typeField()).append("=?");
    if (withMetadata) {
      sql.append(", ").append(schema.metadataField()).append("=?");
    }
    return sql.toString();
  }
}
