package io.rowstream.stream.jdbc;

import io.rowstream.stream.api.EventType;
import io.rowstream.stream.api.StreamEvent;
import io.rowstream.stream.error.StorageErrorClassifier;
import io.rowstream.stream.loop.EventNotifier;
import io.rowstream.stream.loop.EventSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Append-only event log backed by a single table with an auto-incremented id.
 * <p>
 * Readers page through the table by id, so ids must be assigned in commit order for readers not to
 * skip rows. {@link #nextBatch(long, Duration)} can hide recently written rows to tolerate writers
 * that commit out of order.
 */
public final class JdbcEventLog implements EventSource {

  public static final int BATCH_SIZE = 1000;

  private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

  private final JdbcTemplate jdbc;
  private final EventLogSchema schema;
  private final StorageErrorClassifier classifier;
  private final EventInserter inserter;
  private final EventNotifier notifier;
  private final RowMapper<StreamEvent> rowMapper = JdbcEventLog::mapRow;

  public JdbcEventLog(JdbcTemplate jdbc, EventLogSchema schema, StorageErrorClassifier classifier) {
    this(jdbc, schema, classifier, EventInserter.forSchema(schema), null);
  }

  public JdbcEventLog(JdbcTemplate jdbc, EventLogSchema schema, StorageErrorClassifier classifier,
      EventInserter inserter, EventNotifier notifier) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.inserter = Objects.requireNonNull(inserter, "inserter");
    this.notifier = notifier;
  }

  public EventLogSchema schema() {
    return schema;
  }

  public void insert(String foreignId, EventType type) {
    insert(foreignId, type, null);
  }

  /**
   * Appends one event. Empty metadata is the same as none.
   *
   * @throws io.rowstream.stream.error.MetadataDisabledException if metadata is given and the schema
   *     has no metadata column
   * @throws io.rowstream.stream.error.StreamStorageException if the write fails
   */
  public void insert(String foreignId, EventType type, byte[] metadata) {
    Objects.requireNonNull(foreignId, "foreignId");
    Objects.requireNonNull(type, "type");
    try {
      inserter.insert(jdbc, foreignId, type, metadata);
    } catch (DataAccessException e) {
      throw StorageErrors.translate(classifier, e, "insert event", null, null);
    }
    if (notifier != null) {
      notifier.notifyInserted();
    }
  }

  @Override
  public long latestId() {
    try {
      Long max = jdbc.queryForObject("SELECT MAX(id) FROM " + schema.tableName(), Long.class);
      return max == null ? 0L : max;
    } catch (DataAccessException e) {
      throw StorageErrors.translate(classifier, e, "latest id", null, null);
    }
  }

  @Override
  public List<StreamEvent> nextBatch(long afterId, Duration maxLag) {
    boolean withLag = maxLag != null && !maxLag.isNegative() && !maxLag.isZero();
    try {
      List<StreamEvent> events;
      if (withLag) {
        events = jdbc.query(nextBatchSql(true), rowMapper, afterId, toMicros(maxLag));
      } else {
        events = jdbc.query(nextBatchSql(false), rowMapper, afterId);
      }
      if (log.isTraceEnabled()) {
        log.trace("Read {} events from {} after id {}", events.size(), schema.tableName(), afterId);
      }
      return events;
    } catch (DataAccessException e) {
      throw StorageErrors.translate(classifier, e, "next batch", null, Long.toString(afterId));
    }
  }

  String nextBatchSql(boolean withLag) {
    StringBuilder sql = new StringBuilder("SELECT id, ")
        .append(schema.foreignIdField()).append(", ")
        .append(schema.timeField()).append(", ")
        .append(schema.typeField()).append(", ")
        .append(schema.metadataEnabled() ? schema.metadataField() : "NULL")
        .append(" FROM ").append(schema.tableName())
        .append(" WHERE id > ?");
    if (withLag) {
      sql.append(" AND ").append(schema.timeField()).append(" < NOW(6) - INTERVAL ? MICROSECOND");
    }
    return sql.append(" ORDER BY id ASC LIMIT ").append(BATCH_SIZE).toString();
  }

  static long toMicros(Duration duration) {
    return duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000;
  }

  // Columns are positional: id, foreign id, timestamp, type, metadata.
  static StreamEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
    long id = rs.getLong(1);
    if (rs.wasNull() || id <= 0) {
      throw new SQLException("malformed event row " + rowNum + ": invalid id");
    }
    String foreignId = rs.getString(2);
    Timestamp timestamp = rs.getTimestamp(3);
    if (timestamp == null) {
      throw new SQLException("malformed event row " + rowNum + ": missing timestamp for id " + id);
    }
    int type = rs.getInt(4);
    if (rs.wasNull()) {
      throw new SQLException("malformed event row " + rowNum + ": missing type for id " + id);
    }
    byte[] metadata = rs.getBytes(5);
    return new StreamEvent(Long.toString(id), foreignId == null ? "" : foreignId, EventType.of(type),
        timestamp.toInstant(), metadata);
  }
}
