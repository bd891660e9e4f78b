package io.rowstream.stream.jdbc;

import io.rowstream.stream.error.CursorRegressionException;
import io.rowstream.stream.error.InvalidCursorStateException;
import io.rowstream.stream.error.StorageErrorClassifier;
import io.rowstream.stream.loop.CursorStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

/**
 * Per consumer checkpoints that only move forward.
 * <p>
 * {@link #advance(String, String)} first runs an update guarded by {@code cursor < new}. When no
 * row matches it inserts one; a duplicate key on that insert means the row exists with a cursor
 * that is already at or past the new value.
 * <p>
 * The guard relies on the driver reporting matched rather than changed rows, which is the MySQL
 * default. Engines that report zero rows for a no-op update need a transaction with a locking read
 * instead.
 */
public final class JdbcCursorStore implements CursorStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcCursorStore.class);

  private final JdbcTemplate jdbc;
  private final CursorSchema schema;
  private final StorageErrorClassifier classifier;
  private final String selectSql;
  private final String updateSql;
  private final String insertSql;
  private final ResultSetExtractor<String> firstCursor = rs -> rs.next() ? rs.getString(1) : null;

  public JdbcCursorStore(JdbcTemplate jdbc, CursorSchema schema, StorageErrorClassifier classifier) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.selectSql = "SELECT " + schema.cursorField() + " FROM " + schema.tableName()
        + " WHERE " + schema.idField() + "=?";
    this.updateSql = "UPDATE " + schema.tableName() + " SET " + schema.cursorField() + "=?, "
        + schema.timeField() + "=NOW(6) WHERE " + schema.idField() + "=? AND "
        + schema.cursorField() + "<?";
    this.insertSql = "INSERT INTO " + schema.tableName() + " SET " + schema.idField() + "=?, "
        + schema.cursorField() + "=?, " + schema.timeField() + "=NOW(6)";
  }

  public CursorSchema schema() {
    return schema;
  }

  /**
   * The stored cursor, or the zero value of the cursor type when none has been stored.
   */
  @Override
  public String get(String consumerId) {
    requireConsumer(consumerId);
    try {
      String cursor = jdbc.query(selectSql, firstCursor, consumerId);
      return cursor == null ? schema.cursorType().zeroValue() : cursor;
    } catch (DataAccessException e) {
      throw StorageErrors.translate(classifier, e, "get cursor", consumerId, null);
    }
  }

  /**
   * Moves the cursor of {@code consumerId} forward to {@code cursor}.
   *
   * @throws CursorRegressionException if the stored cursor is already at or past {@code cursor}
   * @throws InvalidCursorStateException if the guarded update touched more than one row
   * @throws IllegalArgumentException if {@code cursor} does not fit the cursor type
   */
  @Override
  public void advance(String consumerId, String cursor) {
    requireConsumer(consumerId);
    Object value = schema.cursorType().cast(cursor);
    int rows;
    try {
      rows = jdbc.update(updateSql, value, consumerId, value);
    } catch (DataAccessException e) {
      throw StorageErrors.translate(classifier, e, "advance cursor", consumerId, cursor);
    }
    if (rows == 1) {
      return;
    }
    if (rows > 1) {
      throw new InvalidCursorStateException(consumerId, cursor, rows);
    }
    try {
      jdbc.update(insertSql, consumerId, value);
    } catch (DataAccessException e) {
      if (classifier.isDuplicateKey(e)) {
        log.debug("Cursor of {} not advanced to {}: already at or past it", consumerId, cursor);
        throw new CursorRegressionException(consumerId, cursor, e);
      }
      throw StorageErrors.translate(classifier, e, "advance cursor", consumerId, cursor);
    }
  }

  /**
   * {@code false} for {@link CursorType#STRING}, where {@code "9"} sorts after {@code "10"}.
   */
  @Override
  public boolean comparesNumerically() {
    return schema.cursorType() == CursorType.NUMERIC;
  }

  String selectSql() {
    return selectSql;
  }

  String updateSql() {
    return updateSql;
  }

  String insertSql() {
    return insertSql;
  }

  private static void requireConsumer(String consumerId) {
    if (consumerId == null || consumerId.isBlank()) {
      throw new IllegalArgumentException("consumerId must not be blank");
    }
  }
}
