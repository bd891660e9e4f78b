package io.rowstream.stream.jdbc;

import io.rowstream.stream.error.StorageErrorClassifier;
import java.util.Set;

/**
 * Classifies MySQL server errors by vendor error code.
 */
public final class MySqlErrorClassifier implements StorageErrorClassifier {

  /** ER_DUP_ENTRY. */
  public static final int DUPLICATE_ENTRY = 1062;
  /** ER_OPTION_PREVENTS_STATEMENT, raised under {@code read_only}. */
  public static final int OPTION_PREVENTS_STATEMENT = 1290;
  public static final int TABLE_ACCESS_DENIED = 1142;
  public static final int COLUMN_ACCESS_DENIED = 1143;
  public static final int PROCEDURE_ACCESS_DENIED = 1370;

  private static final Set<Integer> WRITE_REJECTED = Set.of(
      OPTION_PREVENTS_STATEMENT, TABLE_ACCESS_DENIED, COLUMN_ACCESS_DENIED, PROCEDURE_ACCESS_DENIED);

  @Override
  public boolean isWriteRejected(Throwable error) {
    return SqlErrors.anySqlException(error, e -> WRITE_REJECTED.contains(e.getErrorCode()));
  }

  @Override
  public boolean isDuplicateKey(Throwable error) {
    return SqlErrors.anySqlException(error, e -> e.getErrorCode() == DUPLICATE_ENTRY);
  }
}
