package io.rowstream.stream.jdbc;

import io.rowstream.stream.error.StorageErrorClassifier;
import java.util.Set;

/**
 * Classifies errors by standard SQLSTATE, for drivers other than MySQL.
 */
public final class SqlStateErrorClassifier implements StorageErrorClassifier {

  public static final String UNIQUE_VIOLATION = "23505";
  public static final String READ_ONLY_TRANSACTION = "25006";
  public static final String INSUFFICIENT_PRIVILEGE = "42501";

  private static final Set<String> WRITE_REJECTED = Set.of(READ_ONLY_TRANSACTION, INSUFFICIENT_PRIVILEGE);

  @Override
  public boolean isWriteRejected(Throwable error) {
    return SqlErrors.anySqlException(error, e -> e.getSQLState() != null && WRITE_REJECTED.contains(e.getSQLState()));
  }

  @Override
  public boolean isDuplicateKey(Throwable error) {
    return SqlErrors.anySqlException(error, e -> UNIQUE_VIOLATION.equals(e.getSQLState()));
  }
}
