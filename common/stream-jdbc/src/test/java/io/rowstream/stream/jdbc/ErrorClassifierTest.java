package io.rowstream.stream.jdbc;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

class ErrorClassifierTest {

  private final MySqlErrorClassifier mysql = new MySqlErrorClassifier();
  private final SqlStateErrorClassifier sqlState = new SqlStateErrorClassifier();

  @Test
  void mysqlRecognisesReadOnlyAndAccessDenied() {
    assertThat(mysql.isWriteRejected(new SQLException("read-only", "HY000", 1290))).isTrue();
    assertThat(mysql.isWriteRejected(new SQLException("denied", "42000", 1142))).isTrue();
    assertThat(mysql.isWriteRejected(new SQLException("denied", "42000", 1143))).isTrue();
    assertThat(mysql.isWriteRejected(new SQLException("denied", "42000", 1370))).isTrue();
    assertThat(mysql.isWriteRejected(new SQLException("deadlock", "40001", 1213))).isFalse();
  }

  @Test
  void mysqlFindsDuplicateKeyBehindWrappers() {
    SQLException duplicate = new SQLException("Duplicate entry 'a' for key 'PRIMARY'", "23000", 1062);
    RuntimeException wrapped = new RuntimeException(new DuplicateKeyException("dup", duplicate));

    assertThat(mysql.isDuplicateKey(wrapped)).isTrue();
    assertThat(mysql.isWriteRejected(wrapped)).isFalse();
  }

  @Test
  void sqlStateClassifierUsesStandardCodes() {
    assertThat(sqlState.isDuplicateKey(new SQLException("dup", "23505"))).isTrue();
    assertThat(sqlState.isWriteRejected(new SQLException("ro", "25006"))).isTrue();
    assertThat(sqlState.isWriteRejected(new SQLException("perm", "42501"))).isTrue();
    assertThat(sqlState.isWriteRejected(new SQLException("no state"))).isFalse();
  }

  @Test
  void unrelatedErrorsAndNullAreNotClassified() {
    assertThat(mysql.isDuplicateKey(null)).isFalse();
    assertThat(mysql.isWriteRejected(new IllegalStateException("x"))).isFalse();
    assertThat(sqlState.isDuplicateKey(null)).isFalse();
    assertThat(sqlState.isDuplicateKey(new IllegalStateException("x"))).isFalse();
  }

  @Test
  void selfReferencingCauseChainTerminates() {
    SelfCaused error = new SelfCaused();

    assertThat(mysql.isDuplicateKey(error)).isFalse();
  }

  private static final class SelfCaused extends RuntimeException {
    @Override
    public synchronized Throwable getCause() {
      return this;
    }
  }
}
