package io.rowstream.stream.jdbc;

import io.rowstream.stream.error.StorageErrorClassifier;
import io.rowstream.stream.error.StreamStorageException;
import io.rowstream.stream.error.TransientStorageException;
import io.rowstream.stream.error.WriteRejectedException;
import org.springframework.dao.DataAccessException;

final class StorageErrors {

  private StorageErrors() {
  }

  static StreamStorageException translate(StorageErrorClassifier classifier, DataAccessException error,
      String operation, String consumerId, String cursor) {
    if (classifier.isWriteRejected(error)) {
      return new WriteRejectedException(operation, consumerId, cursor, error);
    }
    Throwable root = error.getMostSpecificCause();
    String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    return new TransientStorageException(message, operation, consumerId, cursor, error);
  }
}
