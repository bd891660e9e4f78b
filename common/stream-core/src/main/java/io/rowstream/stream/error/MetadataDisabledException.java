package io.rowstream.stream.error;

/**
 * An insert supplied metadata but the event table has no metadata column.
 */
public class MetadataDisabledException extends StreamStorageException {

    public MetadataDisabledException(String table) {
        super("metadata not enabled for table " + table, "insert event", null, null, null);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
