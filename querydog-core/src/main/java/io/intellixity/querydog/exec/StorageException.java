package io.intellixity.querydog.exec;

/** A statement failed inside the storage backend. The message is the backend's own. */
public final class StorageException extends RuntimeException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
