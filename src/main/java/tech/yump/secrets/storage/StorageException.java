package tech.yump.secrets.storage;

/**
 * Runtime exception for errors raised by a {@link SecretRepository} implementation.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
