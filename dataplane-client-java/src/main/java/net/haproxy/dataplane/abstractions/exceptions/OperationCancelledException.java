package net.haproxy.dataplane.abstractions.exceptions;

/**
 * The caller cancelled the operation through its cancellation token, or the waiting thread was
 * interrupted. Never retried.
 */
public class OperationCancelledException extends RuntimeException {

  public OperationCancelledException(String message) {
    super(message);
  }

  public OperationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }

}
