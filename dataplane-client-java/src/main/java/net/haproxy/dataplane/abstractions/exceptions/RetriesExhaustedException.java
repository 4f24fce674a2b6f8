package net.haproxy.dataplane.abstractions.exceptions;

/**
 * Every attempt of a transactional operation failed with a retryable error.
 * The cause is the error of the last attempt.
 */
public class RetriesExhaustedException extends RuntimeException {

  private final int attempts;

  public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
    super(String.format("%s failed after %d attempts: %s", operation, attempts, lastError.getMessage()), lastError);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }

}
