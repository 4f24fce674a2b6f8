package net.haproxy.dataplane.abstractions.exceptions;

/**
 * A single step of a bundle operation failed. The cause is the original failure.
 */
public class BundleOperationException extends RuntimeException {

  private final String step;

  public BundleOperationException(String step, Throwable cause) {
    super(step + " failed: " + cause.getMessage(), cause);
    this.step = step;
  }

  /**
   * @return description of the failed step, e.g. "ACL 2 (is_api) creation"
   */
  public String getStep() {
    return step;
  }

}
