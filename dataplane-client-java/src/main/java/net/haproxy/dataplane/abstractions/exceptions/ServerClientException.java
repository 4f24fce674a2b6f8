package net.haproxy.dataplane.abstractions.exceptions;

/**
 * Failure to reach the Data Plane API or to (de)serialize what was exchanged with it.
 * API answers with an error status are reported as {@link HttpOperationException} instead.
 */
public class ServerClientException extends RuntimeException {

  public ServerClientException(String message) {
    super(message);
  }

  public ServerClientException(String message, Throwable cause) {
    super(message, cause);
  }

}
