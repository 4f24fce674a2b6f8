package net.haproxy.dataplane.client.connection.profiling;

public enum RequestStatus {
  /**
   * A response came back, whatever its status code
   */
  COMPLETED,
  /**
   * The server could not be reached or the exchange broke off
   */
  FAILED_TO_CONNECT,
  /**
   * The caller's cancellation token aborted the exchange
   */
  CANCELLED;
}
