package net.haproxy.dataplane.client.connection.profiling;

/**
 * Notified after every Data Plane API request, on the thread that issued it.
 */
public interface RequestListener {
  public void requestCompleted(RequestResultArgs result);
}
