package net.haproxy.dataplane.client.transaction;

import net.haproxy.dataplane.client.utils.CancellationTokenSource.CancellationToken;

/**
 * Waits between attempts of a transactional operation.
 */
public interface Sleeper {

  /**
   * Blocks for the given time. Returns early when the token gets cancelled.
   * @param token may be null
   */
  public void sleep(long millis, CancellationToken token) throws InterruptedException;

  public static final Sleeper THREAD_SLEEPER = new Sleeper() {
    @Override
    public void sleep(long millis, CancellationToken token) throws InterruptedException {
      if (millis <= 0) {
        return;
      }
      if (token != null) {
        token.await(millis);
      } else {
        Thread.sleep(millis);
      }
    }
  };
}
