package net.haproxy.dataplane.client.transaction;

import net.haproxy.dataplane.abstractions.data.Constants;
import net.haproxy.dataplane.client.document.DataPlaneConvention;

import com.google.common.base.Preconditions;

/**
 * Bounded number of attempts with a fixed delay between them.
 */
public class RetryPolicy {

  private final int maxAttempts;
  private final long delayMillis;

  public RetryPolicy(int maxAttempts, long delayMillis) {
    Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
    Preconditions.checkArgument(delayMillis >= 0, "delayMillis can not be negative");
    this.maxAttempts = maxAttempts;
    this.delayMillis = delayMillis;
  }

  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(Constants.DEFAULT_MAX_ATTEMPTS, Constants.DEFAULT_RETRY_DELAY_MILLIS);
  }

  public static RetryPolicy fromConvention(DataPlaneConvention convention) {
    return new RetryPolicy(convention.getMaxAttempts(), convention.getRetryDelayMillis());
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getDelayMillis() {
    return delayMillis;
  }

  @Override
  public String toString() {
    return "RetryPolicy [maxAttempts=" + maxAttempts + ", delayMillis=" + delayMillis + "]";
  }
}
