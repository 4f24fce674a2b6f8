package net.haproxy.dataplane.client.document;

import net.haproxy.dataplane.abstractions.data.ApiVersion;
import net.haproxy.dataplane.abstractions.data.Constants;

import com.google.common.base.Preconditions;

/**
 * Tunables of the client. Defaults match what the Data Plane API expects from a well behaved client.
 */
public class DataPlaneConvention {

  private ApiVersion apiVersion = ApiVersion.V3;

  private boolean insecure;

  private int maxAttempts = Constants.DEFAULT_MAX_ATTEMPTS;

  private long retryDelayMillis = Constants.DEFAULT_RETRY_DELAY_MILLIS;

  private int requestTimeoutMillis = Constants.DEFAULT_REQUEST_TIMEOUT_MILLIS;

  private int maxConnectionsPerRoute = 10;

  public ApiVersion getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(ApiVersion apiVersion) {
    this.apiVersion = Preconditions.checkNotNull(apiVersion, "apiVersion");
  }

  /**
   * @return true when TLS certificates of the API are not verified
   */
  public boolean isInsecure() {
    return insecure;
  }

  public void setInsecure(boolean insecure) {
    this.insecure = insecure;
  }

  /**
   * Upper bound of attempts of a transactional operation, the first one included.
   */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
    this.maxAttempts = maxAttempts;
  }

  /**
   * Fixed delay between attempts.
   */
  public long getRetryDelayMillis() {
    return retryDelayMillis;
  }

  public void setRetryDelayMillis(long retryDelayMillis) {
    Preconditions.checkArgument(retryDelayMillis >= 0, "retryDelayMillis can not be negative");
    this.retryDelayMillis = retryDelayMillis;
  }

  public int getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  public void setRequestTimeoutMillis(int requestTimeoutMillis) {
    this.requestTimeoutMillis = requestTimeoutMillis;
  }

  public int getMaxConnectionsPerRoute() {
    return maxConnectionsPerRoute;
  }

  public void setMaxConnectionsPerRoute(int maxConnectionsPerRoute) {
    this.maxConnectionsPerRoute = maxConnectionsPerRoute;
  }

}
